package org.pragmatica.sentinel.lint;

import io.vavr.control.Option;
import org.pragmatica.sentinel.fix.RuleFixer;
import org.pragmatica.sentinel.fix.ThrowInFinallyFixer;
import org.pragmatica.sentinel.rule.LintRule;
import org.pragmatica.sentinel.rule.rules.NestedCleanupRule;
import org.pragmatica.sentinel.rule.rules.ThrowInFinallyRule;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.vavr.control.Option.none;
import static io.vavr.control.Option.some;

/**
 * Registered rules keyed by rule id, in registration order.
 */
public final class RuleRegistry {
    private static final String USAGE = "Usage";
    private static final String DESIGN = "Design";

    public static final RuleDescriptor THROW_IN_FINALLY = new RuleDescriptor(
            ThrowInFinallyRule.RULE_ID,
            "Do not raise exceptions in finally regions",
            "Throwing ''{0}'' from a finally region hides the exception that is already propagating",
            "When an exception is raised in a finally region, the new exception replaces the active one "
            + "and the original failure is lost, which makes the real error hard to find.",
            USAGE,
            DiagnosticSeverity.WARNING,
            "https://learn.microsoft.com/dotnet/fundamentals/code-analysis/quality-rules/ca2219",
            true);

    public static final RuleDescriptor NESTED_CLEANUP = new RuleDescriptor(
            NestedCleanupRule.RULE_ID,
            "Avoid try/finally nested inside finally regions",
            "Nested cleanup region ''{0}'' inside a finally region; move it to a separate method",
            "Cleanup code that needs its own cleanup is hard to follow and easy to get wrong. "
            + "Extract it into a method with its own try/finally.",
            DESIGN,
            DiagnosticSeverity.INFO,
            "",
            true);

    private final Map<String, RuleRegistration> registrations;

    private RuleRegistry(Map<String, RuleRegistration> registrations) {
        this.registrations = registrations;
    }

    public static RuleRegistry ruleRegistry() {
        return new RuleRegistry(new LinkedHashMap<>());
    }

    /**
     * Registry with the built-in rules.
     */
    public static RuleRegistry defaultRegistry() {
        return ruleRegistry()
                .register(THROW_IN_FINALLY, new ThrowInFinallyRule(), some(new ThrowInFinallyFixer()))
                .register(NESTED_CLEANUP, NestedCleanupRule.nestedCleanupRule(), none());
    }

    /**
     * Register a rule. Registering the same id twice replaces the earlier registration.
     */
    public RuleRegistry register(RuleDescriptor descriptor, LintRule rule, Option<RuleFixer> fixer) {
        var copy = new LinkedHashMap<>(registrations);
        copy.put(descriptor.id(), new RuleRegistration(descriptor, rule, fixer));
        return new RuleRegistry(copy);
    }

    public Option<RuleRegistration> find(String ruleId) {
        return Option.of(registrations.get(ruleId));
    }

    public Collection<RuleRegistration> all() {
        return List.copyOf(registrations.values());
    }

    /**
     * Registrations the context allows to run.
     */
    public List<RuleRegistration> enabled(LintContext context) {
        return registrations.values()
                            .stream()
                            .filter(registration -> context.isRuleEnabled(registration.descriptor()))
                            .toList();
    }
}

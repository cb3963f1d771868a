package org.pragmatica.sentinel.lint;

import io.vavr.control.Option;
import org.pragmatica.sentinel.fix.RuleFixer;
import org.pragmatica.sentinel.rule.LintRule;

/// A rule together with its metadata and optional fixer.
public record RuleRegistration(RuleDescriptor descriptor, LintRule rule, Option<RuleFixer> fixer) {
    public RuleRegistration {
        if (!descriptor.id().equals(rule.ruleId())) {
            throw new IllegalArgumentException("Descriptor " + descriptor.id() + " does not match rule " + rule.ruleId());
        }
        fixer.peek(f -> {
            if (!f.ruleId().equals(rule.ruleId())) {
                throw new IllegalArgumentException("Fixer for " + f.ruleId() + " registered with rule " + rule.ruleId());
            }
        });
    }

    public String ruleId() {
        return descriptor.id();
    }
}

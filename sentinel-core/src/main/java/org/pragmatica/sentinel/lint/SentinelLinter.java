package org.pragmatica.sentinel.lint;

import io.vavr.control.Either;
import org.pragmatica.sentinel.shared.SentinelError;
import org.pragmatica.sentinel.engine.RuleEngine;
import org.pragmatica.sentinel.fix.FixError;
import org.pragmatica.sentinel.fix.RewritePlan;
import org.pragmatica.sentinel.fix.Rewriter;
import org.pragmatica.sentinel.frontend.JavaOperationTreeBuilder;
import org.pragmatica.sentinel.frontend.OperationBlock;
import org.pragmatica.sentinel.rule.Violation;
import org.pragmatica.sentinel.shared.SourceFile;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lint facade: Java source in, rendered diagnostics and fix proposals out.
 * <p>
 * Each operation block of a file is analyzed as its own tree. Rule metadata comes from the
 * {@link RuleRegistry}; the engine itself only sees the rule predicates.
 */
public final class SentinelLinter {
    private static final Logger log = LoggerFactory.getLogger(SentinelLinter.class);

    private final RuleRegistry registry;
    private final LintConfig config;
    private final JavaOperationTreeBuilder frontEnd;

    private SentinelLinter(RuleRegistry registry, LintConfig config) {
        this.registry = registry;
        this.config = config;
        this.frontEnd = JavaOperationTreeBuilder.javaOperationTreeBuilder();
    }

    /**
     * Factory method with built-in rules and default config.
     */
    public static SentinelLinter sentinelLinter() {
        return new SentinelLinter(RuleRegistry.defaultRegistry(), LintConfig.defaultConfig());
    }

    public static SentinelLinter sentinelLinter(LintConfig config) {
        return new SentinelLinter(RuleRegistry.defaultRegistry(), config);
    }

    public static SentinelLinter sentinelLinter(RuleRegistry registry, LintConfig config) {
        return new SentinelLinter(registry, config);
    }

    public LintConfig config() {
        return config;
    }

    /**
     * Lint one source file.
     *
     * @return diagnostics in source order of blocks and traversal order within a block
     */
    public Either<SentinelError, List<Diagnostic>> lint(SourceFile source) {
        var context = new LintContext(config, source.fileName());

        return findings(source, context).map(found -> found.stream()
                                                           .map(finding -> diagnostic(finding, context))
                                                           .toList());
    }

    /**
     * Lint one source file and ask each rule's fixer for a rewrite of every finding.
     * Fixes that cannot be produced are returned as {@link FixProposal.Skipped}.
     */
    public Either<SentinelError, List<FixProposal>> proposeFixes(SourceFile source) {
        var context = new LintContext(config, source.fileName());

        return findings(source, context).map(found -> found.stream()
                                                           .map(finding -> propose(finding, context))
                                                           .toList());
    }

    private Either<SentinelError, List<Finding>> findings(SourceFile source, LintContext context) {
        var registrations = registry.enabled(context);
        var engine = RuleEngine.ruleEngine(registrations.stream()
                                                        .map(RuleRegistration::rule)
                                                        .toList(),
                                           config.engine());

        return frontEnd.build(source)
                       .flatMap(blocks -> analyzeBlocks(engine, blocks));
    }

    private Either<SentinelError, List<Finding>> analyzeBlocks(RuleEngine engine, List<OperationBlock> blocks) {
        var found = new ArrayList<Finding>();

        for (var block : blocks) {
            var result = engine.analyze(block.root());

            if (result.isLeft()) {
                return Either.left(result.getLeft());
            }
            result.peek(violations -> violations.forEach(violation -> found.add(new Finding(block, violation))));
        }
        return Either.right(List.copyOf(found));
    }

    private FixProposal propose(Finding finding, LintContext context) {
        var diagnostic = diagnostic(finding, context);
        var violation = finding.violation();
        var block = finding.block();

        return registry.find(violation.ruleId())
                       .flatMap(RuleRegistration::fixer)
                       .<SentinelError>toEither(new FixError.NotFixable(violation.ruleId(), "no fixer registered"))
                       .flatMap(fixer -> fixer.propose(violation, block.root()))
                       .fold(cause -> skipped(diagnostic, block, cause.message()),
                             plan -> new FixProposal.Planned(diagnostic, block.name(), plan, verify(block, plan, violation)));
    }

    private static FixProposal skipped(Diagnostic diagnostic, OperationBlock block, String reason) {
        log.warn("Skipping fix for {} in {}: {}", diagnostic.ruleId(), block.name(), reason);
        return new FixProposal.Skipped(diagnostic, block.name(), reason);
    }

    // Apply the plan to a copy and check that the violation no longer shows up at the rewritten location
    private boolean verify(OperationBlock block, RewritePlan plan, Violation violation) {
        var engine = RuleEngine.ruleEngine(registry.find(violation.ruleId())
                                                   .map(registration -> List.of(registration.rule()))
                                                   .getOrElse(List.of()),
                                           config.engine());

        return Rewriter.apply(block.root(), plan)
                       .flatMap(engine::analyze)
                       .map(remaining -> remaining.stream()
                                                  .noneMatch(other -> other.path().equals(plan.target())
                                                                      && other.node().equals(violation.node())))
                       .getOrElse(false);
    }

    private Diagnostic diagnostic(Finding finding, LintContext context) {
        var violation = finding.violation();
        var position = violation.position();
        var descriptor = registry.find(violation.ruleId())
                                 .map(RuleRegistration::descriptor)
                                 .getOrElse(() -> unregistered(violation.ruleId()));
        var diagnostic = Diagnostic.diagnostic(descriptor.id(),
                                               context.severityFor(descriptor),
                                               context.fileName(),
                                               position.line(),
                                               position.column(),
                                               descriptor.formatMessage(violation.node().label()),
                                               descriptor.description());

        return descriptor.hasHelpLink()
               ? diagnostic.withDocLink(descriptor.helpLink())
               : diagnostic;
    }

    private static RuleDescriptor unregistered(String ruleId) {
        return new RuleDescriptor(ruleId, ruleId, "{0}", "", "", DiagnosticSeverity.WARNING, "", true);
    }

    private record Finding(OperationBlock block, Violation violation) {}
}

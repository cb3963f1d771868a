package org.pragmatica.sentinel.rule.rules;

import io.vavr.control.Option;
import org.pragmatica.sentinel.rule.LintRule;
import org.pragmatica.sentinel.rule.Violation;
import org.pragmatica.sentinel.traversal.RegionKind;
import org.pragmatica.sentinel.traversal.TraversalContext;
import org.pragmatica.sentinel.tree.Node;
import org.pragmatica.sentinel.tree.NodeKind;

import static io.vavr.control.Option.none;
import static io.vavr.control.Option.some;

/**
 * SNT-EX-01: Do not raise exceptions in finally regions.
 *
 * An exception thrown from a finally region replaces whatever exception was already propagating,
 * so the original failure is lost. Any finally depth counts, including nested try statements
 * inside the region and conditional code.
 *
 * The check is structural. A throw inside a lambda that is only defined in the finally region,
 * and runs later, is still reported.
 */
public class ThrowInFinallyRule implements LintRule {

    public static final String RULE_ID = "SNT-EX-01";

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public String description() {
        return "Do not raise exceptions in finally regions";
    }

    @Override
    public Option<Violation> evaluate(Node node, TraversalContext context) {
        if (node.is(NodeKind.THROW_SITE) && context.isInside(RegionKind.FINALLY)) {
            return some(Violation.violation(RULE_ID, node, context));
        }
        return none();
    }
}

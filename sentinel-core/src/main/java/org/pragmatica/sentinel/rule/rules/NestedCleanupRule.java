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

/// SNT-EX-02: Avoid try/finally nested inside finally regions.
///
/// Reports a try region that owns a finally region while it already sits inside at least
/// `maxNesting` finally regions. Cleanup that needs its own cleanup usually belongs in a
/// separate method.
public class NestedCleanupRule implements LintRule {
    public static final String RULE_ID = "SNT-EX-02";

    private final int maxNesting;

    private NestedCleanupRule(int maxNesting) {
        this.maxNesting = maxNesting;
    }

    public static NestedCleanupRule nestedCleanupRule() {
        return new NestedCleanupRule(1);
    }

    public static NestedCleanupRule nestedCleanupRule(int maxNesting) {
        if (maxNesting < 1) {
            throw new IllegalArgumentException("maxNesting must be at least 1");
        }
        return new NestedCleanupRule(maxNesting);
    }

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public String description() {
        return "Avoid try/finally nested inside finally regions";
    }

    @Override
    public Option<Violation> evaluate(Node node, TraversalContext context) {
        if (node.is(NodeKind.TRY_REGION)
            && ownsFinally(node)
            && context.depth(RegionKind.FINALLY) >= maxNesting) {
            return some(Violation.violation(RULE_ID, node, context));
        }
        return none();
    }

    private static boolean ownsFinally(Node tryNode) {
        return tryNode.children()
                      .stream()
                      .anyMatch(child -> child.is(NodeKind.FINALLY_REGION));
    }
}

package org.pragmatica.sentinel.rule;

import io.vavr.control.Option;
import org.pragmatica.sentinel.traversal.TraversalContext;
import org.pragmatica.sentinel.tree.Node;

/**
 * Predicate hosted by the rule engine.
 *
 * Each rule is evaluated once per visited node. Implementations must be pure: they may read the
 * context but never change it, and they keep no state between calls. Accumulating results is the
 * job of {@link ViolationCollector}.
 */
public interface LintRule {

    /**
     * Get the rule ID (e.g., "SNT-EX-01").
     */
    String ruleId();

    /**
     * Get a short description of what this rule checks.
     */
    String description();

    /**
     * Evaluate the rule at one node.
     *
     * @param node    the node being visited
     * @param context walker state at that node
     * @return the violation, if the node breaks the rule
     */
    Option<Violation> evaluate(Node node, TraversalContext context);
}

package org.pragmatica.sentinel.rule;

import org.pragmatica.sentinel.traversal.ContextSnapshot;
import org.pragmatica.sentinel.traversal.TraversalContext;
import org.pragmatica.sentinel.tree.Node;
import org.pragmatica.sentinel.tree.NodePath;
import org.pragmatica.sentinel.tree.SourcePosition;

/// Confirmed match of a rule against a node. Immutable once created.
///
/// The snapshot records where in the tree the node was found and which regions enclosed it,
/// which is what a fixer later uses to check the violation against a possibly newer tree.
public record Violation(String ruleId, Node node, ContextSnapshot context) {

    public static Violation violation(String ruleId, Node node, TraversalContext context) {
        return new Violation(ruleId, node, context.snapshot());
    }

    public NodePath path() {
        return context.path();
    }

    public SourcePosition position() {
        return node.position();
    }
}

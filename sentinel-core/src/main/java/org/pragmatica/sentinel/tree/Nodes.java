package org.pragmatica.sentinel.tree;

import java.util.ArrayList;
import java.util.List;

/// Static helpers for assembling operation trees by hand.
///
/// Front ends and tests use these instead of calling the [Node] constructor directly, so the
/// structural shape of try regions stays in one place.
public final class Nodes {
    private Nodes() {}

    public static Node block(Node... statements) {
        return Node.node(NodeKind.BLOCK, "", SourcePosition.UNKNOWN, List.of(statements));
    }

    public static Node block(SourcePosition position, List<Node> statements) {
        return Node.node(NodeKind.BLOCK, "", position, statements);
    }

    /// Try region with protected body, catch clauses and optional finally region (pass `null` for none).
    public static Node tryRegion(Node body, List<Node> catches, Node finallyRegion) {
        return tryRegion(SourcePosition.UNKNOWN, body, catches, finallyRegion);
    }

    public static Node tryRegion(SourcePosition position, Node body, List<Node> catches, Node finallyRegion) {
        var children = new ArrayList<Node>();
        children.add(body);
        children.addAll(catches);
        if (finallyRegion != null) {
            children.add(finallyRegion);
        }
        return Node.node(NodeKind.TRY_REGION, "try", position, children);
    }

    /// Shorthand for `try { body } finally { cleanup }`.
    public static Node tryFinally(Node body, Node... cleanup) {
        return tryRegion(body, List.of(), finallyRegion(cleanup));
    }

    public static Node catchClause(Node... statements) {
        return catchClause("catch", SourcePosition.UNKNOWN, List.of(statements));
    }

    public static Node catchClause(String label, SourcePosition position, List<Node> statements) {
        return Node.node(NodeKind.CATCH_CLAUSE, label, position, statements);
    }

    public static Node finallyRegion(Node... statements) {
        return finallyRegion(SourcePosition.UNKNOWN, List.of(statements));
    }

    public static Node finallyRegion(SourcePosition position, List<Node> statements) {
        return Node.node(NodeKind.FINALLY_REGION, "finally", position, statements);
    }

    public static Node throwSite(String label) {
        return throwSite(label, SourcePosition.UNKNOWN);
    }

    public static Node throwSite(String label, SourcePosition position) {
        return Node.node(NodeKind.THROW_SITE, label, position, List.of());
    }

    public static Node lambda(Node... body) {
        return Node.node(NodeKind.LAMBDA, "->", SourcePosition.UNKNOWN, List.of(body));
    }

    public static Node other(String label, Node... children) {
        return Node.node(NodeKind.OTHER, label, SourcePosition.UNKNOWN, List.of(children));
    }

    /// Statement with no effect; replacement for removed constructs that cannot be deleted outright.
    public static Node noOp(SourcePosition position) {
        return Node.node(NodeKind.OTHER, ";", position, List.of());
    }
}

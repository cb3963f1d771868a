package org.pragmatica.sentinel.traversal;

import org.pragmatica.sentinel.tree.Node;

/// Callback invoked by [TreeWalker] once per node, in traversal order.
@FunctionalInterface
public interface NodeVisitor {
    void visit(Node node, TraversalContext context);
}

package org.pragmatica.sentinel.traversal;

import org.pragmatica.sentinel.tree.NodePath;

import java.util.List;

/**
 * Read-only view of the walker state at the node currently being visited.
 * <p>
 * Rules receive this view and may only query it. The mutable side lives in {@link RegionTracker}
 * and is driven exclusively by {@link TreeWalker}.
 */
public interface TraversalContext {

    /**
     * Number of active markers of the given kind.
     */
    int depth(RegionKind kind);

    /**
     * Total number of active markers of any kind.
     */
    int nesting();

    /**
     * Active markers, outermost first.
     */
    List<RegionKind> regions();

    /**
     * Path of the node being visited.
     */
    NodePath path();

    /**
     * Immutable copy of the current state, safe to keep after the traversal moves on.
     */
    ContextSnapshot snapshot();

    default boolean isInside(RegionKind kind) {
        return depth(kind) > 0;
    }
}

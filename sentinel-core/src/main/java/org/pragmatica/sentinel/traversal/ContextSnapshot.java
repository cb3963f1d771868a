package org.pragmatica.sentinel.traversal;

import org.pragmatica.sentinel.tree.NodePath;

import java.util.List;

/// Frozen [TraversalContext] captured when a violation is reported.
public record ContextSnapshot(NodePath path, List<RegionKind> regions) {
    public ContextSnapshot {
        regions = List.copyOf(regions);
    }

    public static ContextSnapshot contextSnapshot(NodePath path, List<RegionKind> regions) {
        return new ContextSnapshot(path, regions);
    }

    public int depth(RegionKind kind) {
        return (int) regions.stream()
                            .filter(kind::equals)
                            .count();
    }
}

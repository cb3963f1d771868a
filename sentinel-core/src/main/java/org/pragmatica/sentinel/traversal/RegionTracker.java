package org.pragmatica.sentinel.traversal;

import org.pragmatica.sentinel.tree.NodePath;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/// Mutable traversal state: the stack of active region markers and the path of the current node.
///
/// One tracker belongs to one traversal at a time and is never shared between threads.
/// Markers are pushed through [#enter(RegionKind)], which returns a [Region] to be closed by
/// try-with-resources, so every push is paired with a pop on every exit path.
public final class RegionTracker implements TraversalContext {
    private final Deque<RegionKind> stack = new ArrayDeque<>();
    private final Map<RegionKind, Integer> depths = new EnumMap<>(RegionKind.class);
    private NodePath path = NodePath.root();

    private RegionTracker() {}

    public static RegionTracker regionTracker() {
        return new RegionTracker();
    }

    /// Push a marker. Closing the returned region pops it.
    public Region enter(RegionKind kind) {
        stack.push(kind);
        depths.merge(kind, 1, Integer::sum);
        return new Region(kind, stack.size());
    }

    NodePath moveTo(NodePath next) {
        var previous = path;
        path = next;
        return previous;
    }

    @Override
    public int depth(RegionKind kind) {
        return depths.getOrDefault(kind, 0);
    }

    @Override
    public int nesting() {
        return stack.size();
    }

    @Override
    public List<RegionKind> regions() {
        var outermostFirst = new ArrayList<RegionKind>(stack.size());
        stack.descendingIterator()
             .forEachRemaining(outermostFirst::add);
        return outermostFirst;
    }

    @Override
    public NodePath path() {
        return path;
    }

    @Override
    public ContextSnapshot snapshot() {
        return ContextSnapshot.contextSnapshot(path, regions());
    }

    @Override
    public String toString() {
        return "RegionTracker" + regions() + " at " + path;
    }

    /// Scoped marker. Close exactly once; closing out of order is a programming error.
    public final class Region implements AutoCloseable {
        private final RegionKind kind;
        private final int level;
        private boolean closed;

        private Region(RegionKind kind, int level) {
            this.kind = kind;
            this.level = level;
        }

        public RegionKind kind() {
            return kind;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            if (stack.size() != level || stack.peek() != kind) {
                throw new IllegalStateException("Region " + kind + " closed out of order, stack " + regions());
            }
            closed = true;
            stack.pop();
            depths.computeIfPresent(kind, (key, count) -> count > 1 ? count - 1 : null);
        }
    }
}

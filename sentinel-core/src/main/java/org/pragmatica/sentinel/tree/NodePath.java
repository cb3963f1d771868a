package org.pragmatica.sentinel.tree;

import io.vavr.control.Option;

import java.util.ArrayList;
import java.util.List;

import static io.vavr.control.Option.none;
import static io.vavr.control.Option.some;

/// Position of a node inside a tree, as the list of child indices leading to it from the root.
///
/// Paths order in document order: an ancestor precedes its descendants, and a left sibling's
/// subtree precedes a right sibling's subtree.
public record NodePath(List<Integer> indices) implements Comparable<NodePath> {
    private static final NodePath ROOT = new NodePath(List.of());

    public NodePath {
        indices = List.copyOf(indices);
    }

    public static NodePath root() {
        return ROOT;
    }

    public static NodePath nodePath(Integer... indices) {
        return new NodePath(List.of(indices));
    }

    public NodePath child(int index) {
        var extended = new ArrayList<>(indices);
        extended.add(index);
        return new NodePath(extended);
    }

    public boolean isRoot() {
        return indices.isEmpty();
    }

    public int length() {
        return indices.size();
    }

    /// Parent path; the root has none.
    public Option<NodePath> parent() {
        return isRoot()
               ? none()
               : some(new NodePath(indices.subList(0, indices.size() - 1)));
    }

    /// Index of the addressed node within its parent. Only meaningful for non-root paths.
    public int lastIndex() {
        return indices.get(indices.size() - 1);
    }

    /// True when this path is equal to or an ancestor of {@code other}.
    public boolean isPrefixOf(NodePath other) {
        return other.indices.size() >= indices.size()
               && other.indices.subList(0, indices.size())
                               .equals(indices);
    }

    /// Two paths overlap when one subtree contains the other.
    public boolean overlaps(NodePath other) {
        return isPrefixOf(other) || other.isPrefixOf(this);
    }

    /// Resolve this path against a tree.
    public Option<Node> resolve(Node root) {
        var current = root;
        for (var index : indices) {
            if (index < 0 || index >= current.children().size()) {
                return none();
            }
            current = current.child(index);
        }
        return some(current);
    }

    @Override
    public int compareTo(NodePath other) {
        var common = Math.min(indices.size(), other.indices.size());
        for (int i = 0; i < common; i++) {
            var cmp = Integer.compare(indices.get(i), other.indices.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(indices.size(), other.indices.size());
    }

    @Override
    public String toString() {
        return indices.isEmpty() ? "/" : "/" + String.join("/", indices.stream().map(String::valueOf).toList());
    }
}

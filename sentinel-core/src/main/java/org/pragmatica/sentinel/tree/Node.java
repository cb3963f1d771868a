package org.pragmatica.sentinel.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable node of an operation tree.
 * <p>
 * Children are exclusively owned by their parent, so a node graph built from these records is
 * always a strict tree. All "modifications" return new nodes; untouched subtrees are shared
 * between the old and the new tree.
 *
 * @param kind     structural kind used by the walker
 * @param label    source excerpt used only when rendering diagnostics
 * @param position opaque location token
 * @param children ordered children
 */
public record Node(NodeKind kind, String label, SourcePosition position, List<Node> children) {
    public Node {
        Objects.requireNonNull(kind, "kind");
        label = label == null ? "" : label;
        position = position == null ? SourcePosition.UNKNOWN : position;
        children = List.copyOf(children);
    }

    /**
     * Factory method.
     */
    public static Node node(NodeKind kind, String label, SourcePosition position, List<Node> children) {
        return new Node(kind, label, position, children);
    }

    public boolean is(NodeKind expected) {
        return kind == expected;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public Node child(int index) {
        return children.get(index);
    }

    /**
     * Total number of nodes in this subtree, including this one.
     */
    public int size() {
        return 1 + children.stream()
                           .mapToInt(Node::size)
                           .sum();
    }

    /**
     * Copy with the child at {@code index} replaced.
     */
    public Node withChild(int index, Node replacement) {
        var copy = new ArrayList<>(children);
        copy.set(index, replacement);
        return new Node(kind, label, position, copy);
    }

    /**
     * Copy with the child at {@code index} removed; later siblings shift left.
     */
    public Node withoutChild(int index) {
        var copy = new ArrayList<>(children);
        copy.remove(index);
        return new Node(kind, label, position, copy);
    }

    @Override
    public String toString() {
        return kind + (label.isEmpty() ? "" : "[" + label + "]") + "@" + position;
    }
}

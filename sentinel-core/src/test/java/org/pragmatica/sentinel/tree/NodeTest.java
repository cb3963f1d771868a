package org.pragmatica.sentinel.tree;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.sentinel.tree.Nodes.block;
import static org.pragmatica.sentinel.tree.Nodes.other;
import static org.pragmatica.sentinel.tree.Nodes.throwSite;

class NodeTest {

    @Test
    void children_areCopiedOnConstruction() {
        var children = new ArrayList<Node>(List.of(other("a")));
        var node = Node.node(NodeKind.BLOCK, "", SourcePosition.UNKNOWN, children);

        children.add(other("b"));

        assertThat(node.children()).hasSize(1);
        assertThatThrownBy(() -> node.children().add(other("c"))).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void withoutChild_leavesOriginalUntouchedAndSharesSiblings() {
        var kept = other("kept", other("deep"));
        var original = block(throwSite("E"), kept);

        var updated = original.withoutChild(0);

        assertThat(original.children()).hasSize(2);
        assertThat(updated.children()).containsExactly(kept);
        assertThat(updated.child(0)).isSameAs(kept);
    }

    @Test
    void size_countsWholeSubtree() {
        assertThat(block(other("a", other("b")), throwSite("E")).size()).isEqualTo(4);
    }
}

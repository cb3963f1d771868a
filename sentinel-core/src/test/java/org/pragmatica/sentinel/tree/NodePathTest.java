package org.pragmatica.sentinel.tree;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.sentinel.tree.NodePath.nodePath;
import static org.pragmatica.sentinel.tree.Nodes.block;
import static org.pragmatica.sentinel.tree.Nodes.other;
import static org.pragmatica.sentinel.tree.Nodes.throwSite;
import static org.pragmatica.sentinel.tree.Nodes.tryFinally;

class NodePathTest {

    private final Node tree = block(other("a"),
                                    tryFinally(block(), throwSite("E")),
                                    other("b", other("c")));

    @Test
    void resolve_findsNodeByChildIndices() {
        assertThat(nodePath(1, 1, 0).resolve(tree).get()).isEqualTo(throwSite("E"));
        assertThat(nodePath(2, 0).resolve(tree).get().label()).isEqualTo("c");
        assertThat(NodePath.root().resolve(tree).get()).isSameAs(tree);
    }

    @Test
    void resolve_returnsNone_forIndexOutOfRange() {
        assertThat(nodePath(3).resolve(tree).isEmpty()).isTrue();
        assertThat(nodePath(0, 0).resolve(tree).isEmpty()).isTrue();
        assertThat(nodePath(-1).resolve(tree).isEmpty()).isTrue();
    }

    @Test
    void overlaps_coversAncestorsAndSelfButNotSiblings() {
        assertThat(nodePath(1).overlaps(nodePath(1, 1, 0))).isTrue();
        assertThat(nodePath(1, 1, 0).overlaps(nodePath(1))).isTrue();
        assertThat(nodePath(1, 0).overlaps(nodePath(1, 0))).isTrue();
        assertThat(nodePath(1, 0).overlaps(nodePath(1, 1))).isFalse();
        assertThat(nodePath(0).overlaps(nodePath(2, 0))).isFalse();
    }

    @Test
    void compareTo_followsDocumentOrder() {
        var paths = new ArrayList<>(List.of(nodePath(2), nodePath(1, 1, 0), NodePath.root(), nodePath(1), nodePath(0)));
        paths.sort(null);

        assertThat(paths).containsExactly(NodePath.root(), nodePath(0), nodePath(1), nodePath(1, 1, 0), nodePath(2));
    }

    @Test
    void parent_dropsLastIndex() {
        assertThat(nodePath(1, 1, 0).parent().get()).isEqualTo(nodePath(1, 1));
        assertThat(NodePath.root().parent().isEmpty()).isTrue();
        assertThat(nodePath(4, 2).lastIndex()).isEqualTo(2);
    }
}

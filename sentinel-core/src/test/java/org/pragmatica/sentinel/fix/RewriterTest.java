package org.pragmatica.sentinel.fix;

import org.junit.jupiter.api.Test;
import org.pragmatica.sentinel.tree.NodePath;
import org.pragmatica.sentinel.tree.SourcePosition;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.sentinel.tree.NodePath.nodePath;
import static org.pragmatica.sentinel.tree.Nodes.block;
import static org.pragmatica.sentinel.tree.Nodes.catchClause;
import static org.pragmatica.sentinel.tree.Nodes.noOp;
import static org.pragmatica.sentinel.tree.Nodes.other;
import static org.pragmatica.sentinel.tree.Nodes.throwSite;
import static org.pragmatica.sentinel.tree.Nodes.tryFinally;
import static org.pragmatica.sentinel.tree.Nodes.tryRegion;

class RewriterTest {

    @Test
    void applyAll_deletesSiblingsInOnePass() {
        var a = throwSite("a");
        var b = throwSite("b");
        var tree = tryFinally(block(), a, other("keep"), b);

        var fixed = Rewriter.applyAll(tree, List.of(RewritePlan.delete(nodePath(1, 0), a),
                                                    RewritePlan.delete(nodePath(1, 2), b)))
                            .get();

        assertThat(fixed).isEqualTo(tryFinally(block(), other("keep")));
    }

    @Test
    void applyAll_acceptsPlansInAnyOrder() {
        var a = throwSite("a");
        var b = throwSite("b");
        var tree = block(a, other("keep"), b);

        var fixed = Rewriter.applyAll(tree, List.of(RewritePlan.delete(nodePath(2), b),
                                                    RewritePlan.delete(nodePath(0), a)))
                            .get();

        assertThat(fixed).isEqualTo(block(other("keep")));
    }

    @Test
    void applyAll_sameTarget_isConflict() {
        var a = throwSite("a");
        var tree = block(a);

        var result = Rewriter.applyAll(tree, List.of(RewritePlan.delete(nodePath(0), a),
                                                     RewritePlan.replace(nodePath(0), a, noOp(SourcePosition.UNKNOWN))));

        assertThat(result.isLeft()).isTrue();
        result.peekLeft(cause -> assertThat(cause).isInstanceOf(FixError.Conflict.class));
    }

    @Test
    void applyAll_ancestorAndDescendant_isConflict() {
        var inner = throwSite("a");
        var wrapper = other("if", inner);
        var tree = block(wrapper);

        var result = Rewriter.applyAll(tree, List.of(RewritePlan.replace(nodePath(0, 0), inner, noOp(SourcePosition.UNKNOWN)),
                                                     RewritePlan.delete(nodePath(0), wrapper)));

        assertThat(result.isLeft()).isTrue();
        result.peekLeft(cause -> assertThat(cause).isInstanceOf(FixError.Conflict.class));
    }

    @Test
    void apply_planForDifferentNode_isStale() {
        var tree = block(other("x"));

        var result = Rewriter.apply(tree, RewritePlan.delete(nodePath(0), throwSite("a")));

        assertThat(result.isLeft()).isTrue();
        result.peekLeft(cause -> assertThat(cause).isInstanceOf(FixError.StaleReference.class));
    }

    @Test
    void apply_pathOutsideTree_isStale() {
        var result = Rewriter.apply(block(), RewritePlan.delete(nodePath(3), throwSite("a")));

        assertThat(result.isLeft()).isTrue();
        result.peekLeft(cause -> assertThat(cause).isInstanceOf(FixError.StaleReference.class));
    }

    @Test
    void apply_deletingRoot_isRejected() {
        var tree = block();

        var result = Rewriter.apply(tree, RewritePlan.delete(NodePath.root(), tree));

        assertThat(result.isLeft()).isTrue();
        result.peekLeft(cause -> assertThat(cause).isInstanceOf(FixError.NotFixable.class));
    }

    @Test
    void apply_deletingProtectedBody_isRejected() {
        var body = block();
        var tree = tryFinally(body, other("close"));

        var result = Rewriter.apply(tree, RewritePlan.delete(nodePath(0), body));

        assertThat(result.isLeft()).isTrue();
        result.peekLeft(cause -> assertThat(cause).isInstanceOf(FixError.NotFixable.class));
    }

    @Test
    void apply_replacingFinallyWithStatement_isRejected() {
        var tree = tryFinally(block(), other("close"));

        var result = Rewriter.apply(tree, RewritePlan.replace(nodePath(1), tree.child(1), other("close")));

        assertThat(result.isLeft()).isTrue();
        result.peekLeft(cause -> assertThat(cause).isInstanceOf(FixError.NotFixable.class));
    }

    @Test
    void apply_replacingCatchWithCatch_isAccepted() {
        var tree = tryRegion(block(), List.of(catchClause(throwSite("a"))), null);

        var fixed = Rewriter.apply(tree, RewritePlan.replace(nodePath(1), tree.child(1), catchClause())).get();

        assertThat(fixed.child(1).children()).isEmpty();
    }
}

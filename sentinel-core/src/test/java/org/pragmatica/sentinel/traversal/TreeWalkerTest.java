package org.pragmatica.sentinel.traversal;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.pragmatica.sentinel.tree.Node;
import org.pragmatica.sentinel.tree.NodeKind;
import org.pragmatica.sentinel.tree.NodePath;
import org.pragmatica.sentinel.tree.SourcePosition;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.sentinel.tree.NodePath.nodePath;
import static org.pragmatica.sentinel.tree.Nodes.block;
import static org.pragmatica.sentinel.tree.Nodes.catchClause;
import static org.pragmatica.sentinel.tree.Nodes.finallyRegion;
import static org.pragmatica.sentinel.tree.Nodes.lambda;
import static org.pragmatica.sentinel.tree.Nodes.other;
import static org.pragmatica.sentinel.tree.Nodes.throwSite;
import static org.pragmatica.sentinel.tree.Nodes.tryFinally;
import static org.pragmatica.sentinel.tree.Nodes.tryRegion;

class TreeWalkerTest {
    private final TreeWalker walker = TreeWalker.treeWalker();

    private record Visit(String label, NodePath path, List<RegionKind> regions) {}

    private List<Visit> record(Node root) {
        var visits = new ArrayList<Visit>();
        var result = walker.traverse(root, (node, context) -> visits.add(new Visit(node.label(), context.path(), context.regions())));

        assertThat(result.isRight()).as("traversal should succeed").isTrue();
        return visits;
    }

    @Nested
    class Order {

        @Test
        void traverse_visitsPreOrderLeftToRight() {
            var tree = block(other("a", other("a1"), other("a2")), other("b"));

            assertThat(record(tree)).extracting(Visit::label)
                                    .containsExactly("", "a", "a1", "a2", "b");
        }

        @Test
        void traverse_visitsEveryNodeExactlyOnce() {
            var tree = block(tryRegion(block(throwSite("t1")),
                                       List.of(catchClause(throwSite("t2")), catchClause(other("x"))),
                                       finallyRegion(tryFinally(block(), throwSite("t3")), lambda(throwSite("t4")))),
                             other("tail"));

            var visits = record(tree);

            assertThat(visits).hasSize(tree.size());
            assertThat(visits).extracting(Visit::path).doesNotHaveDuplicates();
        }

        @Test
        void traverse_walksBodyThenCatchesThenFinally() {
            var tree = tryRegion(block(other("body")),
                                 List.of(catchClause(other("first")), catchClause(other("second"))),
                                 finallyRegion(other("cleanup")));

            assertThat(record(tree)).extracting(Visit::label)
                                    .containsExactly("try", "", "body", "catch", "first", "catch", "second", "finally", "cleanup");
        }
    }

    @Nested
    class Regions {

        @Test
        void finallyChildren_areInsideFinallyRegion_butFinallyNodeItselfIsNot() {
            var visits = record(tryFinally(block(other("body")), other("cleanup")));

            assertThat(regionsOf(visits, "finally")).isEmpty();
            assertThat(regionsOf(visits, "cleanup")).containsExactly(RegionKind.FINALLY);
            assertThat(regionsOf(visits, "body")).isEmpty();
        }

        @Test
        void catchChildren_areMarkedAsCatch_notFinally() {
            var visits = record(tryRegion(block(), List.of(catchClause(other("handler"))), finallyRegion()));

            assertThat(regionsOf(visits, "handler")).containsExactly(RegionKind.CATCH);
        }

        @Test
        void nestedFinally_increasesDepth() {
            var tree = tryFinally(block(), tryFinally(block(other("inner-body")), other("innermost")));
            var depths = new ArrayList<Integer>();

            walker.traverse(tree, (node, context) -> {
                if (node.label().equals("innermost")) {
                    depths.add(context.depth(RegionKind.FINALLY));
                }
                if (node.label().equals("inner-body")) {
                    depths.add(context.depth(RegionKind.FINALLY));
                }
            });

            assertThat(depths).containsExactly(1, 2);
        }

        @Test
        void lambdaBody_isMarkedInsideEnclosingRegions() {
            var visits = record(tryFinally(block(), lambda(other("deferred"))));

            assertThat(regionsOf(visits, "deferred")).containsExactly(RegionKind.FINALLY, RegionKind.LAMBDA);
        }

        @Test
        void siblingsAfterRegion_seeNoLeftoverMarkers() {
            var visits = record(block(tryFinally(block(), other("cleanup")), other("after")));

            assertThat(regionsOf(visits, "after")).isEmpty();
        }

        @Test
        void presetMarkers_areTreatedAsEnclosingRegions() {
            var tracker = RegionTracker.regionTracker();
            var depths = new ArrayList<Integer>();

            try (var ignored = tracker.enter(RegionKind.FINALLY)) {
                walker.traverse(block(throwSite("E")), tracker, (node, context) -> depths.add(context.depth(RegionKind.FINALLY)));
                assertThat(tracker.nesting()).isEqualTo(1);
            }

            assertThat(depths).containsExactly(1, 1);
            assertThat(tracker.nesting()).isZero();
        }

        private List<RegionKind> regionsOf(List<Visit> visits, String label) {
            return visits.stream()
                         .filter(visit -> visit.label().equals(label))
                         .findFirst()
                         .map(Visit::regions)
                         .orElseThrow();
        }
    }

    @Nested
    class Failures {

        @Test
        void callbackFailure_isReportedAndMarkersAreReleased() {
            var tracker = RegionTracker.regionTracker();
            var tree = tryFinally(block(), tryFinally(block(), other("boom")));

            var result = walker.traverse(tree, tracker, (node, context) -> {
                if (node.label().equals("boom")) {
                    assertThat(context.depth(RegionKind.FINALLY)).isEqualTo(2);
                    throw new IllegalStateException("boom");
                }
            });

            assertThat(result.isLeft()).isTrue();
            result.peekLeft(cause -> assertThat(cause).isInstanceOfSatisfying(TraversalError.VisitorFailed.class,
                                                                                failed -> assertThat(failed.path()).isEqualTo(nodePath(1, 0, 1, 0))));
            assertThat(tracker.nesting()).isZero();
            assertThat(tracker.depth(RegionKind.FINALLY)).isZero();
        }

        @Test
        void trackerIsReusable_afterFailedTraversal() {
            var tracker = RegionTracker.regionTracker();
            var tree = tryFinally(block(), other("boom"));

            walker.traverse(tree, tracker, (node, context) -> {
                if (node.label().equals("boom")) {
                    throw new IllegalStateException("boom");
                }
            });
            var depths = new ArrayList<Integer>();
            var second = walker.traverse(tree, tracker, (node, context) -> depths.add(context.depth(RegionKind.FINALLY)));

            assertThat(second.isRight()).isTrue();
            assertThat(depths).containsExactly(0, 0, 0, 1);
        }

        @Test
        void catchOutsideTry_isMalformed() {
            assertMalformed(block(catchClause(other("x"))), nodePath(0));
        }

        @Test
        void finallyOutsideTry_isMalformed() {
            assertMalformed(finallyRegion(other("x")), NodePath.root());
        }

        @Test
        void tryWithoutProtectedBlock_isMalformed() {
            var broken = Node.node(NodeKind.TRY_REGION, "try", SourcePosition.UNKNOWN, List.of(finallyRegion()));

            assertMalformed(block(broken), nodePath(0));
        }

        @Test
        void catchAfterFinally_isMalformed() {
            var broken = Node.node(NodeKind.TRY_REGION,
                                   "try",
                                   SourcePosition.UNKNOWN,
                                   List.of(block(), finallyRegion(), catchClause()));

            assertMalformed(broken, nodePath(2));
        }

        @Test
        void statementDirectlyInTry_isMalformed() {
            var broken = Node.node(NodeKind.TRY_REGION, "try", SourcePosition.UNKNOWN, List.of(block(), throwSite("E")));

            assertMalformed(broken, nodePath(1));
        }

        @Test
        void treeDeeperThanLimit_isMalformed() {
            var deep = other("leaf");
            for (int i = 0; i < 20; i++) {
                deep = other("level", deep);
            }

            var result = TreeWalker.treeWalker(10).traverse(deep, (node, context) -> { });

            assertThat(result.isLeft()).isTrue();
            result.peekLeft(cause -> assertThat(cause.message()).contains("depth"));
        }

        private void assertMalformed(Node tree, NodePath expectedPath) {
            var tracker = RegionTracker.regionTracker();
            var result = walker.traverse(tree, tracker, (node, context) -> { });

            assertThat(result.isLeft()).isTrue();
            result.peekLeft(cause -> assertThat(cause).isInstanceOfSatisfying(TraversalError.MalformedTree.class,
                                                                                malformed -> assertThat(malformed.path()).isEqualTo(expectedPath)));
            assertThat(tracker.nesting()).isZero();
        }
    }
}

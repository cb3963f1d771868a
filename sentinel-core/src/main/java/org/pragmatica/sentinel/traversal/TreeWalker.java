package org.pragmatica.sentinel.traversal;

import io.vavr.control.Either;
import org.pragmatica.sentinel.shared.SentinelError;
import org.pragmatica.sentinel.tree.Node;
import org.pragmatica.sentinel.tree.NodeKind;
import org.pragmatica.sentinel.tree.NodePath;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.pragmatica.sentinel.traversal.TraversalError.malformedTree;

/**
 * Context-tracking depth-first walker over operation trees.
 * <p>
 * Nodes are visited in pre-order, children left to right, each exactly once. While walking it
 * maintains region markers in a {@link RegionTracker}:
 * <ul>
 *     <li>a try region is walked as protected body, then each catch clause, then the finally
 *     region; only the children of the finally region are walked under a {@link RegionKind#FINALLY}
 *     marker, catch clause children are walked under {@link RegionKind#CATCH};</li>
 *     <li>lambda bodies are walked under {@link RegionKind#LAMBDA}.</li>
 * </ul>
 * Markers are scoped with try-with-resources, so the tracker is back at its starting depth when
 * {@link #traverse} returns, whether the walk completed, hit a malformed node, or the callback threw.
 */
public final class TreeWalker {
    private static final Logger log = LoggerFactory.getLogger(TreeWalker.class);

    public static final int DEFAULT_MAX_DEPTH = 1024;

    private final int maxDepth;

    private TreeWalker(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * Factory method with the default depth limit.
     */
    public static TreeWalker treeWalker() {
        return new TreeWalker(DEFAULT_MAX_DEPTH);
    }

    /**
     * Factory method with a custom depth limit. Trees nested deeper are reported as malformed.
     */
    public static TreeWalker treeWalker(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        return new TreeWalker(maxDepth);
    }

    public int maxDepth() {
        return maxDepth;
    }

    /**
     * Walk {@code root} with a fresh tracker.
     */
    public Either<SentinelError, Integer> traverse(Node root, NodeVisitor onVisit) {
        return traverse(root, RegionTracker.regionTracker(), onVisit);
    }

    /**
     * Walk {@code root}, reporting every node to {@code onVisit}.
     * <p>
     * Markers already present in {@code context} are treated as enclosing regions of the root,
     * which lets a caller analyze a subtree known to sit inside a region.
     *
     * @return number of visited nodes, or a {@link TraversalError} when the tree is malformed or the callback failed
     */
    public Either<SentinelError, Integer> traverse(Node root, RegionTracker context, NodeVisitor onVisit) {
        var walk = new Walk(context, onVisit);
        var startPath = context.moveTo(NodePath.root());

        try {
            walk.node(root, NodePath.root(), 0);
            log.debug("Visited {} nodes", walk.visited);
            return Either.right(walk.visited);
        } catch (WalkAborted aborted) {
            log.debug("Traversal aborted after {} nodes: {}", walk.visited, aborted.error.message());
            return Either.left(aborted.error);
        } finally {
            context.moveTo(startPath);
        }
    }

    private final class Walk {
        private final RegionTracker context;
        private final NodeVisitor onVisit;
        private int visited;

        private Walk(RegionTracker context, NodeVisitor onVisit) {
            this.context = context;
            this.onVisit = onVisit;
        }

        void node(Node node, NodePath path, int depth) {
            if (depth > maxDepth) {
                throw new WalkAborted(malformedTree(path, "nesting depth exceeds limit of " + maxDepth));
            }

            if (node.is(NodeKind.CATCH_CLAUSE) || node.is(NodeKind.FINALLY_REGION)) {
                throw new WalkAborted(malformedTree(path, node.kind() + " outside of a try region"));
            }

            visit(node, path);

            switch (node.kind()) {
                case TRY_REGION -> tryRegion(node, path, depth);
                case LAMBDA -> {
                    try (var ignored = context.enter(RegionKind.LAMBDA)) {
                        children(node, path, depth);
                    }
                }
                case BLOCK, THROW_SITE, OTHER -> children(node, path, depth);
                // Handlers are walked by tryRegion, never on their own
                case CATCH_CLAUSE, FINALLY_REGION -> { }
            }
        }

        private void tryRegion(Node tryNode, NodePath path, int depth) {
            checkTryShape(tryNode, path);

            node(tryNode.child(0), path.child(0), depth + 1);

            for (int i = 1; i < tryNode.children().size(); i++) {
                var handler = tryNode.child(i);
                var handlerPath = path.child(i);
                var region = handler.is(NodeKind.CATCH_CLAUSE)
                             ? RegionKind.CATCH
                             : RegionKind.FINALLY;

                visit(handler, handlerPath);

                try (var ignored = context.enter(region)) {
                    children(handler, handlerPath, depth + 1);
                }
            }
        }

        private void children(Node parent, NodePath path, int depth) {
            var children = parent.children();

            for (int i = 0; i < children.size(); i++) {
                node(children.get(i), path.child(i), depth + 1);
            }
        }

        private void visit(Node node, NodePath path) {
            context.moveTo(path);
            visited++;

            try {
                onVisit.visit(node, context);
            } catch (RuntimeException e) {
                throw new WalkAborted(new TraversalError.VisitorFailed(path, e));
            }
        }

        private void checkTryShape(Node tryNode, NodePath path) {
            var children = tryNode.children();

            if (children.isEmpty() || !children.get(0).is(NodeKind.BLOCK)) {
                throw new WalkAborted(malformedTree(path, "try region must start with a protected block"));
            }

            var seenFinally = false;

            for (int i = 1; i < children.size(); i++) {
                var kind = children.get(i).kind();

                if (seenFinally) {
                    throw new WalkAborted(malformedTree(path.child(i), kind + " after finally region"));
                }
                switch (kind) {
                    case CATCH_CLAUSE -> { }
                    case FINALLY_REGION -> seenFinally = true;
                    default -> throw new WalkAborted(malformedTree(path.child(i),
                                                                   "unexpected " + kind + " in try region"));
                }
            }
        }
    }

    private static final class WalkAborted extends RuntimeException {
        private final TraversalError error;

        private WalkAborted(TraversalError error) {
            super(error.message(), null, false, false);
            this.error = error;
        }
    }
}

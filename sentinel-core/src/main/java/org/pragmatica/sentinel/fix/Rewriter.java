package org.pragmatica.sentinel.fix;

import io.vavr.control.Either;
import org.pragmatica.sentinel.shared.SentinelError;
import org.pragmatica.sentinel.tree.Node;
import org.pragmatica.sentinel.tree.NodeKind;
import org.pragmatica.sentinel.tree.NodePath;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/// Applies rewrite plans by path copying. The input tree is never modified; the returned tree shares
/// every subtree that lies off the edited paths.
public final class Rewriter {
    private static final Logger log = LoggerFactory.getLogger(Rewriter.class);

    private Rewriter() {}

    /// Check that `expected` is still found at `path` in `tree`.
    public static Either<SentinelError, Node> locate(Node tree, String ruleId, NodePath path, Node expected) {
        return path.resolve(tree)
                   .filter(expected::equals)
                   .toEither(new FixError.StaleReference(ruleId, path));
    }

    /// Apply a single plan.
    public static Either<SentinelError, Node> apply(Node tree, RewritePlan plan) {
        return applyAll(tree, List.of(plan));
    }

    /// Apply several plans computed against the same tree in one pass.
    ///
    /// Every plan is checked against `tree` first. Plans whose targets are equal or nested are
    /// rejected with [FixError.Conflict]; the caller applies one of them and re-runs detection.
    /// Accepted plans are applied last-in-document-order first, so deleting a node never shifts
    /// the index of a node another plan still has to reach.
    public static Either<SentinelError, Node> applyAll(Node tree, List<RewritePlan> plans) {
        var ordered = new ArrayList<>(plans);
        ordered.sort(Comparator.comparing(RewritePlan::target));

        for (int i = 0; i < ordered.size(); i++) {
            var plan = ordered.get(i);
            var stale = locate(tree, "rewrite", plan.target(), plan.original());

            if (stale.isLeft()) {
                return stale;
            }
            if (plan instanceof RewritePlan.Delete && !deletable(tree, plan.target())) {
                return Either.left(new FixError.NotFixable("rewrite", "cannot delete " + plan.original().kind()
                                                                      + " at " + plan.target() + " without breaking its parent"));
            }
            if (plan instanceof RewritePlan.Replace replace && !keepsShape(tree, replace)) {
                return Either.left(new FixError.NotFixable("rewrite", "replacing " + plan.original().kind() + " with "
                                                                      + replace.replacement().kind() + " at " + plan.target()
                                                                      + " breaks the enclosing try region"));
            }
            if (i > 0 && ordered.get(i - 1).target().overlaps(plan.target())) {
                return Either.left(new FixError.Conflict(ordered.get(i - 1), plan));
            }
        }

        var result = tree;

        for (int i = ordered.size() - 1; i >= 0; i--) {
            result = rewrite(result, ordered.get(i), 0);
        }
        log.debug("Applied {} rewrite(s)", ordered.size());
        return Either.right(result);
    }

    private static boolean deletable(Node tree, NodePath target) {
        return target.parent()
                     .flatMap(parentPath -> parentPath.resolve(tree))
                     .map(parent -> parent.kind().isStatementList())
                     .getOrElse(false);
    }

    private static Node rewrite(Node current, RewritePlan plan, int level) {
        var indices = plan.target().indices();

        if (level == indices.size()) {
            // Only reachable for Replace: deleting the root is rejected by deletable()
            return ((RewritePlan.Replace) plan).replacement();
        }

        var index = indices.get(level);

        if (level == indices.size() - 1 && plan instanceof RewritePlan.Delete) {
            return current.withoutChild(index);
        }
        return current.withChild(index, rewrite(current.child(index), plan, level + 1));
    }

    // Handlers and the protected body of a try region may only be swapped for a node of the same kind
    private static boolean keepsShape(Node tree, RewritePlan.Replace plan) {
        var original = plan.original().kind();
        var replacement = plan.replacement().kind();

        if (original == replacement) {
            return true;
        }
        if (original == NodeKind.CATCH_CLAUSE || original == NodeKind.FINALLY_REGION
            || replacement == NodeKind.CATCH_CLAUSE || replacement == NodeKind.FINALLY_REGION) {
            return false;
        }
        return plan.target()
                   .parent()
                   .flatMap(parentPath -> parentPath.resolve(tree))
                   .map(parent -> !parent.is(NodeKind.TRY_REGION))
                   .getOrElse(true);
    }
}

package org.pragmatica.sentinel.fix;

import io.vavr.control.Either;
import org.pragmatica.sentinel.shared.SentinelError;
import org.pragmatica.sentinel.rule.Violation;
import org.pragmatica.sentinel.rule.rules.ThrowInFinallyRule;
import org.pragmatica.sentinel.tree.Node;
import org.pragmatica.sentinel.tree.NodeKind;
import org.pragmatica.sentinel.tree.Nodes;

/**
 * Removes a throw site reported by {@link ThrowInFinallyRule}.
 * <p>
 * When the throw sits in a statement list it is deleted; elsewhere (for example as the only
 * branch of a conditional) it is replaced with a no-op so the parent keeps its shape. Siblings are
 * left untouched. The edit only makes the violation go away; it does not try to keep the program
 * meaning the same.
 */
public class ThrowInFinallyFixer implements RuleFixer {

    @Override
    public String ruleId() {
        return ThrowInFinallyRule.RULE_ID;
    }

    @Override
    public Either<SentinelError, RewritePlan> propose(Violation violation, Node tree) {
        if (!ThrowInFinallyRule.RULE_ID.equals(violation.ruleId())) {
            return Either.left(new FixError.NotFixable(violation.ruleId(), "not handled by " + getClass().getSimpleName()));
        }
        if (!violation.node().is(NodeKind.THROW_SITE)) {
            return Either.left(new FixError.NotFixable(violation.ruleId(), "violation does not point at a throw site"));
        }

        return Rewriter.locate(tree, violation.ruleId(), violation.path(), violation.node())
                       .map(target -> planFor(violation, tree));
    }

    private static RewritePlan planFor(Violation violation, Node tree) {
        var path = violation.path();
        var parentIsList = path.parent()
                               .flatMap(parentPath -> parentPath.resolve(tree))
                               .map(parent -> parent.kind().isStatementList())
                               .getOrElse(false);

        return parentIsList
               ? RewritePlan.delete(path, violation.node())
               : RewritePlan.replace(path, violation.node(), Nodes.noOp(violation.position()));
    }
}

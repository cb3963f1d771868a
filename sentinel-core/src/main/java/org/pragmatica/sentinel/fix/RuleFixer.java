package org.pragmatica.sentinel.fix;

import io.vavr.control.Either;
import org.pragmatica.sentinel.shared.SentinelError;
import org.pragmatica.sentinel.rule.Violation;
import org.pragmatica.sentinel.tree.Node;

/**
 * Companion of a rule that turns one of its violations into a rewrite plan.
 */
public interface RuleFixer {

    /**
     * Rule whose violations this fixer handles.
     */
    String ruleId();

    /**
     * Compute a minimal edit that removes the violation from {@code tree}.
     *
     * @return the plan, {@link FixError.StaleReference} if the violating node is no longer at its
     *         recorded position, or {@link FixError.NotFixable}
     */
    Either<SentinelError, RewritePlan> propose(Violation violation, Node tree);
}

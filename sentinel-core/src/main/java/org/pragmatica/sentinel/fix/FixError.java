package org.pragmatica.sentinel.fix;

import org.pragmatica.sentinel.shared.SentinelError;
import org.pragmatica.sentinel.tree.NodePath;

/// Reasons a fix cannot be proposed or applied. All of them are recoverable: the caller may skip
/// the fix and keep the diagnostic.
public sealed interface FixError extends SentinelError {

    /// The node a violation or plan refers to is no longer at its recorded position.
    record StaleReference(String ruleId, NodePath path) implements FixError {
        @Override
        public String message() {
            return "Stale " + ruleId + " reference: no matching node at " + path;
        }
    }

    /// Two plans touch the same node or one touches a subtree of the other.
    record Conflict(RewritePlan first, RewritePlan second) implements FixError {
        @Override
        public String message() {
            return "Conflicting rewrites at " + first.target() + " and " + second.target()
                   + "; apply one and re-run detection";
        }
    }

    /// The violation is not something this fixer knows how to rewrite.
    record NotFixable(String ruleId, String reason) implements FixError {
        @Override
        public String message() {
            return "Cannot fix " + ruleId + ": " + reason;
        }
    }
}

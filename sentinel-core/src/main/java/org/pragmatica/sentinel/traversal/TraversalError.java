package org.pragmatica.sentinel.traversal;

import org.pragmatica.sentinel.shared.SentinelError;
import org.pragmatica.sentinel.tree.NodePath;

/**
 * Failures of a tree traversal. A traversal that fails reports no partial "clean" result.
 */
public sealed interface TraversalError extends SentinelError {

    /**
     * The tree does not have the shape the walker expects, or it is deeper than the configured limit.
     */
    record MalformedTree(NodePath path, String reason) implements TraversalError {
        @Override
        public String message() {
            return "Malformed tree at " + path + ": " + reason;
        }
    }

    /**
     * The visit callback threw while handling the node at {@code path}.
     */
    record VisitorFailed(NodePath path, Throwable cause) implements TraversalError {
        @Override
        public String message() {
            return "Visitor failed at " + path + ": " + cause;
        }
    }

    static TraversalError malformedTree(NodePath path, String reason) {
        return new MalformedTree(path, reason);
    }
}

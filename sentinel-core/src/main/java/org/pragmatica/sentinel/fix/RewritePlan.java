package org.pragmatica.sentinel.fix;

import org.pragmatica.sentinel.tree.Node;
import org.pragmatica.sentinel.tree.NodePath;

/**
 * Structural edit that removes or replaces one node.
 * <p>
 * Plans carry the node they expect to find at {@link #target()}, so applying a plan to a tree that
 * has changed since it was computed is detected instead of corrupting an unrelated node.
 */
public sealed interface RewritePlan {

    NodePath target();

    /**
     * Node expected at {@link #target()}.
     */
    Node original();

    /**
     * Human-readable summary, used by fix previews.
     */
    String describe();

    record Replace(NodePath target, Node original, Node replacement) implements RewritePlan {
        @Override
        public String describe() {
            return "replace " + original.kind() + " '" + original.label() + "' at " + original.position()
                   + " with " + replacement.kind() + " '" + replacement.label() + "'";
        }
    }

    record Delete(NodePath target, Node original) implements RewritePlan {
        @Override
        public String describe() {
            return "delete " + original.kind() + " '" + original.label() + "' at " + original.position();
        }
    }

    static RewritePlan replace(NodePath target, Node original, Node replacement) {
        return new Replace(target, original, replacement);
    }

    static RewritePlan delete(NodePath target, Node original) {
        return new Delete(target, original);
    }
}

package org.pragmatica.sentinel.engine;

import org.pragmatica.sentinel.traversal.TreeWalker;

/**
 * Configuration for the rule engine.
 *
 * @param maxDepth trees nested deeper than this are reported as malformed instead of overflowing the stack
 */
public record EngineConfig(int maxDepth) {

    public static final EngineConfig DEFAULT = new EngineConfig(TreeWalker.DEFAULT_MAX_DEPTH);

    public static EngineConfig defaultConfig() {
        return DEFAULT;
    }

    public EngineConfig withMaxDepth(int maxDepth) {
        return new EngineConfig(maxDepth);
    }
}

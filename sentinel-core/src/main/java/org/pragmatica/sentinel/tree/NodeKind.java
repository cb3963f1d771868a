package org.pragmatica.sentinel.tree;

/// Closed set of node kinds the walker knows how to traverse.
///
/// Front ends map every construct of their source dialect onto one of these kinds.
/// Anything without structural meaning for the engine becomes [#OTHER].
public enum NodeKind {
    BLOCK,
    TRY_REGION,
    CATCH_CLAUSE,
    FINALLY_REGION,
    THROW_SITE,
    LAMBDA,
    OTHER;

    /// Kinds whose children form a plain statement list. Removing one child keeps the parent well formed.
    public boolean isStatementList() {
        return switch (this) {
            case BLOCK, CATCH_CLAUSE, FINALLY_REGION, LAMBDA -> true;
            case TRY_REGION, THROW_SITE, OTHER -> false;
        };
    }
}

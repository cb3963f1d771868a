package org.pragmatica.sentinel.traversal;

/// Region markers pushed by the walker while it is inside the corresponding construct.
public enum RegionKind {
    /// Children of a finally region.
    FINALLY,
    /// Children of a catch clause. Not part of the finally region of the same try.
    CATCH,
    /// Body of a lambda or closure.
    LAMBDA
}

package org.pragmatica.sentinel.frontend;

import org.pragmatica.sentinel.tree.Node;
import org.pragmatica.sentinel.tree.SourcePosition;

/// One executable body of a source file (method, constructor, initializer or field initializer),
/// analyzed as an independent tree.
///
/// @param name     display name, e.g. `Service.close(..)`
/// @param position start of the declaration
/// @param root     operation tree of the body
public record OperationBlock(String name, SourcePosition position, Node root) {

    public static OperationBlock operationBlock(String name, SourcePosition position, Node root) {
        return new OperationBlock(name, position, root);
    }
}

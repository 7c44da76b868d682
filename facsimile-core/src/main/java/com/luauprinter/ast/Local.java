package com.luauprinter.ast;

/**
 * A local variable binding. Bindings are shared between the declaring node and
 * every {@link LocalExpression} that refers to them.
 */
public record Local(
    String name,
    SourceLocation location,
    TypeAnnotation annotation  // Can be null
) {
}

package com.luauprinter.ast;

public record GenericTypeParameter(
    SourceLocation location,
    String name,
    TypeAnnotation defaultValue  // Can be null
) implements Node {
}

package com.luauprinter.ast;

public record SingletonBoolType(
    SourceLocation location,
    boolean value
) implements TypeAnnotation {
}

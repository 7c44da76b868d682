package com.luauprinter.ast;

public record SingletonStringType(
    SourceLocation location,
    String value
) implements TypeAnnotation {
}

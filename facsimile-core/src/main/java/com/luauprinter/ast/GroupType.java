package com.luauprinter.ast;

public record GroupType(
    SourceLocation location,
    TypeAnnotation type
) implements TypeAnnotation {
}

package com.luauprinter.ast;

public record TypeofType(
    SourceLocation location,
    Expression expr
) implements TypeAnnotation {
}

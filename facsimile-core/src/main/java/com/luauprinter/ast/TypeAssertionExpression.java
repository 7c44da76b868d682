package com.luauprinter.ast;

public record TypeAssertionExpression(
    SourceLocation location,
    Expression expr,
    TypeAnnotation annotation
) implements Expression {
}

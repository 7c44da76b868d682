package com.luauprinter.ast;

public record IndexExpression(
    SourceLocation location,
    Expression expr,
    Expression index
) implements Expression {
}

package com.luauprinter.ast;

public record UnaryExpression(
    SourceLocation location,
    UnaryOperator op,
    Expression expr
) implements Expression {
}

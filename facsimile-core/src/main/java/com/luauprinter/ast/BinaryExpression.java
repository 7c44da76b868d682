package com.luauprinter.ast;

public record BinaryExpression(
    SourceLocation location,
    BinaryOperator op,
    Expression left,
    Expression right
) implements Expression {
}

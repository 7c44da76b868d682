package com.luauprinter.ast;

public record NumberExpression(
    SourceLocation location,
    double value
) implements Expression {
}

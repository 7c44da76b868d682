package com.luauprinter.ast;

public record BooleanExpression(
    SourceLocation location,
    boolean value
) implements Expression {
}

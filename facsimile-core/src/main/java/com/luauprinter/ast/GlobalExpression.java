package com.luauprinter.ast;

public record GlobalExpression(
    SourceLocation location,
    String name
) implements Expression {
}

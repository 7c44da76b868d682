package com.luauprinter.ast;

public record GroupExpression(
    SourceLocation location,
    Expression expr
) implements Expression {
}

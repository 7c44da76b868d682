package com.luauprinter.ast;

public record LocalExpression(
    SourceLocation location,
    Local local,
    boolean upvalue
) implements Expression {
}

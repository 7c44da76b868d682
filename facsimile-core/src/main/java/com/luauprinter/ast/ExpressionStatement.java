package com.luauprinter.ast;

public record ExpressionStatement(
    SourceLocation location,
    Expression expr,
    boolean hasSemicolon
) implements Statement {
}

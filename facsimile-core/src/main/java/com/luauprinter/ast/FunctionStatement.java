package com.luauprinter.ast;

public record FunctionStatement(
    SourceLocation location,
    Expression name,
    FunctionExpression func,
    boolean hasSemicolon
) implements Statement {
}

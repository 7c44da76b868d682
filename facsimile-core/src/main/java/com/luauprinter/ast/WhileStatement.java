package com.luauprinter.ast;

public record WhileStatement(
    SourceLocation location,
    Expression condition,
    Block body,
    SourceLocation doLocation,
    boolean hasSemicolon
) implements Statement {
}

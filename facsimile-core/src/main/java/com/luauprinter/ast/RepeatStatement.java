package com.luauprinter.ast;

public record RepeatStatement(
    SourceLocation location,
    Block body,
    Expression condition,
    boolean hasSemicolon
) implements Statement {
}

package com.luauprinter.ast;

public record ContinueStatement(
    SourceLocation location,
    boolean hasSemicolon
) implements Statement {
}

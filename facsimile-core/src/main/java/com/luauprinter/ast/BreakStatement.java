package com.luauprinter.ast;

public record BreakStatement(
    SourceLocation location,
    boolean hasSemicolon
) implements Statement {
}

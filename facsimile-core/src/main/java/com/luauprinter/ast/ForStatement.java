package com.luauprinter.ast;

public record ForStatement(
    SourceLocation location,
    Local var,
    Expression from,
    Expression to,
    Expression step,  // Can be null
    Block body,
    SourceLocation doLocation,
    boolean hasSemicolon
) implements Statement {
}

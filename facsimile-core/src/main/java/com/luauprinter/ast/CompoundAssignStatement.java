package com.luauprinter.ast;

public record CompoundAssignStatement(
    SourceLocation location,
    BinaryOperator op,
    Expression var,
    Expression value,
    boolean hasSemicolon
) implements Statement {
}

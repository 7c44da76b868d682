package com.luauprinter.ast;

public record TypeFunctionStatement(
    SourceLocation location,
    String name,
    SourceLocation nameLocation,
    FunctionExpression body,
    boolean exported,
    boolean hasSemicolon
) implements Statement {
}

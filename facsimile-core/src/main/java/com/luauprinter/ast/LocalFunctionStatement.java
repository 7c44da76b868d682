package com.luauprinter.ast;

public record LocalFunctionStatement(
    SourceLocation location,
    Local name,
    FunctionExpression func,
    boolean hasSemicolon
) implements Statement {
}

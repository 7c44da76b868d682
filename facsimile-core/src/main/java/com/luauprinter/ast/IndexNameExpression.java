package com.luauprinter.ast;

import com.luauprinter.ast.SourceLocation.Position;

public record IndexNameExpression(
    SourceLocation location,
    Expression expr,
    String index,
    SourceLocation indexLocation,
    Position opPosition,
    char op
) implements Expression {
}

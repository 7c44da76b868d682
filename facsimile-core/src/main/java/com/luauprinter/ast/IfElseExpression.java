package com.luauprinter.ast;

public record IfElseExpression(
    SourceLocation location,
    Expression condition,
    Expression trueExpr,
    Expression falseExpr
) implements Expression {
}

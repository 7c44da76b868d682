package com.luauprinter.ast;

public record NilExpression(
    SourceLocation location
) implements Expression {
}

package com.luauprinter.ast;

public record VarargsExpression(
    SourceLocation location
) implements Expression {
}

package com.luauprinter.ast;

import java.util.List;

public record ErrorExpression(
    SourceLocation location,
    List<Expression> expressions,
    int messageIndex
) implements Expression {
}

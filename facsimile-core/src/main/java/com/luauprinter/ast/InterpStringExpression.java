package com.luauprinter.ast;

import java.util.List;

/**
 * An interpolated string {@code `a{b}c`}. There is always one more string
 * segment than there are expressions.
 */
public record InterpStringExpression(
    SourceLocation location,
    List<String> strings,
    List<Expression> expressions
) implements Expression {
}

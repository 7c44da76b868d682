package com.luauprinter.ast;

import java.util.List;

/**
 * A function or method call. For {@code a:b(c)} the callee is an
 * {@link IndexNameExpression} with op {@code ':'} and {@code self} is true.
 */
public record CallExpression(
    SourceLocation location,
    Expression func,
    List<Expression> args,
    boolean self,
    SourceLocation argLocation
) implements Expression {
}

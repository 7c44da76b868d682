package com.luauprinter.ast;

/**
 * An {@code if} statement. {@code elseBody} is either a {@link Block} for an
 * {@code else} branch or another {@code IfStatement} for an {@code elseif}.
 */
public record IfStatement(
    SourceLocation location,
    Expression condition,
    Block thenBody,
    Statement elseBody,            // Can be null
    SourceLocation thenLocation,   // Can be null
    SourceLocation elseLocation,   // Can be null
    boolean hasSemicolon
) implements Statement {
}

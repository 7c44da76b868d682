package com.luauprinter.ast;

import java.util.List;

/**
 * A sequence of statements. A block appearing directly in a statement list is a
 * {@code do ... end} statement.
 */
public record Block(
    SourceLocation location,
    List<Statement> body,
    boolean hasSemicolon
) implements Statement {
}

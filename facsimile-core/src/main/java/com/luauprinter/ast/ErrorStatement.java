package com.luauprinter.ast;

import java.util.List;

/**
 * Placeholder for a statement that failed to parse. Carries whatever
 * sub-expressions and sub-statements were recovered.
 */
public record ErrorStatement(
    SourceLocation location,
    List<Expression> expressions,
    List<Statement> statements,
    int messageIndex,
    boolean hasSemicolon
) implements Statement {
}

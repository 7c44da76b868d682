package com.luauprinter.ast;

/**
 * A string constant. {@code value} holds the decoded contents; the spelling in
 * the source (quotes, escapes, long brackets) is only available from the CST.
 */
public record StringExpression(
    SourceLocation location,
    String value
) implements Expression {
}

package com.luauprinter;

import com.luauprinter.ast.SourceLocation;
import com.luauprinter.cst.QuoteStyle;

/**
 * A lexical token.
 *
 * @param lexeme  the source text of the token; for strings, the text between the delimiters
 * @param literal the decoded value of a string, or the error message of an {@link TokenType#ERROR} token
 * @param quoteStyle the delimiters of a string, null for other tokens
 * @param depth   the number of {@code =} signs of a long bracket string
 */
public record Token(
    TokenType type,
    String lexeme,
    String literal,
    SourceLocation location,
    QuoteStyle quoteStyle,
    int depth
) {

    public Token(TokenType type, String lexeme, SourceLocation location) {
        this(type, lexeme, null, location, null, 0);
    }

    public SourceLocation.Position start() {
        return location.start();
    }

    public SourceLocation.Position end() {
        return location.end();
    }

    /**
     * How the token reads in an error message.
     */
    public String describe() {
        return switch (type) {
            case EOF -> "<eof>";
            case STRING, RAW_STRING -> "string";
            case INTERP_BEGIN, INTERP_MID, INTERP_END, INTERP_SIMPLE -> "interpolated string";
            case ERROR -> "invalid token";
            default -> "'" + lexeme + "'";
        };
    }
}

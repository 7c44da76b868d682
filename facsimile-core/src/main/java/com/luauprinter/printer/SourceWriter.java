package com.luauprinter.printer;

import com.luauprinter.ast.SourceLocation.Position;
import com.luauprinter.cst.QuoteStyle;

/**
 * Token sink used by the {@link Printer}. Implementations track the position
 * of the next character so that the printer can place tokens at recorded
 * source positions.
 */
public interface SourceWriter {

    /**
     * Moves to {@code target} by writing newlines and then spaces. Does nothing
     * when the writer is already at or past the target.
     */
    void advance(Position target);

    void newline();

    void space();

    /**
     * Writes a single space if the current column plus {@code reserve} is still
     * short of {@code next}'s column.
     */
    void maybeSpace(Position next, int reserve);

    void write(String text);

    void identifier(String name);

    void keyword(String keyword);

    void symbol(String symbol);

    void literal(String literal);

    /**
     * Writes a string constant with canonical quoting and escaping.
     */
    void string(String value);

    /**
     * Writes a string constant exactly as it was spelled in the source.
     */
    void sourceString(String sourceText, QuoteStyle quoteStyle, int depth);

    Position position();

    char lastChar();
}

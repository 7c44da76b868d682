package com.luauprinter.printer;

import com.luauprinter.InternalConsistencyException;
import com.luauprinter.ast.SourceLocation.Position;
import com.luauprinter.cst.QuoteStyle;

public class StringSourceWriter implements SourceWriter {

    private final StringBuilder out = new StringBuilder();
    private int line;
    private int column;
    // Decides whether an extra space is needed to keep adjacent tokens apart.
    private char lastChar = '\0';
    // Set while the most recent output is a number literal.
    private boolean lastWasNumber;

    public StringSourceWriter() {
        this(Position.ORIGIN);
    }

    public StringSourceWriter(Position start) {
        this.line = start.line();
        this.column = start.column();
    }

    public String str() {
        return out.toString();
    }

    @Override
    public Position position() {
        return new Position(line, column);
    }

    @Override
    public char lastChar() {
        return lastChar;
    }

    @Override
    public void advance(Position target) {
        while (line < target.line()) {
            newline();
        }
        if (line == target.line() && column < target.column()) {
            write(" ".repeat(target.column() - column));
        }
    }

    @Override
    public void maybeSpace(Position next, int reserve) {
        if (column + reserve < next.column()) {
            space();
        }
    }

    @Override
    public void newline() {
        out.append('\n');
        line++;
        column = 0;
        lastChar = '\n';
        lastWasNumber = false;
    }

    @Override
    public void space() {
        out.append(' ');
        column++;
        lastChar = ' ';
        lastWasNumber = false;
    }

    @Override
    public void write(String text) {
        if (text.isEmpty()) {
            return;
        }
        out.append(text);
        int lastNewline = text.lastIndexOf('\n');
        if (lastNewline < 0) {
            column += text.length();
        } else {
            for (int i = 0; i <= lastNewline; i++) {
                if (text.charAt(i) == '\n') {
                    line++;
                }
            }
            column = text.length() - lastNewline - 1;
        }
        lastChar = text.charAt(text.length() - 1);
        lastWasNumber = false;
    }

    private void write(char c) {
        write(String.valueOf(c));
    }

    @Override
    public void identifier(String name) {
        if (name.isEmpty()) {
            return;
        }
        if (isIdentifierChar(lastChar)) {
            space();
        }
        write(name);
    }

    @Override
    public void keyword(String keyword) {
        if (keyword.isEmpty()) {
            return;
        }
        if (isIdentifierChar(lastChar)) {
            space();
        }
        write(keyword);
    }

    @Override
    public void symbol(String symbol) {
        if (symbol.isEmpty()) {
            return;
        }
        // "1" followed by ".x" would re-lex as the number "1."
        if (lastWasNumber && symbol.charAt(0) == '.') {
            space();
        }
        write(symbol);
    }

    @Override
    public void literal(String literal) {
        if (literal.isEmpty()) {
            return;
        }
        if (isIdentifierChar(lastChar) && isDigit(literal.charAt(0))) {
            space();
        }
        write(literal);
        lastWasNumber = true;
    }

    @Override
    public void string(String value) {
        char quote = value.indexOf('\'') >= 0 ? '"' : '\'';
        write(quote);
        write(StringEscaper.escape(value, quote));
        write(quote);
    }

    @Override
    public void sourceString(String sourceText, QuoteStyle quoteStyle, int depth) {
        if (quoteStyle == QuoteStyle.RAW) {
            String fence = "=".repeat(depth);
            write("[" + fence + "[");
            write(sourceText);
            write("]" + fence + "]");
            return;
        }
        if (depth != 0) {
            throw new InternalConsistencyException("long bracket depth " + depth + " on a " + quoteStyle + " string");
        }
        write(quoteStyle.quote());
        write(sourceText);
        write(quoteStyle.quote());
    }

    static boolean isIdentifierStartChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isIdentifierChar(char c) {
        return isIdentifierStartChar(c) || isDigit(c);
    }
}

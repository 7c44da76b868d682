package com.luauprinter;

import com.luauprinter.ast.SourceLocation;
import com.luauprinter.ast.SourceLocation.Position;
import com.luauprinter.cst.QuoteStyle;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Splits Luau source into tokens. Comments and whitespace are skipped.
 *
 * <p>A lexical error does not throw: tokenizing stops with an
 * {@link TokenType#ERROR} token so that an earlier syntax error is still
 * reported first.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        entry("and", TokenType.AND),
        entry("break", TokenType.BREAK),
        entry("do", TokenType.DO),
        entry("else", TokenType.ELSE),
        entry("elseif", TokenType.ELSEIF),
        entry("end", TokenType.END),
        entry("false", TokenType.FALSE),
        entry("for", TokenType.FOR),
        entry("function", TokenType.FUNCTION),
        entry("if", TokenType.IF),
        entry("in", TokenType.IN),
        entry("local", TokenType.LOCAL),
        entry("nil", TokenType.NIL),
        entry("not", TokenType.NOT),
        entry("or", TokenType.OR),
        entry("repeat", TokenType.REPEAT),
        entry("return", TokenType.RETURN),
        entry("then", TokenType.THEN),
        entry("true", TokenType.TRUE),
        entry("until", TokenType.UNTIL),
        entry("while", TokenType.WHILE)
    );

    // Longest first
    private static final String[] SYMBOLS = {
        "...", "..=", "//=",
        "..", "//", "==", "~=", "<=", ">=", "->", "::",
        "+=", "-=", "*=", "/=", "%=", "^=",
        "+", "-", "*", "/", "%", "^", "#", "=", "<", ">",
        "(", ")", "{", "}", "[", "]", ";", ":", ",", ".", "|", "&", "?"
    };

    private static final Map<String, TokenType> SYMBOL_TYPES = Map.ofEntries(
        entry("...", TokenType.DOT3),
        entry("..=", TokenType.CONCAT_ASSIGN),
        entry("//=", TokenType.DOUBLE_SLASH_ASSIGN),
        entry("..", TokenType.DOT2),
        entry("//", TokenType.DOUBLE_SLASH),
        entry("==", TokenType.EQ),
        entry("~=", TokenType.NE),
        entry("<=", TokenType.LE),
        entry(">=", TokenType.GE),
        entry("->", TokenType.ARROW),
        entry("::", TokenType.DOUBLE_COLON),
        entry("+=", TokenType.PLUS_ASSIGN),
        entry("-=", TokenType.MINUS_ASSIGN),
        entry("*=", TokenType.STAR_ASSIGN),
        entry("/=", TokenType.SLASH_ASSIGN),
        entry("%=", TokenType.PERCENT_ASSIGN),
        entry("^=", TokenType.CARET_ASSIGN),
        entry("+", TokenType.PLUS),
        entry("-", TokenType.MINUS),
        entry("*", TokenType.STAR),
        entry("/", TokenType.SLASH),
        entry("%", TokenType.PERCENT),
        entry("^", TokenType.CARET),
        entry("#", TokenType.HASH),
        entry("=", TokenType.ASSIGN),
        entry("<", TokenType.LT),
        entry(">", TokenType.GT),
        entry("(", TokenType.LPAREN),
        entry(")", TokenType.RPAREN),
        entry("{", TokenType.LBRACE),
        entry("}", TokenType.RBRACE),
        entry("[", TokenType.LBRACKET),
        entry("]", TokenType.RBRACKET),
        entry(";", TokenType.SEMICOLON),
        entry(":", TokenType.COLON),
        entry(",", TokenType.COMMA),
        entry(".", TokenType.DOT),
        entry("|", TokenType.PIPE),
        entry("&", TokenType.AMPERSAND),
        entry("?", TokenType.QUESTION)
    );

    private final String source;
    private int pos;
    private int line;
    private int column;

    // One entry per open brace: true when the brace belongs to an interpolated string
    private final Deque<Boolean> braces = new ArrayDeque<>();

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            Position start = position();
            try {
                skipWhitespaceAndComments();
                start = position();
                Token token = nextToken();
                tokens.add(token);
                if (token.type() == TokenType.EOF) {
                    return tokens;
                }
            } catch (ParseException e) {
                tokens.add(new Token(TokenType.ERROR, "", e.getMessage(), e.location(), null, 0));
                tokens.add(new Token(TokenType.EOF, "", new SourceLocation(start, start)));
                return tokens;
            }
        }
    }

    // ========================================================================
    // Tokens
    // ========================================================================

    private Token nextToken() {
        Position start = position();
        if (isAtEnd()) {
            return new Token(TokenType.EOF, "", new SourceLocation(start, start));
        }

        char c = peek();
        if (isNameStart(c)) {
            return name(start);
        }
        if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
            return number(start);
        }
        if (c == '"' || c == '\'') {
            return quotedString(start, c);
        }
        if (c == '[' && (peek(1) == '[' || peek(1) == '=')) {
            return longString(start);
        }
        if (c == '`') {
            advanceChar();
            return interpolatedSegment(start, true);
        }
        if (c == '}' && Boolean.TRUE.equals(braces.peek())) {
            braces.pop();
            advanceChar();
            return interpolatedSegment(start, false);
        }
        if (c == '{') {
            braces.push(false);
        } else if (c == '}' && !braces.isEmpty()) {
            braces.pop();
        }
        return symbol(start);
    }

    private Token name(Position start) {
        int begin = pos;
        while (!isAtEnd() && isNameChar(peek())) {
            advanceChar();
        }
        String text = source.substring(begin, pos);
        TokenType type = KEYWORDS.getOrDefault(text, TokenType.NAME);
        return new Token(type, text, span(start));
    }

    private Token number(Position start) {
        int begin = pos;
        do {
            advanceChar();
        } while (!isAtEnd() && (isDigit(peek()) || peek() == '.' || peek() == '_'));
        if (!isAtEnd() && (peek() == 'e' || peek() == 'E')) {
            advanceChar();
            if (!isAtEnd() && (peek() == '+' || peek() == '-')) {
                advanceChar();
            }
        }
        while (!isAtEnd() && isNameChar(peek())) {
            advanceChar();
        }
        return new Token(TokenType.NUMBER, source.substring(begin, pos), span(start));
    }

    private Token symbol(Position start) {
        for (String symbol : SYMBOLS) {
            if (source.startsWith(symbol, pos)) {
                for (int i = 0; i < symbol.length(); i++) {
                    advanceChar();
                }
                return new Token(SYMBOL_TYPES.get(symbol), symbol, span(start));
            }
        }
        char c = advanceChar();
        throw new ParseException("Unexpected character '" + c + "'", span(start));
    }

    // ========================================================================
    // Strings
    // ========================================================================

    private Token quotedString(Position start, char quote) {
        advanceChar();
        int begin = pos;
        StringBuilder value = new StringBuilder();
        while (true) {
            if (isAtEnd() || peek() == '\n' || peek() == '\r') {
                throw new ParseException("Malformed string; did you forget to finish it?", span(start));
            }
            char c = advanceChar();
            if (c == quote) {
                break;
            }
            if (c == '\\') {
                escape(value, start);
            } else {
                value.append(c);
            }
        }
        String raw = source.substring(begin, pos - 1);
        QuoteStyle style = quote == '\'' ? QuoteStyle.SINGLE : QuoteStyle.DOUBLE;
        return new Token(TokenType.STRING, raw, value.toString(), span(start), style, 0);
    }

    private Token longString(Position start) {
        int depth = longBracketDepth();
        if (depth < 0) {
            if (peek(1) == '=') {
                advanceChar();
                throw new ParseException("Invalid long string delimiter", span(start));
            }
            return symbol(start);
        }
        String body = longBracketBody(depth, start, "string");
        return new Token(TokenType.RAW_STRING, body, stripFirstNewline(body), span(start), QuoteStyle.RAW, depth);
    }

    /**
     * Counts the {@code =} signs of a long bracket opening at the current
     * position without consuming anything; -1 when there is no long bracket.
     */
    private int longBracketDepth() {
        if (peek() != '[') {
            return -1;
        }
        int depth = 0;
        while (peek(1 + depth) == '=') {
            depth++;
        }
        return peek(1 + depth) == '[' ? depth : -1;
    }

    private String longBracketBody(int depth, Position start, String what) {
        for (int i = 0; i < depth + 2; i++) {
            advanceChar();
        }
        int begin = pos;
        String close = "]" + "=".repeat(depth) + "]";
        while (!source.startsWith(close, pos)) {
            if (isAtEnd()) {
                throw new ParseException("Unfinished long " + what, span(start));
            }
            advanceChar();
        }
        String body = source.substring(begin, pos);
        for (int i = 0; i < close.length(); i++) {
            advanceChar();
        }
        return body;
    }

    private static String stripFirstNewline(String body) {
        if (body.startsWith("\r\n") || body.startsWith("\n\r")) {
            return body.substring(2);
        }
        if (body.startsWith("\n") || body.startsWith("\r")) {
            return body.substring(1);
        }
        return body;
    }

    /**
     * Reads one segment of an interpolated string, after its opening
     * {@code `} or {@code }}, up to and including the {@code {} or closing
     * {@code `}.
     */
    private Token interpolatedSegment(Position start, boolean first) {
        int begin = pos;
        StringBuilder value = new StringBuilder();
        while (true) {
            if (isAtEnd() || peek() == '\n' || peek() == '\r') {
                throw new ParseException("Malformed interpolated string; did you forget to add a '`'?",
                    span(start));
            }
            char c = advanceChar();
            if (c == '`') {
                String raw = source.substring(begin, pos - 1);
                TokenType type = first ? TokenType.INTERP_SIMPLE : TokenType.INTERP_END;
                return new Token(type, raw, value.toString(), span(start), QuoteStyle.INTERP, 0);
            }
            if (c == '{') {
                if (peek() == '{') {
                    throw new ParseException("Double braces are not permitted within interpolated strings; "
                        + "did you mean '\\{'?", span(start));
                }
                braces.push(true);
                String raw = source.substring(begin, pos - 1);
                TokenType type = first ? TokenType.INTERP_BEGIN : TokenType.INTERP_MID;
                return new Token(type, raw, value.toString(), span(start), QuoteStyle.INTERP, 0);
            }
            if (c == '\\') {
                escape(value, start);
            } else {
                value.append(c);
            }
        }
    }

    /**
     * Decodes the escape sequence after a backslash.
     */
    private void escape(StringBuilder value, Position start) {
        if (isAtEnd()) {
            throw new ParseException("Malformed string; did you forget to finish it?", span(start));
        }
        char c = advanceChar();
        switch (c) {
            case 'n' -> value.append('\n');
            case 't' -> value.append('\t');
            case 'r' -> value.append('\r');
            case 'a' -> value.append('\u0007');
            case 'b' -> value.append('\b');
            case 'f' -> value.append('\f');
            case 'v' -> value.append('\u000B');
            case '\n' -> {
                value.append('\n');
                if (peek() == '\r') {
                    advanceChar();
                }
            }
            case '\r' -> {
                value.append('\n');
                if (peek() == '\n') {
                    advanceChar();
                }
            }
            case 'z' -> {
                while (!isAtEnd() && Character.isWhitespace(peek())) {
                    advanceChar();
                }
            }
            case 'x' -> {
                int code = 0;
                for (int i = 0; i < 2; i++) {
                    int digit = isAtEnd() ? -1 : Character.digit(peek(), 16);
                    if (digit < 0) {
                        throw new ParseException("Invalid hexadecimal escape sequence", span(start));
                    }
                    advanceChar();
                    code = code * 16 + digit;
                }
                value.append((char) code);
            }
            case 'u' -> {
                if (peek() != '{') {
                    throw new ParseException("Invalid Unicode escape sequence", span(start));
                }
                advanceChar();
                int code = 0;
                int digits = 0;
                while (!isAtEnd() && Character.digit(peek(), 16) >= 0) {
                    code = code * 16 + Character.digit(advanceChar(), 16);
                    digits++;
                    if (code > 0x10FFFF) {
                        throw new ParseException("Unicode escape sequence is out of range", span(start));
                    }
                }
                if (digits == 0 || peek() != '}') {
                    throw new ParseException("Invalid Unicode escape sequence", span(start));
                }
                advanceChar();
                value.appendCodePoint(code);
            }
            default -> {
                if (isDigit(c)) {
                    int code = c - '0';
                    for (int i = 0; i < 2 && !isAtEnd() && isDigit(peek()); i++) {
                        code = code * 10 + (advanceChar() - '0');
                    }
                    if (code > 255) {
                        throw new ParseException("Invalid decimal escape sequence", span(start));
                    }
                    value.append((char) code);
                } else {
                    value.append(c);
                }
            }
        }
    }

    // ========================================================================
    // Whitespace and comments
    // ========================================================================

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == '\u000B') {
                advanceChar();
            } else if (c == '-' && peek(1) == '-') {
                Position start = position();
                advanceChar();
                advanceChar();
                int depth = longBracketDepth();
                if (depth >= 0) {
                    longBracketBody(depth, start, "comment");
                } else {
                    while (!isAtEnd() && peek() != '\n') {
                        advanceChar();
                    }
                }
            } else {
                return;
            }
        }
    }

    // ========================================================================
    // Characters
    // ========================================================================

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private char peek() {
        return peek(0);
    }

    private char peek(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private char advanceChar() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 0;
        } else {
            column++;
        }
        return c;
    }

    private Position position() {
        return new Position(line, column);
    }

    private SourceLocation span(Position start) {
        return new SourceLocation(start, position());
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isNameStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isNameChar(char c) {
        return isNameStart(c) || isDigit(c);
    }
}

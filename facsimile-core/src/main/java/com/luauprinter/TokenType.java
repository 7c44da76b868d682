package com.luauprinter;

public enum TokenType {
    // Literals and names
    NAME,
    NUMBER,
    STRING,
    RAW_STRING,
    INTERP_BEGIN,
    INTERP_MID,
    INTERP_END,
    INTERP_SIMPLE,

    // Keywords
    AND, BREAK, DO, ELSE, ELSEIF, END, FALSE, FOR, FUNCTION, IF, IN,
    LOCAL, NIL, NOT, OR, REPEAT, RETURN, THEN, TRUE, UNTIL, WHILE,

    // Operators
    PLUS, MINUS, STAR, SLASH, DOUBLE_SLASH, PERCENT, CARET, HASH,
    DOT, DOT2, DOT3,
    EQ, NE, LE, GE, LT, GT,
    ASSIGN,
    PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN, DOUBLE_SLASH_ASSIGN,
    PERCENT_ASSIGN, CARET_ASSIGN, CONCAT_ASSIGN,
    ARROW, DOUBLE_COLON,

    // Punctuation
    LPAREN, RPAREN, LBRACE, RBRACE, LBRACKET, RBRACKET,
    SEMICOLON, COLON, COMMA, PIPE, AMPERSAND, QUESTION,

    // A lexical error; the token's literal holds the message
    ERROR,
    EOF
}

package com.luauprinter;

import com.luauprinter.ast.SourceLocation;
import com.luauprinter.cst.QuoteStyle;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<TokenType> types(String source) {
        return new Lexer(source).tokenize().stream().map(Token::type).collect(Collectors.toList());
    }

    @Test
    void testSymbolsUseLongestMatch() {
        assertEquals(
            List.of(TokenType.NAME, TokenType.DOT2, TokenType.DOT3, TokenType.CONCAT_ASSIGN,
                TokenType.DOUBLE_SLASH, TokenType.DOUBLE_COLON, TokenType.ARROW, TokenType.EOF),
            types("a .. ... ..= // :: ->"));
    }

    @Test
    void testCommentsAreSkipped() {
        assertEquals(List.of(TokenType.LOCAL, TokenType.NAME, TokenType.EOF),
            types("--[==[ long\ncomment ]==] local -- trailing\nx"));
    }

    @Test
    void testQuotedStringKeepsSourceAndValue() {
        Token token = new Lexer("'a\\tb'").tokenize().get(0);

        assertEquals(TokenType.STRING, token.type());
        assertEquals("a\\tb", token.lexeme());
        assertEquals("a\tb", token.literal());
        assertEquals(QuoteStyle.SINGLE, token.quoteStyle());
        assertEquals(SourceLocation.of(0, 0, 0, 6), token.location());
    }

    @Test
    void testLongStringDropsLeadingNewlineFromValue() {
        Token token = new Lexer("[==[\ntext]]]==]").tokenize().get(0);

        assertEquals(TokenType.RAW_STRING, token.type());
        assertEquals(2, token.depth());
        assertEquals(QuoteStyle.RAW, token.quoteStyle());
        assertEquals("\ntext]]", token.lexeme());
        assertEquals("text]]", token.literal());
    }

    @Test
    void testInterpolatedStringSegments() {
        assertEquals(
            List.of(TokenType.INTERP_BEGIN, TokenType.NAME, TokenType.INTERP_MID, TokenType.LBRACE,
                TokenType.RBRACE, TokenType.INTERP_END, TokenType.EOF),
            types("`a{x}b{ {} }c`"));
        assertEquals(List.of(TokenType.INTERP_SIMPLE, TokenType.EOF), types("`plain`"));
    }

    @Test
    void testNumbers() {
        List<Token> tokens = new Lexer("0x1F 1e-3 1_000 .5").tokenize();

        assertEquals("0x1F", tokens.get(0).lexeme());
        assertEquals("1e-3", tokens.get(1).lexeme());
        assertEquals("1_000", tokens.get(2).lexeme());
        assertEquals(".5", tokens.get(3).lexeme());
    }

    @Test
    void testUnfinishedStringBecomesErrorToken() {
        List<Token> tokens = new Lexer("local s = 'abc\nx").tokenize();
        Token error = tokens.get(tokens.size() - 2);

        assertEquals(TokenType.ERROR, error.type());
        assertEquals("Malformed string; did you forget to finish it?", error.literal());
        assertEquals(TokenType.EOF, tokens.get(tokens.size() - 1).type());
    }
}

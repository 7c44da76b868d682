package com.luauprinter.printer;

import com.luauprinter.InternalConsistencyException;
import com.luauprinter.ast.SourceLocation.Position;
import com.luauprinter.cst.QuoteStyle;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class StringSourceWriterTest {

    @Test
    void testAdvanceToLaterLineAndColumn() {
        StringSourceWriter writer = new StringSourceWriter();
        writer.keyword("local");
        writer.advance(new Position(2, 4));
        writer.identifier("x");

        assertEquals("local\n\n    x", writer.str());
        assertEquals(new Position(2, 5), writer.position());
    }

    @Test
    void testAdvanceNeverMovesBackwards() {
        StringSourceWriter writer = new StringSourceWriter();
        writer.write("abcdef");
        writer.advance(new Position(0, 2));

        assertEquals("abcdef", writer.str());
    }

    @Test
    void testAdjacentWordsAreSeparated() {
        StringSourceWriter writer = new StringSourceWriter();
        writer.keyword("return");
        writer.identifier("x");
        writer.keyword("and");
        writer.literal("1");

        assertEquals("return x and 1", writer.str());
    }

    @Test
    void testNumberFollowedByDotGetsSpace() {
        StringSourceWriter writer = new StringSourceWriter();
        writer.literal("1");
        writer.symbol(".");

        assertEquals("1 .", writer.str());
    }

    @Test
    void testNameEndingInDigitFollowedByDot() {
        StringSourceWriter writer = new StringSourceWriter();
        writer.identifier("v2");
        writer.symbol(".");
        writer.identifier("y");
        writer.symbol("..");

        assertEquals("v2.y..", writer.str());
    }

    @Test
    void testNumberGuardEndsAtNextToken() {
        StringSourceWriter writer = new StringSourceWriter();
        writer.literal("1");
        writer.space();
        writer.symbol("..");

        assertEquals("1 ..", writer.str());
    }

    @Test
    void testMultilineWriteTracksPosition() {
        StringSourceWriter writer = new StringSourceWriter(new Position(3, 2));
        writer.write("ab\ncde");

        assertEquals(new Position(4, 3), writer.position());
    }

    @Test
    void testCanonicalStringPicksQuote() {
        StringSourceWriter plain = new StringSourceWriter();
        plain.string("a \"b\" c");
        assertEquals("'a \"b\" c'", plain.str());

        StringSourceWriter apostrophe = new StringSourceWriter();
        apostrophe.string("it's");
        assertEquals("\"it's\"", apostrophe.str());
    }

    @Test
    void testSourceStringLongBrackets() {
        StringSourceWriter writer = new StringSourceWriter();
        writer.sourceString("text", QuoteStyle.RAW, 2);

        assertEquals("[==[text]==]", writer.str());
    }

    @Test
    void testSourceStringRejectsDepthOnQuotedString() {
        StringSourceWriter writer = new StringSourceWriter();

        assertThrows(InternalConsistencyException.class,
            () -> writer.sourceString("text", QuoteStyle.DOUBLE, 1));
    }
}

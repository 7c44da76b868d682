package com.luauprinter;

import com.luauprinter.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static ParseError firstError(String source) {
        ParseResult result = Parser.parse(source);
        assertTrue(result.hasErrors(), "expected a syntax error in: " + source);
        assertNull(result.root());
        return result.errors().get(0);
    }

    @Test
    void testMissingExpression() {
        ParseError error = firstError("local x = ");

        assertEquals("Expected identifier when parsing expression, got <eof>", error.message());
        assertEquals(SourceLocation.of(0, 10, 0, 10), error.location());
    }

    @Test
    void testUnclosedBlockNamesOpeningKeyword() {
        assertEquals("Expected 'end' (to close 'if' at column 1), got <eof>",
            firstError("if x then y() ").message());
        assertEquals("Expected 'end' (to close 'function' at line 1), got <eof>",
            firstError("function f()\n  return 1\n").message());
    }

    @Test
    void testIncompleteStatement() {
        assertEquals("Incomplete statement: expected assignment or a function call", firstError("x").message());
    }

    @Test
    @DisplayName("A syntax error before a lexical error is reported first")
    void testEarlierSyntaxErrorWins() {
        ParseError error = firstError("local = 1 'unterminated");

        assertEquals("Expected identifier when parsing variable name, got '='", error.message());
        assertEquals(SourceLocation.of(0, 6, 0, 7), error.location());
    }

    @Test
    void testLexicalErrorLocation() {
        ParseError error = firstError("local a = 1\nlocal s = 'abc\n");

        assertEquals("Malformed string; did you forget to finish it?", error.message());
        assertEquals(1, error.location().start().line());
        assertEquals(10, error.location().start().column());
    }

    @Test
    void testVarargsOutsideVarargFunction() {
        assertEquals("Cannot use '...' outside of a vararg function",
            firstError("function f() return ... end").message());
        assertFalse(Parser.parse("function f(...) return ... end").hasErrors());
        assertFalse(Parser.parse("return ...").hasErrors());
    }

    @Test
    void testAmbiguousCallOnNewLine() {
        assertTrue(firstError("local x = f\n(g)()").message().startsWith("Ambiguous syntax"));
    }

    @Test
    void testMixedUnionAndIntersection() {
        assertTrue(firstError("type T = a | b & c").message().startsWith("Mixing union and intersection types"));
    }

    @Test
    void testMalformedNumber() {
        assertEquals("Malformed number", firstError("local n = 1.2.3").message());
    }

    @Test
    void testLocalsAreResolvedToTheirBinding() {
        ParseResult result = Parser.parse("local a = 1\nreturn a, b");
        assertFalse(result.hasErrors());

        LocalStatement local = (LocalStatement) result.root().body().get(0);
        ReturnStatement ret = (ReturnStatement) result.root().body().get(1);
        LocalExpression a = (LocalExpression) ret.list().get(0);

        assertSame(local.vars().get(0), a.local());
        assertFalse(a.upvalue());
        assertInstanceOf(GlobalExpression.class, ret.list().get(1));
    }

    @Test
    void testUpvalueFlag() {
        ParseResult result = Parser.parse("local a = 1\nlocal function f() return a end");
        LocalFunctionStatement function = (LocalFunctionStatement) result.root().body().get(1);
        ReturnStatement ret = (ReturnStatement) function.func().body().body().get(0);

        assertTrue(((LocalExpression) ret.list().get(0)).upvalue());
    }

    @Test
    void testRootSpansWholeSource() {
        ParseResult result = Parser.parse("local x = 1\n\n");

        assertEquals(SourceLocation.of(0, 0, 2, 0), result.root().location());
    }

    @Test
    void testConcreteSyntaxIsOptional() {
        ParseResult withCst = Parser.parse("local x = 'a'");
        ParseResult withoutCst = Parser.parse("local x = 'a'", ParseOptions.withoutCst());

        assertTrue(withCst.cstNodeMap().isEnabled());
        assertTrue(withCst.cstNodeMap().size() > 0);
        assertFalse(withoutCst.cstNodeMap().isEnabled());
        assertEquals(withCst.root(), withoutCst.root());
    }

    @Test
    void testBinaryPrecedence() {
        ParseResult result = Parser.parse("return 1 + 2 * 3 ^ 2 .. 'x'");
        ReturnStatement ret = (ReturnStatement) result.root().body().get(0);
        BinaryExpression concat = (BinaryExpression) ret.list().get(0);

        assertEquals(BinaryOperator.CONCAT, concat.op());
        BinaryExpression add = (BinaryExpression) concat.left();
        assertEquals(BinaryOperator.ADD, add.op());
        BinaryExpression mul = (BinaryExpression) add.right();
        assertEquals(BinaryOperator.MUL, mul.op());
        assertEquals(BinaryOperator.POW, ((BinaryExpression) mul.right()).op());
    }
}

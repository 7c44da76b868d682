package com.luauprinter;

import com.luauprinter.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TranspilerTest {

    private static String exact(String source) {
        TranspileResult result = Transpiler.transpile(source, ParseOptions.defaults(), true);
        assertTrue(result.isSuccess(), () -> "parse failed: " + result.parseError());
        return result.code();
    }

    private static String canonical(String source) {
        ParseResult parsed = Parser.parse(source, ParseOptions.withoutCst());
        assertFalse(parsed.hasErrors(), () -> "parse failed: " + parsed.errors());
        return Transpiler.transpileWithTypes(parsed.root());
    }

    private static void assertRoundTrip(String source) {
        assertEquals(source, exact(source));
    }

    @Test
    void testStatementsRoundTrip() {
        assertRoundTrip("local x = 1");
        assertRoundTrip("local a, b = 1, 2\na, b = b, a");
        assertRoundTrip("x += 1\ny ..= 'z'\nz //= 2");
        assertRoundTrip("while x do\n  x = x - 1\nend");
        assertRoundTrip("repeat\n  local y = 1\nuntil y");
        assertRoundTrip("for i = 1, 10, 2 do\n  print(i)\nend");
        assertRoundTrip("for k, v in pairs(t) do\n  break\nend");
        assertRoundTrip("do\n  return\nend");
        assertRoundTrip("if a then\n  f()\nelseif b then\n  g()\nelse\n  h()\nend");
        assertRoundTrip("local function f(a, b, ...)\n  return a + b\nend");
        assertRoundTrip("function t.a.b:method(x)\n  return self, x\nend");
    }

    @Test
    void testIrregularSpacingIsKept() {
        assertRoundTrip("local   x   =   1");
        assertRoundTrip("x = { 1 ,2 ,  3 }");
        assertRoundTrip("f ( a , b )");
        assertRoundTrip("local t = a [ 1 ] . b");
        assertRoundTrip("return   1  +  2");
    }

    @Test
    @DisplayName("Names ending in a digit are followed directly by dots")
    void testDigitNamesBeforeDots() {
        assertRoundTrip("local x = v2.y");
        assertRoundTrip("local v = a.b1.c");
        assertRoundTrip("local v = x1..y");
        assertRoundTrip("type Fn = <P1...>(P1...) -> P1...");
        assertRoundTrip("type T<A1...> = (A1...) -> ()");
        assertRoundTrip("local t = a1[1].b2:c3(d4)");
    }

    @Test
    void testNumberBeforeDotIsSeparated() {
        NumberExpression one = new NumberExpression(SourceLocation.NONE, 1);
        IndexNameExpression index = new IndexNameExpression(SourceLocation.NONE, one, "x", SourceLocation.NONE,
            null, '.');
        BinaryExpression concat = new BinaryExpression(SourceLocation.NONE, BinaryOperator.CONCAT, one,
            new StringExpression(SourceLocation.NONE, "a"));

        assertEquals("1 .x", Transpiler.toString(index));
        assertEquals("1 ..'a'", Transpiler.toString(concat));
    }

    @Test
    void testCanonicalTableTypeIndexer() {
        String printed = canonical("type M = {x: number, [string]: any}");

        assertTrue(printed.contains("{x: number, [string]: any}"), printed);
    }

    @Test
    void testSemicolons() {
        assertRoundTrip("local x = 1; local y = 2;");
        assertRoundTrip("f(); g()");
    }

    @Test
    void testStringSpellingsAreKept() {
        assertRoundTrip("local a = 'single'");
        assertRoundTrip("local b = \"double\"");
        assertRoundTrip("local c = [==[text]==]");
        assertRoundTrip("local d = [[\nfirst line]]");
        assertRoundTrip("local e = 'tab\\t\\x41\\u{48}'");
    }

    @Test
    void testNumberSpellingsAreKept() {
        assertRoundTrip("local n = 0x1F + 1e3 + 1_000 + 0b101 + .5");
    }

    @Test
    void testTableSeparators() {
        assertRoundTrip("local t = {1, 2; 3}");
        assertRoundTrip("local t = {a = 1, [\"b\"] = 2,}");
        assertRoundTrip("local t = {\n  x = 1;\n  y = 2;\n}");
    }

    @Test
    void testCallSugar() {
        assertRoundTrip("require 'module'");
        assertRoundTrip("f { x = 1 }");
        assertRoundTrip("obj:method 'x'");
        assertRoundTrip("f[[long]]");
    }

    @Test
    void testInterpolatedStrings() {
        assertRoundTrip("local s = `plain`");
        assertRoundTrip("local s = `a {x} b {y + 1} c`");
        assertRoundTrip("local s = `{x}{y}`");
    }

    @Test
    void testIfElseExpression() {
        assertRoundTrip("local v = if a then 1 elseif b then 2 else 3");
    }

    @Test
    void testTypesRoundTrip() {
        assertRoundTrip("local x: number = 1");
        assertRoundTrip("local x: string? = nil");
        assertRoundTrip("type Point = { x: number, y: number }");
        assertRoundTrip("export type List<T> = { T }");
        assertRoundTrip("type F = (number, string) -> boolean");
        assertRoundTrip("type G = <T...>(T...) -> ...any");
        assertRoundTrip("type U = | 'a' | 'b'");
        assertRoundTrip("type I = A & B");
        assertRoundTrip("type M = { [string]: number, read: boolean }");
        assertRoundTrip("type D<T = string, U... = ...number> = (T) -> U...");
        assertRoundTrip("type Q = typeof(x)");
        assertRoundTrip("local y = x :: number");
        assertRoundTrip("function f<T>(a: T, ...: number): (T, number)\n  return a, 1\nend");
    }

    @Test
    void testTypeFunction() {
        assertRoundTrip("type function Identity(t)\n  return t\nend");
    }

    @Test
    void testTypesDroppedWithoutWriteTypes() {
        TranspileResult result = Transpiler.transpile("local x: number = 1");

        assertTrue(result.isSuccess());
        assertEquals("local x = 1", result.code().stripTrailing().replaceAll(" +", " "));
    }

    @Test
    void testCanonicalQuoteChoice() {
        String printed = canonical("local s = \"a \\\"b\\\" c\"");

        assertTrue(printed.contains("'a \"b\" c'"), printed);
    }

    @Test
    void testCanonicalDropsSpelling() {
        String printed = canonical("local n = 0x10\nlocal s = [[x]]");

        assertTrue(printed.contains("16"), printed);
        assertTrue(printed.contains("'x'"), printed);
    }

    @Test
    @DisplayName("Canonical output is a fixed point of parse and print")
    void testCanonicalIsIdempotent() {
        String[] sources = {
            "local t = {1, 2; 3, a = 4, [5] = 6}",
            "local function f(...) return select('#', ...) end",
            "if x then y() elseif z then w() else v() end",
            "local s = `a {b} c`",
            "type T<U> = { U } | nil",
            "local v = if a then b else c",
            "for i = 1, 2 do local _ = -i end",
        };
        for (String source : sources) {
            String once = canonical(source);
            String twice = canonical(once);
            assertEquals(once, twice, "for source: " + source);
        }
    }

    @Test
    void testFailureResult() {
        TranspileResult result = Transpiler.transpile("local = 1");

        assertFalse(result.isSuccess());
        assertEquals("", result.code());
        assertEquals(SourceLocation.of(0, 6, 0, 7), result.errorLocation());
        assertNotNull(result.parseError());
    }

    @Test
    void testErrorNodesArePrinted() {
        ErrorExpression error = new ErrorExpression(SourceLocation.NONE,
            List.of(new GlobalExpression(SourceLocation.NONE, "x")), 0);

        assertEquals("(error-expr: x)", Transpiler.toString(error));
    }

    @Test
    void testTableWithoutConcreteSyntax() {
        TableExpression table = new TableExpression(SourceLocation.NONE, List.of(
            new TableItem(TableItem.Kind.LIST, null, new NumberExpression(SourceLocation.NONE, 1)),
            new TableItem(TableItem.Kind.LIST, null, new NumberExpression(SourceLocation.NONE, 2)),
            new TableItem(TableItem.Kind.LIST, null, new NumberExpression(SourceLocation.NONE, 3))));

        assertEquals("{1,2,3}", Transpiler.toString(table));
    }

    @Test
    void testToStringStartsAtNode() {
        ParseResult parsed = Parser.parse("\n\nlocal x = a + b");
        LocalStatement local = (LocalStatement) parsed.root().body().get(0);

        assertEquals("a + b", Transpiler.toString(local.values().get(0)));
    }
}

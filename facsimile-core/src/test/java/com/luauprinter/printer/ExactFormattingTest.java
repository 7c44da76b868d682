package com.luauprinter.printer;

import com.luauprinter.InternalConsistencyException;
import com.luauprinter.ParseResult;
import com.luauprinter.Parser;
import com.luauprinter.Transpiler;
import com.luauprinter.ast.*;
import com.luauprinter.cst.CstCall;
import com.luauprinter.cst.CstNodeMap;
import com.luauprinter.cst.CstTable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExactFormattingTest {

    @Test
    void testTableItemCountMustMatch() {
        ParseResult parsed = Parser.parse("local t = {1, 2}");
        LocalStatement local = (LocalStatement) parsed.root().body().get(0);
        TableExpression table = (TableExpression) local.values().get(0);
        CstNodeMap map = parsed.cstNodeMap();

        map.put(table, new CstTable(List.of(
            new CstTable.Item(TableItem.Kind.LIST, null, null, null, null, null))));

        InternalConsistencyException e = assertThrows(InternalConsistencyException.class,
            () -> Transpiler.transpile(parsed.root(), map));
        assertTrue(e.getMessage().contains("2 items but 1 recorded"), e.getMessage());
    }

    @Test
    void testCallCommasMustBeRecorded() {
        ParseResult parsed = Parser.parse("f(a, b, c)");
        ExpressionStatement statement = (ExpressionStatement) parsed.root().body().get(0);
        CallExpression call = (CallExpression) statement.expr();
        CstNodeMap map = parsed.cstNodeMap();
        CstCall recorded = map.get(call, CstCall.class).orElseThrow();

        map.put(call, new CstCall(recorded.openParensPosition(), recorded.closeParensPosition(),
            recorded.commaPositions().subList(0, 1)));

        assertThrows(InternalConsistencyException.class, () -> Transpiler.transpile(parsed.root(), map));
    }

    @Test
    void testUndecoratedNodesFallBackToCanonical() {
        ParseResult parsed = Parser.parse("local t = {1,2}");
        CstNodeMap empty = new CstNodeMap();

        assertEquals("local t = {1,2}", Transpiler.transpile(parsed.root(), empty));
    }
}

package com.luauprinter.cst;

import com.luauprinter.InternalConsistencyException;
import com.luauprinter.ast.NumberExpression;
import com.luauprinter.ast.SourceLocation;
import com.luauprinter.ast.StringExpression;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CstNodeMapTest {

    @Test
    void testLookupIsByIdentity() {
        CstNodeMap map = new CstNodeMap();
        StringExpression first = new StringExpression(SourceLocation.NONE, "a");
        StringExpression second = new StringExpression(SourceLocation.NONE, "a");
        map.put(first, new CstConstantString("a", QuoteStyle.DOUBLE, 0));

        assertEquals(first, second);
        assertTrue(map.get(first).isPresent());
        assertTrue(map.get(second).isEmpty());
    }

    @Test
    void testTypedLookupWithWrongKindFails() {
        CstNodeMap map = new CstNodeMap();
        StringExpression node = new StringExpression(SourceLocation.NONE, "a");
        map.put(node, new CstConstantString("a", QuoteStyle.SINGLE, 0));

        assertTrue(map.get(node, CstConstantString.class).isPresent());
        assertThrows(InternalConsistencyException.class, () -> map.get(node, CstConstantNumber.class));
    }

    @Test
    void testDecorationMustFitNode() {
        CstNodeMap map = new CstNodeMap();
        NumberExpression number = new NumberExpression(SourceLocation.NONE, 1);

        assertThrows(InternalConsistencyException.class,
            () -> map.put(number, new CstConstantString("1", QuoteStyle.SINGLE, 0)));
    }

    @Test
    void testDisabledMapIgnoresInsertions() {
        CstNodeMap map = CstNodeMap.disabled();
        StringExpression node = new StringExpression(SourceLocation.NONE, "a");
        map.put(node, new CstConstantString("a", QuoteStyle.SINGLE, 0));

        assertFalse(map.isEnabled());
        assertTrue(map.get(node).isEmpty());
        assertEquals(0, map.size());
    }

    @Test
    void testStringDepthOnlyForLongBrackets() {
        assertDoesNotThrow(() -> new CstConstantString("x", QuoteStyle.RAW, 3));
        assertThrows(InternalConsistencyException.class, () -> new CstConstantString("x", QuoteStyle.SINGLE, 1));
        assertThrows(InternalConsistencyException.class, () -> new CstConstantString("x", QuoteStyle.RAW, -1));
    }
}

package com.luauprinter.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.luauprinter.ParseOptions;
import com.luauprinter.ParseResult;
import com.luauprinter.Parser;
import com.luauprinter.Transpiler;
import com.luauprinter.ast.*;
import com.luauprinter.json.AstJsonException;
import com.luauprinter.json.AstJsonProvider;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonTest {

    private static final String SOURCE = """
        local t = {1, 2.5; x = "y", [3] = `a{b}c`}
        local function f(a: number, ...: string): (number, string)
            return a + #t, select(1, ...)
        end
        type Pair<T> = { first: T, second: T? }
        if t.x == 'y' then
            f(1)
        elseif not t then
            print(-1 // 2)
        end
        """;

    @Test
    void testProviderIsDiscovered() {
        assertTrue(AstJsonProvider.isProviderAvailable());
        AstJsonProvider provider = AstJsonProvider.getProvider();

        assertEquals("Jackson", provider.getName());
        assertInstanceOf(JacksonAstJsonProvider.class, provider);
        assertInstanceOf(JacksonAstJsonProvider.class, AstJsonProvider.getProvider("Jackson"));
    }

    @Test
    void testJsonRoundTripPrintsTheSame() throws Exception {
        ParseResult parsed = Parser.parse(SOURCE, ParseOptions.withoutCst());
        assertFalse(parsed.hasErrors(), () -> parsed.errors().toString());

        AstJsonProvider provider = new JacksonAstJsonProvider();
        String json = provider.getSerializer().serialize(parsed.root());
        Block restored = provider.getDeserializer().deserializeBlock(json);

        assertEquals(Transpiler.transpileWithTypes(parsed.root()), Transpiler.transpileWithTypes(restored));
    }

    @Test
    void testNodesCarryKind() throws Exception {
        ObjectMapper mapper = LuauJackson.createObjectMapper();
        ParseResult parsed = Parser.parse("return x", ParseOptions.withoutCst());

        JsonNode json = mapper.readTree(mapper.writeValueAsString(parsed.root()));

        assertEquals("Block", json.path("kind").asText());
        JsonNode ret = json.path("body").get(0);
        assertEquals("ReturnStatement", ret.path("kind").asText());
        assertEquals("GlobalExpression", ret.path("list").get(0).path("kind").asText());
        assertEquals("x", ret.path("list").get(0).path("name").asText());
    }

    @Test
    void testNumberSerialization() throws Exception {
        ObjectMapper mapper = LuauJackson.createObjectMapper();

        assertEquals(3, mapper.readTree(number(mapper, 3.0)).path("value").asLong());
        assertTrue(mapper.readTree(number(mapper, 3.0)).path("value").isIntegralNumber());
        assertEquals(3.5, mapper.readTree(number(mapper, 3.5)).path("value").asDouble());
        assertEquals("NaN", mapper.readTree(number(mapper, Double.NaN)).path("value").asText());
        assertEquals("-Infinity",
            mapper.readTree(number(mapper, Double.NEGATIVE_INFINITY)).path("value").asText());
        assertTrue(mapper.readTree(number(mapper, -0.0)).path("value").isFloatingPointNumber());
    }

    @Test
    void testSpecialNumbersReadBack() throws Exception {
        ObjectMapper mapper = LuauJackson.createObjectMapper();
        String json = number(mapper, Double.POSITIVE_INFINITY);

        NumberExpression restored = (NumberExpression) mapper.readValue(json, Expression.class);

        assertEquals(Double.POSITIVE_INFINITY, restored.value());
        assertEquals("1e500", Transpiler.toString(restored));
    }

    @Test
    void testWrongKindIsRejected() throws Exception {
        AstJsonProvider provider = new JacksonAstJsonProvider();
        String json = provider.getSerializer().serialize(new GlobalExpression(SourceLocation.NONE, "x"));

        assertThrows(AstJsonException.class, () -> provider.getDeserializer().deserializeBlock(json));
        assertThrows(AstJsonException.class, () -> provider.getDeserializer().deserializeBlock("{not json"));
    }

    private static String number(ObjectMapper mapper, double value) throws Exception {
        return mapper.writeValueAsString(new NumberExpression(SourceLocation.NONE, value));
    }
}

package com.luauprinter.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.luauprinter.ast.Block;
import com.luauprinter.ast.Node;
import com.luauprinter.json.AstJsonDeserializer;
import com.luauprinter.json.AstJsonException;
import com.luauprinter.json.AstJsonProvider;
import com.luauprinter.json.AstJsonSerializer;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this(LuauJackson.createObjectMapper());
    }

    public JacksonAstJsonProvider(ObjectMapper mapper) {
        this.mapper = mapper;
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Node node) throws AstJsonException {
            try {
                return mapper.writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize " + node.kind(), e);
            }
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize " + node.kind(), e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Block deserializeBlock(String json) throws AstJsonException {
            return deserialize(json, Block.class);
        }

        @Override
        public <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException {
            try {
                return mapper.readValue(json, type);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new AstJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
        }
    }
}

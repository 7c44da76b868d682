package com.luauprinter.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for object mappers that read and write syntax trees.
 *
 * <pre>
 * ObjectMapper mapper = LuauJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(root);
 * Block copy = mapper.readValue(json, Block.class);
 * </pre>
 */
public final class LuauJackson {

    private LuauJackson() {
    }

    /**
     * The returned mapper writes every node with a {@code kind} property,
     * leaves out null fields and ignores unknown properties when reading.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.registerModule(new AstModule());
        return mapper;
    }
}

package com.luauprinter.json;

import com.luauprinter.ast.Block;
import com.luauprinter.ast.Node;

/**
 * Reads syntax trees back from JSON. Read trees carry no concrete syntax
 * data, so they print in canonical form.
 */
public interface AstJsonDeserializer {

    /**
     * Reads the root block of a chunk.
     *
     * @throws AstJsonException if the JSON is malformed or is not a block
     */
    Block deserializeBlock(String json) throws AstJsonException;

    /**
     * Reads a node of the given type, or of any subtype when {@code type} is
     * one of the node interfaces.
     *
     * @throws AstJsonException if the JSON is malformed or has another kind
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}

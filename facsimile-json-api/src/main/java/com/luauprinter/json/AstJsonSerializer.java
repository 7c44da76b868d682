package com.luauprinter.json;

import com.luauprinter.ast.Node;

/**
 * Writes syntax trees as JSON. Every node becomes an object whose
 * {@code kind} property names its node type.
 */
public interface AstJsonSerializer {

    /**
     * @throws AstJsonException if the node cannot be written
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Same as {@link #serialize(Node)}, indented for reading.
     *
     * @throws AstJsonException if the node cannot be written
     */
    String serializePretty(Node node) throws AstJsonException;
}

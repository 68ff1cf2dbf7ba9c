package com.pulseparser.json;

import com.pulseparser.ast.Node;

/**
 * Writes syntax trees as JSON.
 */
public interface AstJsonSerializer {

    /**
     * Serializes a node and its subtree to a compact JSON string.
     *
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Serializes a node and its subtree to an indented JSON string.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;
}

package com.pulseparser.json;

import com.pulseparser.ast.Node;
import com.pulseparser.ast.Program;

/**
 * Reads syntax trees back from JSON written by an {@link AstJsonSerializer}.
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes a whole program.
     *
     * @param json the JSON text of a {@code Program} node
     * @return the program tree
     * @throws AstJsonException if the text is not valid JSON or does not describe a program
     */
    Program deserializeProgram(String json) throws AstJsonException;

    /**
     * Deserializes a subtree rooted at a node of the given type. {@code type} may be an
     * abstract node category such as {@code Statement} or {@code Expression}; the
     * concrete variant is taken from the JSON.
     *
     * @throws AstJsonException if deserialization fails or the node is not a {@code type}
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}

package com.pulseparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for AST serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = CadenceJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(program);
 * Program program = mapper.readValue(json, Program.class);
 * </pre>
 */
public final class CadenceJackson {

    private CadenceJackson() {
        // Utility class
    }

    /**
     * Creates a mapper that writes spans. Equivalent to {@code createObjectMapper(true)}.
     */
    public static ObjectMapper createObjectMapper() {
        return createObjectMapper(true);
    }

    /**
     * Creates a new ObjectMapper configured for AST serialization/deserialization.
     *
     * The returned mapper:
     * - Handles polymorphic Node types via the "kind" property
     * - Writes null for optional child nodes (return types, initializers, range steps)
     * - Omits every "span" property when {@code includeSpans} is false; such JSON reads
     *   back as a tree without spans
     *
     * @param includeSpans whether nodes are written with their source spans
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper(boolean includeSpans) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Configure serialization - exclude null values by default
        // Specific null fields (returnType, initExpression, ...) are included via mixins in AstModule
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        // Ignore unknown properties during deserialization
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule(includeSpans));

        return mapper;
    }
}

package com.pulseparser.json;

/**
 * Thrown when a tree cannot be written as JSON or JSON cannot be read back as a tree.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}

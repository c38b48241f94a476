package com.actsetl.infrastructure.eisb;

/**
 * The source document cannot be converted at all.
 */
public class EisbParseException extends RuntimeException {

    public EisbParseException(String message) {
        super(message);
    }

    public EisbParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

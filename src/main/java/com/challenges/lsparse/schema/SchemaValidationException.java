package com.challenges.lsparse.schema;

/**
 * Raised when structural data does not describe a valid syntax tree: an unknown or ambiguous
 * variant, an extra or missing field, a value of the wrong type, or a shape the grammar
 * cannot produce.
 */
public class SchemaValidationException extends RuntimeException {
    public SchemaValidationException(String message) {
        super(message);
    }

    public SchemaValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

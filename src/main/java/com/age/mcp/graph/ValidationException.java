package com.age.mcp.graph;

/**
 * Runtime exception thrown when connection configuration is malformed or out of range.
 */
public class ValidationException extends RuntimeException {

    private final String field;

    public ValidationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public ValidationException(String field, String message, Throwable cause) {
        super(field + ": " + message, cause);
        this.field = field;
    }

    /**
     * Name of the offending configuration field.
     */
    public String getField() {
        return field;
    }
}

package com.age.mcp.graph;

/**
 * Runtime exception thrown when an engine or session cannot be created or disposed,
 * e.g. because the database is unreachable.
 */
public class ResourceException extends RuntimeException {

    public ResourceException(String message) {
        super(message);
    }

    public ResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}

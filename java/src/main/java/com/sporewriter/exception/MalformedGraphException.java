package com.sporewriter.exception;

/**
 * Exception thrown when a request graph or mapping is structurally invalid.
 */
public class MalformedGraphException extends RuntimeException {

    public MalformedGraphException(String message) {
        super(message);
    }

    public MalformedGraphException(String graph, String problem) {
        super(String.format("Graph '%s' is malformed: %s", graph, problem));
    }
}

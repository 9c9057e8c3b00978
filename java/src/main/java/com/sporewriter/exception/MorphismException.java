package com.sporewriter.exception;

/**
 * Base exception for a pattern match that cannot be used for rewriting.
 */
public abstract class MorphismException extends RuntimeException {

    protected MorphismException(String message) {
        super(message);
    }
}

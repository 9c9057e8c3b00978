package com.sporewriter.exception;

/**
 * Exception thrown when the match does not preserve the pattern's structure.
 */
public class NoMorphismException extends MorphismException {

    public NoMorphismException() {
        super("error: no morphism");
    }

    public NoMorphismException(String reason) {
        super("error: no morphism (" + reason + ")");
    }
}

package com.sporewriter.exception;

import lombok.Getter;

/**
 * Exception thrown when a pattern node has no entry in the match.
 */
@Getter
public class UnmappedPatternNodeException extends MorphismException {

    private final Object patternNode;

    public UnmappedPatternNodeException(Object patternNode) {
        super("error: lhs isn't fully mapped to input");
        this.patternNode = patternNode;
    }
}

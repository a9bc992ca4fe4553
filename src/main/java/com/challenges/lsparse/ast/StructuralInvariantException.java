package com.challenges.lsparse.ast;

/**
 * Thrown when a node is constructed with a shape the configuration language cannot produce.
 */
public class StructuralInvariantException extends IllegalStateException {
    public StructuralInvariantException(String message) {
        super(message);
    }
}

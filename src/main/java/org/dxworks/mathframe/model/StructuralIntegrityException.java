package org.dxworks.mathframe.model;

/**
 * Raised when a tree or cursor invariant is violated. Indicates a bug in the caller
 * or in the engine, never bad user input.
 */
public class StructuralIntegrityException extends IllegalStateException {

    public StructuralIntegrityException(String message) {
        super(message);
    }
}

package org.dxworks.mathframe.model;

/**
 * Monotonic identifier source owned by a single document.
 * Identifiers are only used for external lookup, never for ordering.
 */
public class NodeIdGenerator {

    private int last;

    public int next() {
        return ++last;
    }

    public int peek() {
        return last;
    }
}

package org.dxworks.mathframe.model;

/**
 * Horizontal direction used for cursor movement and sibling lookup.
 */
public enum Direction {
    LEFT,
    RIGHT;

    public Direction opposite() {
        return this == LEFT ? RIGHT : LEFT;
    }
}

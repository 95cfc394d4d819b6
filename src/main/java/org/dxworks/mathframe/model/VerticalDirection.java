package org.dxworks.mathframe.model;

public enum VerticalDirection {
    UP,
    DOWN;

    public VerticalDirection opposite() {
        return this == UP ? DOWN : UP;
    }
}

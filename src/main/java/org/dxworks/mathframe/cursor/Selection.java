package org.dxworks.mathframe.cursor;

import org.dxworks.mathframe.model.Direction;
import org.dxworks.mathframe.model.MathNode;
import org.dxworks.mathframe.model.NodeFragment;

/**
 * Fragment between the anchor and the cursor. {@code direction} is the side the cursor is on.
 */
public class Selection extends NodeFragment {

    private final Direction direction;

    public Selection(MathNode leftEnd, MathNode rightEnd, Direction direction) {
        super(leftEnd, rightEnd);
        this.direction = direction;
    }

    public Direction getDirection() {
        return direction;
    }
}

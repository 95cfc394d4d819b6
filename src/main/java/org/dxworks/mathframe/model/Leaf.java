package org.dxworks.mathframe.model;

/**
 * A node that owns no blocks.
 */
public abstract class Leaf extends MathNode {

    protected Leaf(NodeIdGenerator ids) {
        super(ids);
    }
}

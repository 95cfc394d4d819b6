package org.dxworks.mathframe.model.command;

import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.model.CompositeNode;
import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.NodeKind;
import org.dxworks.mathframe.model.NodeVisitor;

import java.util.List;

/**
 * Combined superscript and subscript on the same base. Remembers which script was
 * written first so serialization reproduces the source order.
 */
public class SupSub extends CompositeNode {

    private final Block sup;
    private final Block sub;
    private final boolean subscriptFirst;

    public SupSub(NodeIdGenerator ids, boolean subscriptFirst) {
        super(ids);
        this.sup = new Block(ids, this);
        this.sub = new Block(ids, this);
        this.subscriptFirst = subscriptFirst;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SUPSUB;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSupSub(this);
    }

    @Override
    public List<Block> getBlocks() {
        return List.of(sup, sub);
    }

    @Override
    public boolean isVerticalStack() {
        return true;
    }

    @Override
    protected Block upperBlock() {
        return sup;
    }

    @Override
    protected Block lowerBlock() {
        return sub;
    }

    public Block getSup() {
        return sup;
    }

    public Block getSub() {
        return sub;
    }

    public boolean isSubscriptFirst() {
        return subscriptFirst;
    }
}

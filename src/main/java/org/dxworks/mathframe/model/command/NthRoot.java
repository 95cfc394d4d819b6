package org.dxworks.mathframe.model.command;

import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.model.CompositeNode;
import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.NodeKind;
import org.dxworks.mathframe.model.NodeVisitor;

import java.util.List;

/**
 * Root with an explicit index. The index precedes the radicand in reading order.
 */
public class NthRoot extends CompositeNode {

    private final Block index;
    private final Block radicand;

    public NthRoot(NodeIdGenerator ids) {
        super(ids);
        this.index = new Block(ids, this);
        this.radicand = new Block(ids, this);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.NTH_ROOT;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNthRoot(this);
    }

    @Override
    public List<Block> getBlocks() {
        return List.of(index, radicand);
    }

    public Block getIndex() {
        return index;
    }

    public Block getRadicand() {
        return radicand;
    }
}

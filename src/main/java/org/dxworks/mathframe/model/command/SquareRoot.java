package org.dxworks.mathframe.model.command;

import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.model.CompositeNode;
import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.NodeKind;
import org.dxworks.mathframe.model.NodeVisitor;

import java.util.List;

public class SquareRoot extends CompositeNode {

    private final Block radicand;

    public SquareRoot(NodeIdGenerator ids) {
        super(ids);
        this.radicand = new Block(ids, this);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SQUARE_ROOT;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSquareRoot(this);
    }

    @Override
    public List<Block> getBlocks() {
        return List.of(radicand);
    }

    public Block getRadicand() {
        return radicand;
    }
}

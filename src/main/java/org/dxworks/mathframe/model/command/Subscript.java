package org.dxworks.mathframe.model.command;

import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.model.CompositeNode;
import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.NodeKind;
import org.dxworks.mathframe.model.NodeVisitor;

import java.util.List;

/**
 * Subscript attached to whatever precedes it in the block.
 */
public class Subscript extends CompositeNode {

    private final Block sub;

    public Subscript(NodeIdGenerator ids) {
        super(ids);
        this.sub = new Block(ids, this);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SUBSCRIPT;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSubscript(this);
    }

    @Override
    public List<Block> getBlocks() {
        return List.of(sub);
    }

    public Block getSub() {
        return sub;
    }
}

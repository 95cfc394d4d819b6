package org.dxworks.mathframe.model.command;

import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.model.CompositeNode;
import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.NodeKind;
import org.dxworks.mathframe.model.NodeVisitor;

import java.util.List;

public class Superscript extends CompositeNode {

    private final Block sup;

    public Superscript(NodeIdGenerator ids) {
        super(ids);
        this.sup = new Block(ids, this);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SUPERSCRIPT;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSuperscript(this);
    }

    @Override
    public List<Block> getBlocks() {
        return List.of(sup);
    }

    public Block getSup() {
        return sup;
    }
}

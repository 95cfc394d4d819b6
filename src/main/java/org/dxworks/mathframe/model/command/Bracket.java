package org.dxworks.mathframe.model.command;

import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.model.CompositeNode;
import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.NodeKind;
import org.dxworks.mathframe.model.NodeVisitor;

import java.util.List;

/**
 * Matched delimiter pair around a content block, written {@code \left( ... \right)}.
 */
public class Bracket extends CompositeNode {

    private final BracketType type;
    private final Block content;

    public Bracket(NodeIdGenerator ids, BracketType type) {
        super(ids);
        this.type = type;
        this.content = new Block(ids, this);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BRACKET;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBracket(this);
    }

    @Override
    public List<Block> getBlocks() {
        return List.of(content);
    }

    public BracketType getType() {
        return type;
    }

    public Block getContent() {
        return content;
    }
}

package org.dxworks.mathframe.model.command;

import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.model.CompositeNode;
import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.NodeKind;
import org.dxworks.mathframe.model.NodeVisitor;

import java.util.List;

/**
 * Big operator (∑, ∫, ⋃ ...) with upper and lower limit blocks. Empty limits are
 * omitted when serialized.
 */
public class LargeOperator extends CompositeNode {

    private final String name;
    private final String glyph;
    private final Block upper;
    private final Block lower;

    public LargeOperator(NodeIdGenerator ids, String name, String glyph) {
        super(ids);
        this.name = name;
        this.glyph = glyph;
        this.upper = new Block(ids, this);
        this.lower = new Block(ids, this);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LARGE_OPERATOR;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLargeOperator(this);
    }

    @Override
    public List<Block> getBlocks() {
        return List.of(upper, lower);
    }

    @Override
    public boolean isVerticalStack() {
        return true;
    }

    @Override
    protected Block upperBlock() {
        return upper;
    }

    @Override
    protected Block lowerBlock() {
        return lower;
    }

    public String getName() {
        return name;
    }

    public String getLatexCommand() {
        return "\\" + name;
    }

    public String getGlyph() {
        return glyph;
    }

    public Block getUpper() {
        return upper;
    }

    public Block getLower() {
        return lower;
    }
}

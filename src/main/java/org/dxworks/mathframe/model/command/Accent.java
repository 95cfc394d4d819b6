package org.dxworks.mathframe.model.command;

import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.model.CompositeNode;
import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.NodeKind;
import org.dxworks.mathframe.model.NodeVisitor;

import java.util.List;

/**
 * Diacritic over (or under) a content block, e.g. {@code \vec{v}}.
 * {@code mark} is the combining character used for display.
 */
public class Accent extends CompositeNode {

    private final String name;
    private final String mark;
    private final Block content;

    public Accent(NodeIdGenerator ids, String name, String mark) {
        super(ids);
        this.name = name;
        this.mark = mark;
        this.content = new Block(ids, this);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ACCENT;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAccent(this);
    }

    @Override
    public List<Block> getBlocks() {
        return List.of(content);
    }

    public String getName() {
        return name;
    }

    public String getLatexCommand() {
        return "\\" + name;
    }

    public String getMark() {
        return mark;
    }

    public Block getContent() {
        return content;
    }
}

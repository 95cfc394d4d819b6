package org.dxworks.mathframe.model.command;

import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.model.CompositeNode;
import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.NodeKind;
import org.dxworks.mathframe.model.NodeVisitor;

import java.util.List;

/**
 * {@code \lim} with a subscript block holding the approach, e.g. {@code x\to 0}.
 */
public class Limit extends CompositeNode {

    private final String name;
    private final String display;
    private final Block lower;

    public Limit(NodeIdGenerator ids, String name, String display) {
        super(ids);
        this.name = name;
        this.display = display != null ? display : name;
        this.lower = new Block(ids, this);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LIMIT;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLimit(this);
    }

    @Override
    public List<Block> getBlocks() {
        return List.of(lower);
    }

    public String getName() {
        return name;
    }

    public String getLatexCommand() {
        return "\\" + name;
    }

    public String getDisplay() {
        return display;
    }

    public Block getLower() {
        return lower;
    }
}

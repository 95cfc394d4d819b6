package org.dxworks.mathframe.model.command;

import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.model.CompositeNode;
import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.NodeKind;
import org.dxworks.mathframe.model.NodeVisitor;

import java.util.List;

/**
 * Styled content such as {@code \mathbb{R}} or {@code \text{if }}.
 * Auto-exit spans eject the cursor after one leaf is typed into them.
 * Raw-text spans hold literal characters rather than math symbols.
 */
public class TextStyleSpan extends CompositeNode {

    private final String name;
    private final boolean autoExit;
    private final boolean rawText;
    private final Block content;

    public TextStyleSpan(NodeIdGenerator ids, String name, boolean autoExit, boolean rawText) {
        super(ids);
        this.name = name;
        this.autoExit = autoExit;
        this.rawText = rawText;
        this.content = new Block(ids, this);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.TEXT_STYLE;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTextStyleSpan(this);
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

    public boolean isAutoExit() {
        return autoExit;
    }

    public boolean isRawText() {
        return rawText;
    }

    public Block getContent() {
        return content;
    }
}

package org.dxworks.mathframe.parser.ast;

import org.dxworks.mathframe.model.command.BracketType;

import java.util.List;
import java.util.Objects;

/**
 * {@code \left<delim> ... \right<delim>}.
 */
public class BracketNode extends LatexNode {

    private final BracketType bracketType;
    private final List<LatexNode> content;

    public BracketNode(int position, BracketType bracketType, List<LatexNode> content) {
        super(position);
        this.bracketType = bracketType;
        this.content = List.copyOf(content);
    }

    @Override
    public LatexNodeType getType() {
        return LatexNodeType.BRACKET;
    }

    public BracketType getBracketType() {
        return bracketType;
    }

    public List<LatexNode> getContent() {
        return content;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BracketNode)) return false;
        BracketNode that = (BracketNode) o;
        return bracketType == that.bracketType && content.equals(that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bracketType, content);
    }

    @Override
    public String toString() {
        return bracketType.getOpen() + content + bracketType.getClose();
    }
}

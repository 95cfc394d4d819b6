package org.dxworks.mathframe.parser.ast;

import java.util.List;

/**
 * Braced group {@code {...}}.
 */
public class GroupNode extends LatexNode {

    private final List<LatexNode> content;

    public GroupNode(int position, List<LatexNode> content) {
        super(position);
        this.content = List.copyOf(content);
    }

    @Override
    public LatexNodeType getType() {
        return LatexNodeType.GROUP;
    }

    public List<LatexNode> getContent() {
        return content;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof GroupNode && ((GroupNode) o).content.equals(content);
    }

    @Override
    public int hashCode() {
        return content.hashCode();
    }

    @Override
    public String toString() {
        return "{" + content + "}";
    }
}

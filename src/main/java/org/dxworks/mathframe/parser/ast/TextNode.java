package org.dxworks.mathframe.parser.ast;

import java.util.Objects;

/**
 * Raw text command such as {@code \text{if }}. The content is taken verbatim.
 */
public class TextNode extends LatexNode {

    private final String name;
    private final String content;

    public TextNode(int position, String name, String content) {
        super(position);
        this.name = name;
        this.content = content;
    }

    @Override
    public LatexNodeType getType() {
        return LatexNodeType.TEXT;
    }

    public String getName() {
        return name;
    }

    public String getContent() {
        return content;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TextNode)) return false;
        TextNode that = (TextNode) o;
        return name.equals(that.name) && content.equals(that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, content);
    }

    @Override
    public String toString() {
        return "\\" + name + "{" + content + "}";
    }
}

package org.dxworks.mathframe.parser.ast;

/**
 * A single letter.
 */
public class CharNode extends LatexNode {

    private final char value;

    public CharNode(int position, char value) {
        super(position);
        this.value = value;
    }

    @Override
    public LatexNodeType getType() {
        return LatexNodeType.CHAR;
    }

    public char getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CharNode && ((CharNode) o).value == value;
    }

    @Override
    public int hashCode() {
        return Character.hashCode(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}

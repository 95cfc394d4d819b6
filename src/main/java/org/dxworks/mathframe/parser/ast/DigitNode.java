package org.dxworks.mathframe.parser.ast;

public class DigitNode extends LatexNode {

    private final char value;

    public DigitNode(int position, char value) {
        super(position);
        this.value = value;
    }

    @Override
    public LatexNodeType getType() {
        return LatexNodeType.DIGIT;
    }

    public char getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DigitNode && ((DigitNode) o).value == value;
    }

    @Override
    public int hashCode() {
        return 31 + Character.hashCode(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}

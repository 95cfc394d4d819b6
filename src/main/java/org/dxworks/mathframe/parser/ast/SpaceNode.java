package org.dxworks.mathframe.parser.ast;

/**
 * A run of source whitespace. Carries no meaning in math mode.
 */
public class SpaceNode extends LatexNode {

    public SpaceNode(int position) {
        super(position);
    }

    @Override
    public LatexNodeType getType() {
        return LatexNodeType.SPACE;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SpaceNode;
    }

    @Override
    public int hashCode() {
        return 7;
    }

    @Override
    public String toString() {
        return "␣";
    }
}

package org.dxworks.mathframe.parser.ast;

/**
 * Node of the intermediate syntax tree produced by the LaTeX parser.
 * The source position is kept for diagnostics and is not part of equality.
 */
public abstract class LatexNode {

    private final int position;

    protected LatexNode(int position) {
        this.position = position;
    }

    public int getPosition() {
        return position;
    }

    public abstract LatexNodeType getType();
}

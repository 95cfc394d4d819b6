package org.dxworks.mathframe.model.symbol;

import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.NodeKind;
import org.dxworks.mathframe.model.NodeVisitor;

/**
 * Infix operator such as +, − or ×. Rendered with surrounding space in plain text.
 */
public class BinaryOperator extends MathSymbol {

    public BinaryOperator(NodeIdGenerator ids, String glyph) {
        super(ids, glyph);
    }

    public BinaryOperator(NodeIdGenerator ids, String glyph, String latexCommand) {
        super(ids, glyph, latexCommand);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BINARY_OPERATOR;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBinaryOperator(this);
    }
}

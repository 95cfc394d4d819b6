package org.dxworks.mathframe.model.symbol;

import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.NodeKind;
import org.dxworks.mathframe.model.NodeVisitor;

public class Digit extends MathSymbol {

    public Digit(NodeIdGenerator ids, String digit) {
        super(ids, digit);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.DIGIT;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDigit(this);
    }
}

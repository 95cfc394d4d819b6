package org.dxworks.mathframe.model.symbol;

import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.NodeKind;
import org.dxworks.mathframe.model.NodeVisitor;

public class Variable extends MathSymbol {

    public Variable(NodeIdGenerator ids, String letter) {
        super(ids, letter);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.VARIABLE;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }
}

package org.dxworks.mathframe.model.symbol;

import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.NodeKind;
import org.dxworks.mathframe.model.NodeVisitor;

public class Punctuation extends MathSymbol {

    public Punctuation(NodeIdGenerator ids, String glyph) {
        super(ids, glyph);
    }

    public Punctuation(NodeIdGenerator ids, String glyph, String latexCommand) {
        super(ids, glyph, latexCommand);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.PUNCTUATION;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitPunctuation(this);
    }
}

package org.dxworks.mathframe.model.symbol;

import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.NodeKind;
import org.dxworks.mathframe.model.NodeVisitor;

/**
 * Relation symbol. Compound relations (≤, ≥, ≠) degrade one step to their base
 * relation on backspace.
 */
public class Relation extends MathSymbol {

    public Relation(NodeIdGenerator ids, String glyph) {
        super(ids, glyph);
    }

    public Relation(NodeIdGenerator ids, String glyph, String latexCommand, String degradesTo) {
        super(ids, glyph, latexCommand, degradesTo);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.RELATION;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitRelation(this);
    }

    @Override
    public MathSymbol createDegraded(NodeIdGenerator ids) {
        if (getDegradesTo() == null) {
            throw new IllegalStateException("Relation " + getLatexForm() + " has no degraded form");
        }
        return new Relation(ids, getDegradesTo());
    }
}

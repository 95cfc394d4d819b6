package org.dxworks.mathframe.model.symbol;

import org.dxworks.mathframe.model.Leaf;
import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.NodeKind;
import org.dxworks.mathframe.model.NodeVisitor;

/**
 * A single displayed glyph. {@code latexCommand} is the source form when it differs from the glyph,
 * e.g. {@code \alpha} for α.
 */
public class MathSymbol extends Leaf {

    private final String glyph;
    private final String latexCommand;
    private final String degradesTo;

    public MathSymbol(NodeIdGenerator ids, String glyph) {
        this(ids, glyph, null, null);
    }

    public MathSymbol(NodeIdGenerator ids, String glyph, String latexCommand) {
        this(ids, glyph, latexCommand, null);
    }

    public MathSymbol(NodeIdGenerator ids, String glyph, String latexCommand, String degradesTo) {
        super(ids);
        this.glyph = glyph;
        this.latexCommand = latexCommand;
        this.degradesTo = degradesTo;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SYMBOL;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSymbol(this);
    }

    public String getGlyph() {
        return glyph;
    }

    public String getLatexCommand() {
        return latexCommand;
    }

    /**
     * Source form of this symbol: the command if there is one, otherwise the glyph.
     */
    public String getLatexForm() {
        return latexCommand != null ? latexCommand : glyph;
    }

    public String getDegradesTo() {
        return degradesTo;
    }

    public boolean canDegrade() {
        return degradesTo != null;
    }

    /**
     * Replacement used when backspace hits this symbol. The result never degrades further.
     */
    public MathSymbol createDegraded(NodeIdGenerator ids) {
        if (degradesTo == null) {
            throw new IllegalStateException("Symbol " + getLatexForm() + " has no degraded form");
        }
        return new MathSymbol(ids, degradesTo);
    }
}

package org.dxworks.mathframe.parser.ast;

import org.dxworks.mathframe.catalog.SymbolClass;

import java.util.Objects;

/**
 * An operator glyph or a zero-argument symbol command. {@code command} is null for
 * plain characters.
 */
public class SymbolNode extends LatexNode {

    private final String glyph;
    private final String command;
    private final SymbolClass symbolClass;
    private final String degradesTo;

    public SymbolNode(int position, String glyph, String command, SymbolClass symbolClass, String degradesTo) {
        super(position);
        this.glyph = glyph;
        this.command = command;
        this.symbolClass = symbolClass;
        this.degradesTo = degradesTo;
    }

    @Override
    public LatexNodeType getType() {
        return LatexNodeType.SYMBOL;
    }

    public String getGlyph() {
        return glyph;
    }

    public String getCommand() {
        return command;
    }

    public SymbolClass getSymbolClass() {
        return symbolClass;
    }

    public String getDegradesTo() {
        return degradesTo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SymbolNode)) return false;
        SymbolNode that = (SymbolNode) o;
        return Objects.equals(glyph, that.glyph) && Objects.equals(command, that.command);
    }

    @Override
    public int hashCode() {
        return Objects.hash(glyph, command);
    }

    @Override
    public String toString() {
        return command != null ? command : glyph;
    }
}

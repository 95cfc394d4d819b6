package org.dxworks.mathframe.parser.ast;

/**
 * Bare {@code _} or {@code ^}. Only exists until the script merging pass replaces it.
 */
public class ScriptMarker extends LatexNode {

    private final boolean subscript;

    public ScriptMarker(int position, boolean subscript) {
        super(position);
        this.subscript = subscript;
    }

    @Override
    public LatexNodeType getType() {
        return LatexNodeType.SCRIPT_MARKER;
    }

    public boolean isSubscript() {
        return subscript;
    }

    public char getSymbol() {
        return subscript ? '_' : '^';
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ScriptMarker && ((ScriptMarker) o).subscript == subscript;
    }

    @Override
    public int hashCode() {
        return subscript ? 1 : 2;
    }

    @Override
    public String toString() {
        return String.valueOf(getSymbol());
    }
}

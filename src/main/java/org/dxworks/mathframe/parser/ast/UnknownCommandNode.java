package org.dxworks.mathframe.parser.ast;

/**
 * Command missing from the catalog, kept as an opaque token.
 */
public class UnknownCommandNode extends LatexNode {

    private final String name;

    public UnknownCommandNode(int position, String name) {
        super(position);
        this.name = name;
    }

    @Override
    public LatexNodeType getType() {
        return LatexNodeType.UNKNOWN_COMMAND;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UnknownCommandNode && ((UnknownCommandNode) o).name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "?\\" + name;
    }
}

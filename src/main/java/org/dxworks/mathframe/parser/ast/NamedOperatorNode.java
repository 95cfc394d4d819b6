package org.dxworks.mathframe.parser.ast;

import org.dxworks.mathframe.catalog.CommandKind;

import java.util.Objects;

/**
 * Operator name ({@code \sin}), large operator ({@code \sum}) or limit ({@code \lim})
 * before any scripts are attached.
 */
public class NamedOperatorNode extends LatexNode {

    private final String name;
    private final CommandKind kind;
    private final String glyph;

    public NamedOperatorNode(int position, String name, CommandKind kind, String glyph) {
        super(position);
        this.name = name;
        this.kind = kind;
        this.glyph = glyph;
    }

    @Override
    public LatexNodeType getType() {
        return LatexNodeType.NAMED_OPERATOR;
    }

    public String getName() {
        return name;
    }

    public CommandKind getKind() {
        return kind;
    }

    public String getGlyph() {
        return glyph;
    }

    public boolean takesLimits() {
        return kind.takesLimits();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NamedOperatorNode)) return false;
        NamedOperatorNode that = (NamedOperatorNode) o;
        return name.equals(that.name) && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind);
    }

    @Override
    public String toString() {
        return "\\" + name;
    }
}

package org.dxworks.mathframe.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * A base with a subscript, a superscript or both. Absent scripts are null; an empty
 * list is a present but empty script.
 */
public class ScriptNode extends LatexNode {

    private final List<LatexNode> base;
    private final List<LatexNode> sub;
    private final List<LatexNode> sup;
    private final boolean subscriptFirst;

    public ScriptNode(int position, List<LatexNode> base, List<LatexNode> sub, List<LatexNode> sup, boolean subscriptFirst) {
        super(position);
        if (sub == null && sup == null) {
            throw new IllegalArgumentException("Script node needs a subscript or a superscript");
        }
        this.base = List.copyOf(base);
        this.sub = sub == null ? null : List.copyOf(sub);
        this.sup = sup == null ? null : List.copyOf(sup);
        this.subscriptFirst = subscriptFirst;
    }

    @Override
    public LatexNodeType getType() {
        return LatexNodeType.SCRIPT;
    }

    public List<LatexNode> getBase() {
        return base;
    }

    public List<LatexNode> getSub() {
        return sub;
    }

    public List<LatexNode> getSup() {
        return sup;
    }

    public boolean hasSub() {
        return sub != null;
    }

    public boolean hasSup() {
        return sup != null;
    }

    public boolean isSubscriptFirst() {
        return subscriptFirst;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScriptNode)) return false;
        ScriptNode that = (ScriptNode) o;
        return subscriptFirst == that.subscriptFirst
                && base.equals(that.base)
                && Objects.equals(sub, that.sub)
                && Objects.equals(sup, that.sup);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, sub, sup, subscriptFirst);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("script(").append(base);
        if (subscriptFirst) {
            appendScripts(sb, "_", sub, "^", sup);
        } else {
            appendScripts(sb, "^", sup, "_", sub);
        }
        return sb.append(")").toString();
    }

    private static void appendScripts(StringBuilder sb, String firstMark, List<LatexNode> first,
                                      String secondMark, List<LatexNode> second) {
        if (first != null) {
            sb.append(firstMark).append(first);
        }
        if (second != null) {
            sb.append(secondMark).append(second);
        }
    }
}

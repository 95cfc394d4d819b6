package org.dxworks.mathframe.parser.ast;

import org.dxworks.mathframe.catalog.CommandKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Canonical form of a parsed node list, shaped like the formula tree it materializes into:
 * <ul>
 *     <li>whitespace is dropped and braced groups are spliced into their surroundings</li>
 *     <li>script bases are lifted out so scripts stand alone after the nodes they decorate,
 *     except for large operators and limits, which own their scripts</li>
 *     <li>ragged matrix rows are padded with empty cells</li>
 * </ul>
 * Two sources that produce the same tree have equal canonical forms.
 */
public final class LatexAst {

    private LatexAst() {
    }

    public static List<LatexNode> normalize(List<LatexNode> nodes) {
        List<LatexNode> out = new ArrayList<>();
        for (LatexNode node : nodes) {
            appendNormalized(node, out);
        }
        return out;
    }

    /**
     * True when both lists have the same canonical form.
     */
    public static boolean equivalent(List<LatexNode> a, List<LatexNode> b) {
        return normalize(a).equals(normalize(b));
    }

    private static void appendNormalized(LatexNode node, List<LatexNode> out) {
        switch (node.getType()) {
            case SPACE:
                return;
            case GROUP:
                for (LatexNode child : ((GroupNode) node).getContent()) {
                    appendNormalized(child, out);
                }
                return;
            case SCRIPT:
                appendScript((ScriptNode) node, out);
                return;
            case COMMAND: {
                CommandNode command = (CommandNode) node;
                out.add(new CommandNode(command.getPosition(), command.getName(), command.getKind(),
                        normalizeAll(command.getRequiredArgs()), normalizeAll(command.getOptionalArgs())));
                return;
            }
            case BRACKET: {
                BracketNode bracket = (BracketNode) node;
                out.add(new BracketNode(bracket.getPosition(), bracket.getBracketType(), normalize(bracket.getContent())));
                return;
            }
            case MATRIX:
                out.add(normalizeMatrix((MatrixNode) node));
                return;
            default:
                out.add(node);
        }
    }

    private static void appendScript(ScriptNode script, List<LatexNode> out) {
        List<LatexNode> base = normalize(script.getBase());
        List<LatexNode> sub = script.hasSub() ? normalize(script.getSub()) : null;
        List<LatexNode> sup = script.hasSup() ? normalize(script.getSup()) : null;
        int position = script.getPosition();

        LatexNode operator = base.size() == 1 ? base.get(0) : null;
        if (operator instanceof NamedOperatorNode && ((NamedOperatorNode) operator).takesLimits()) {
            NamedOperatorNode named = (NamedOperatorNode) operator;
            if (named.getKind() == CommandKind.LIMIT && sup != null) {
                // a limit has no upper block, so a superscript stays a separate script
                out.add(sub != null ? new ScriptNode(position, base, sub, null, true) : named);
                out.add(new ScriptNode(position, Collections.emptyList(), null, sup, false));
            } else {
                out.add(new ScriptNode(position, base, sub, sup, true));
            }
            return;
        }
        out.addAll(base);
        out.add(new ScriptNode(position, Collections.emptyList(), sub, sup, script.isSubscriptFirst()));
    }

    private static List<List<LatexNode>> normalizeAll(List<List<LatexNode>> lists) {
        List<List<LatexNode>> result = new ArrayList<>(lists.size());
        for (List<LatexNode> list : lists) {
            result.add(normalize(list));
        }
        return result;
    }

    private static MatrixNode normalizeMatrix(MatrixNode matrix) {
        int columns = matrix.getColumnCount();
        List<List<List<LatexNode>>> rows = new ArrayList<>();
        for (List<List<LatexNode>> row : matrix.getRows()) {
            List<List<LatexNode>> cells = normalizeAll(row);
            while (cells.size() < columns) {
                cells.add(Collections.emptyList());
            }
            rows.add(cells);
        }
        return new MatrixNode(matrix.getPosition(), matrix.getMatrixType(), rows);
    }
}

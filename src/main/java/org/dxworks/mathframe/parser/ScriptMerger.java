package org.dxworks.mathframe.parser;

import org.dxworks.mathframe.parser.ast.GroupNode;
import org.dxworks.mathframe.parser.ast.LatexNode;
import org.dxworks.mathframe.parser.ast.ScriptMarker;
import org.dxworks.mathframe.parser.ast.ScriptNode;
import org.dxworks.mathframe.parser.ast.SpaceNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Folds {@code _} and {@code ^} markers into script nodes. The base is the node before the
 * marker and the argument is the node after it; a following marker of the other kind joins
 * the same script, and the written order is recorded.
 */
final class ScriptMerger {

    private ScriptMerger() {
    }

    static List<LatexNode> merge(List<LatexNode> nodes) throws LatexParseException {
        List<LatexNode> result = new ArrayList<>();
        int i = 0;
        while (i < nodes.size()) {
            LatexNode node = nodes.get(i);
            if (!(node instanceof ScriptMarker)) {
                result.add(node);
                i++;
                continue;
            }
            ScriptMarker marker = (ScriptMarker) node;
            while (!result.isEmpty() && result.get(result.size() - 1) instanceof SpaceNode) {
                result.remove(result.size() - 1);
            }
            List<LatexNode> base = result.isEmpty()
                    ? Collections.emptyList()
                    : List.of(result.remove(result.size() - 1));

            int argIndex = nextNonSpace(nodes, i + 1);
            List<LatexNode> first = argument(nodes, argIndex, marker);
            List<LatexNode> second = null;
            i = argIndex + 1;

            int next = nextNonSpace(nodes, i);
            if (next < nodes.size() && nodes.get(next) instanceof ScriptMarker
                    && ((ScriptMarker) nodes.get(next)).isSubscript() != marker.isSubscript()) {
                ScriptMarker other = (ScriptMarker) nodes.get(next);
                int otherArg = nextNonSpace(nodes, next + 1);
                second = argument(nodes, otherArg, other);
                i = otherArg + 1;
            }

            List<LatexNode> sub = marker.isSubscript() ? first : second;
            List<LatexNode> sup = marker.isSubscript() ? second : first;
            result.add(new ScriptNode(marker.getPosition(), base, sub, sup, marker.isSubscript()));
        }
        return result;
    }

    private static int nextNonSpace(List<LatexNode> nodes, int from) {
        int i = from;
        while (i < nodes.size() && nodes.get(i) instanceof SpaceNode) {
            i++;
        }
        return i;
    }

    private static List<LatexNode> argument(List<LatexNode> nodes, int index, ScriptMarker marker) throws LatexParseException {
        if (index >= nodes.size() || nodes.get(index) instanceof ScriptMarker) {
            int position = index < nodes.size() ? nodes.get(index).getPosition() : marker.getPosition() + 1;
            throw new LatexParseException(position, "an argument after '" + marker.getSymbol() + "'");
        }
        LatexNode arg = nodes.get(index);
        if (arg instanceof GroupNode) {
            return ((GroupNode) arg).getContent();
        }
        return List.of(arg);
    }
}

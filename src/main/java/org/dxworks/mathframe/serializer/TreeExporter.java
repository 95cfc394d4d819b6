package org.dxworks.mathframe.serializer;

import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.model.MathNode;
import org.dxworks.mathframe.model.symbol.MathSymbol;
import org.dxworks.mathframe.model.symbol.OperatorName;
import org.dxworks.mathframe.report.FormulaAnalysis;
import org.dxworks.mathframe.report.FormulaNodeInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a formula tree into report objects for JSON output.
 */
public final class TreeExporter {

    private TreeExporter() {
    }

    public static List<FormulaNodeInfo> export(Block block) {
        List<FormulaNodeInfo> result = new ArrayList<>();
        for (MathNode child : block.children()) {
            result.add(export(child));
        }
        return result;
    }

    public static FormulaNodeInfo export(MathNode node) {
        FormulaNodeInfo info = new FormulaNodeInfo(node.getId(), node.getKind().getName(), node.latex());
        if (node instanceof MathSymbol) {
            info.glyph = ((MathSymbol) node).getGlyph();
        } else if (node instanceof OperatorName) {
            info.glyph = ((OperatorName) node).getDisplay();
        }
        for (Block block : node.getBlocks()) {
            info.addBlock(export(block));
        }
        return info;
    }

    /**
     * Fills the tree statistics and node listing of {@code analysis} from {@code root}.
     */
    public static void fillStatistics(Block root, FormulaAnalysis analysis) {
        analysis.nodes = export(root);
        root.preOrder(node -> {
            analysis.nodeCount++;
            analysis.maxDepth = Math.max(analysis.maxDepth, node.depth());
            analysis.nodeKinds.merge(node.getKind().getName(), 1, Integer::sum);
        });
    }
}

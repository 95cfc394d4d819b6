package org.dxworks.mathframe.serializer;

import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.parser.LatexParseException;
import org.dxworks.mathframe.report.FormulaAnalysis;
import org.dxworks.mathframe.report.FormulaNodeInfo;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.mathframe.TestUtils.tree;
import static org.junit.jupiter.api.Assertions.*;

class TreeExporterTest {

    @Test
    void exportsNestedBlocks() throws LatexParseException {
        List<FormulaNodeInfo> nodes = TreeExporter.export(tree("\\frac{x}{2}+y"));

        assertEquals(3, nodes.size());
        FormulaNodeInfo fraction = nodes.get(0);
        assertEquals("fraction", fraction.kind);
        assertEquals("\\frac{x}{2}", fraction.latex);
        assertNull(fraction.glyph);
        assertEquals(2, fraction.blocks.size());
        assertEquals("variable", fraction.blocks.get(0).get(0).kind);
        assertEquals("x", fraction.blocks.get(0).get(0).glyph);
        assertEquals("binary_operator", nodes.get(1).kind);
        assertNull(nodes.get(1).blocks);
    }

    @Test
    void operatorNamesExportTheirDisplay() throws LatexParseException {
        FormulaNodeInfo sin = TreeExporter.export(tree("\\sin x")).get(0);

        assertEquals("operator_name", sin.kind);
        assertEquals("sin", sin.glyph);
    }

    @Test
    void fillsStatistics() throws LatexParseException {
        Block root = tree("\\frac{\\sqrt{x}}{2}+1");
        FormulaAnalysis analysis = new FormulaAnalysis();

        TreeExporter.fillStatistics(root, analysis);

        assertEquals(6, analysis.nodeCount);
        assertEquals(2, analysis.maxDepth);
        assertEquals(2, analysis.nodeKinds.get("digit"));
        assertEquals(1, analysis.nodeKinds.get("square_root"));
        assertEquals(3, analysis.nodes.size());
    }

    @Test
    void idsAreUniqueAcrossTheExport() throws LatexParseException {
        List<FormulaNodeInfo> nodes = TreeExporter.export(tree("ab"));

        assertNotEquals(nodes.get(0).id, nodes.get(1).id);
    }
}

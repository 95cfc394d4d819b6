package org.dxworks.mathframe;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class FormulaFileDetectorTest {

    @Test
    void recognizesFormulaExtensions() {
        assertTrue(FormulaFileDetector.isFormulaFile(Paths.get("a/b/formulas.tex")));
        assertTrue(FormulaFileDetector.isFormulaFile(Paths.get("doc.LATEX")));
        assertTrue(FormulaFileDetector.isFormulaFile(Paths.get("list.math")));
    }

    @Test
    void rejectsOtherFiles() {
        assertFalse(FormulaFileDetector.isFormulaFile(Paths.get("notes.txt")));
        assertFalse(FormulaFileDetector.isFormulaFile(Paths.get("tex")));
        assertFalse(FormulaFileDetector.isFormulaFile(Paths.get("/")));
    }
}

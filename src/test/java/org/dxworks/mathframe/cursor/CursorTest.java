package org.dxworks.mathframe.cursor;

import org.dxworks.mathframe.catalog.CommandCatalog;
import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.model.Direction;
import org.dxworks.mathframe.model.MathNode;
import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.StructuralIntegrityException;
import org.dxworks.mathframe.model.VerticalDirection;
import org.dxworks.mathframe.model.command.Fraction;
import org.dxworks.mathframe.model.command.LargeOperator;
import org.dxworks.mathframe.model.command.Matrix;
import org.dxworks.mathframe.model.command.MatrixCell;
import org.dxworks.mathframe.model.command.NthRoot;
import org.dxworks.mathframe.model.symbol.Variable;
import org.dxworks.mathframe.parser.AstMaterializer;
import org.dxworks.mathframe.parser.LatexParseException;
import org.dxworks.mathframe.parser.LatexParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CursorTest {

    private NodeIdGenerator ids;
    private Block root;
    private Cursor cursor;

    private void load(String latex) throws LatexParseException {
        load(latex, VerticalDirection.UP);
    }

    private void load(String latex, VerticalDirection verticalEntry) throws LatexParseException {
        ids = new NodeIdGenerator();
        root = Block.root(ids);
        cursor = new Cursor(root, ids, verticalEntry);
        new AstMaterializer(CommandCatalog.getDefault(), ids).materialize(new LatexParser().parse(latex), cursor);
    }

    @Test
    void materializingLeavesCursorAtEndOfRoot() throws LatexParseException {
        load("a+b");

        assertSame(root, cursor.getParent());
        assertTrue(cursor.isAtEnd());
        assertEquals(3, cursor.offset());
        cursor.verifyConsistency();
    }

    @Test
    void movingRightEntersFractionNumeratorAndExitsPastIt() throws LatexParseException {
        load("a\\frac{b}{c}d");
        Fraction fraction = (Fraction) root.childAt(1);
        cursor.moveToStart();

        assertTrue(cursor.moveRight());
        assertTrue(cursor.moveRight());
        assertSame(fraction.getNumerator(), cursor.getParent());
        assertTrue(cursor.isAtStart());

        assertTrue(cursor.moveRight());
        assertTrue(cursor.moveRight());
        assertSame(root, cursor.getParent());
        assertSame(fraction, cursor.getLeft());
    }

    @Test
    void movingLeftEntersFromTheRightEdge() throws LatexParseException {
        load("\\frac{xy}{z}");
        Fraction fraction = (Fraction) root.getFirstChild();

        assertTrue(cursor.moveLeft());

        assertSame(fraction.getNumerator(), cursor.getParent());
        assertTrue(cursor.isAtEnd());
    }

    @Test
    void verticalEntryPreferenceSelectsDenominator() throws LatexParseException {
        load("\\frac{x}{y}", VerticalDirection.DOWN);
        Fraction fraction = (Fraction) root.getFirstChild();

        cursor.moveLeft();

        assertSame(fraction.getDenominator(), cursor.getParent());
    }

    @Test
    void boundaryMovesReturnFalseAndKeepPosition() throws LatexParseException {
        load("ab");

        assertFalse(cursor.moveRight());
        assertEquals(2, cursor.offset());
        cursor.moveToStart();
        assertFalse(cursor.moveLeft());
        assertFalse(cursor.moveUp());
        assertFalse(cursor.moveDown());
        assertTrue(cursor.isAtStart());
    }

    @Test
    void downFromNumeratorKeepsOffsetClamped() throws LatexParseException {
        load("\\frac{abc}{xyz}");
        Fraction fraction = (Fraction) root.getFirstChild();
        cursor.moveLeft();
        cursor.moveLeft();

        assertTrue(cursor.moveDown());
        assertSame(fraction.getDenominator(), cursor.getParent());
        assertEquals(2, cursor.offset());

        load("\\frac{abc}{x}");
        fraction = (Fraction) root.getFirstChild();
        cursor.moveLeft();
        assertTrue(cursor.moveDown());
        assertSame(fraction.getDenominator(), cursor.getParent());
        assertEquals(1, cursor.offset());
    }

    @Test
    void verticalMoveIntoEmptyBlockLandsAtItsStart() throws LatexParseException {
        load("\\frac{}{xyz}", VerticalDirection.DOWN);
        Fraction fraction = (Fraction) root.getFirstChild();
        cursor.moveLeft();
        assertEquals(3, cursor.offset());

        assertTrue(cursor.moveUp());
        assertSame(fraction.getNumerator(), cursor.getParent());
        assertEquals(0, cursor.offset());
        cursor.verifyConsistency();

        load("\\sum_{i=1}^{}", VerticalDirection.DOWN);
        LargeOperator sum = (LargeOperator) root.getFirstChild();
        cursor.moveLeft();
        assertSame(sum.getLower(), cursor.getParent());

        assertTrue(cursor.moveUp());
        assertSame(sum.getUpper(), cursor.getParent());
        assertTrue(cursor.isAtStart());
        assertTrue(cursor.moveDown());
        assertSame(sum.getLower(), cursor.getParent());
        assertEquals(0, cursor.offset());
    }

    @Test
    void verticalMoveIntoShorterBlockClampsToItsEnd() throws LatexParseException {
        load("\\frac{a}{wxyz}", VerticalDirection.DOWN);
        Fraction fraction = (Fraction) root.getFirstChild();
        cursor.moveLeft();
        cursor.moveLeft();

        assertTrue(cursor.moveUp());
        assertSame(fraction.getNumerator(), cursor.getParent());
        assertTrue(cursor.isAtEnd());
        assertEquals(1, cursor.offset());
    }

    @Test
    void downFromDenominatorHasNowhereToGo() throws LatexParseException {
        load("\\frac{a}{b}");
        Fraction fraction = (Fraction) root.getFirstChild();
        cursor.moveLeft();
        cursor.moveDown();

        assertFalse(cursor.moveDown());
        assertSame(fraction.getDenominator(), cursor.getParent());
        assertTrue(cursor.moveUp());
        assertSame(fraction.getNumerator(), cursor.getParent());
    }

    @Test
    void upClimbsThroughEnclosingComposites() throws LatexParseException {
        load("\\frac{1}{\\sqrt{x}}");
        Fraction fraction = (Fraction) root.getFirstChild();
        cursor.moveLeft();
        cursor.moveDown();
        cursor.moveLeft();
        assertNotSame(fraction.getDenominator(), cursor.getParent());

        assertTrue(cursor.moveUp());
        assertSame(fraction.getNumerator(), cursor.getParent());
    }

    @Test
    void largeOperatorLimitsAreReachedWithUpAndDown() throws LatexParseException {
        load("\\sum_{i=1}^{n}");
        LargeOperator sum = (LargeOperator) root.getFirstChild();

        cursor.moveLeft();
        assertSame(sum.getUpper(), cursor.getParent());
        assertTrue(cursor.moveDown());
        assertSame(sum.getLower(), cursor.getParent());
        assertEquals(1, cursor.offset());
        assertTrue(cursor.moveUp());
        assertSame(sum.getUpper(), cursor.getParent());
    }

    @Test
    void nthRootIsEnteredAtIndexThenRadicand() throws LatexParseException {
        load("\\sqrt[3]{x}");
        NthRoot nthRoot = (NthRoot) root.getFirstChild();
        cursor.moveToStart();

        cursor.moveRight();
        assertSame(nthRoot.getIndex(), cursor.getParent());
        cursor.moveRight();
        cursor.moveRight();
        assertSame(nthRoot.getRadicand(), cursor.getParent());
        assertTrue(cursor.isAtStart());
        cursor.moveRight();
        cursor.moveRight();
        assertSame(root, cursor.getParent());
        assertSame(nthRoot, cursor.getLeft());
    }

    @Test
    void matrixCellsAreWalkedInEveryDirection() throws LatexParseException {
        load("\\begin{pmatrix}a&b\\\\c&d\\end{pmatrix}");
        Matrix matrix = (Matrix) root.getFirstChild();

        cursor.moveLeft();
        assertSame(matrix.getCell(1, 1), cursor.getParent());
        cursor.moveUp();
        assertSame(matrix.getCell(0, 1), cursor.getParent());
        cursor.moveLeft();
        cursor.moveLeft();
        MatrixCell cell = (MatrixCell) cursor.getParent();
        assertEquals(0, cell.getRow());
        assertEquals(0, cell.getColumn());
        cursor.moveDown();
        assertSame(matrix.getCell(1, 0), cursor.getParent());
    }

    @Test
    void insertAdvancesPastInsertedNode() throws LatexParseException {
        load("ac");
        cursor.moveLeft();

        Variable b = new Variable(ids, "b");
        cursor.insert(b);

        assertEquals("abc", root.latex());
        assertSame(b, cursor.getLeft());
        cursor.verifyConsistency();
    }

    @Test
    void autoExitSpanEjectsCursorAfterOneLeaf() throws LatexParseException {
        load("\\mathbb{}");
        cursor.moveLeft();
        assertNotSame(root, cursor.getParent());

        cursor.insert(new Variable(ids, "R"));
        assertSame(root, cursor.getParent());
        cursor.insert(new Variable(ids, "x"));

        assertEquals("\\mathbb{R}x", root.latex());
    }

    @Test
    void backspaceDegradesRelationBeforeRemovingIt() throws LatexParseException {
        load("a\\leq b");

        assertTrue(cursor.backspace());
        assertEquals("a\\leq", root.latex());
        assertTrue(cursor.backspace());
        assertEquals("a<", root.latex());
        assertTrue(cursor.backspace());
        assertEquals("a", root.latex());
        cursor.verifyConsistency();
    }

    @Test
    void backspaceRemovesWholeCompositeOnTheLeft() throws LatexParseException {
        load("x\\frac{a}{b}");

        assertTrue(cursor.backspace());
        assertEquals("x", root.latex());
    }

    @Test
    void backspaceAtStartOfFilledBlockStepsOutWithoutDeleting() throws LatexParseException {
        load("x\\frac{a}{b}");
        cursor.moveToStart();
        cursor.moveRight();
        cursor.moveRight();

        assertTrue(cursor.backspace());
        assertEquals("x\\frac{a}{b}", root.latex());
        assertSame(root, cursor.getParent());
        assertSame(root.childAt(1), cursor.getRight());

        assertTrue(cursor.backspace());
        assertEquals("\\frac{a}{b}", root.latex());
    }

    @Test
    void backspaceInEmptyCompositeRemovesIt() throws LatexParseException {
        load("y\\frac{}{}");
        cursor.moveLeft();

        assertTrue(cursor.backspace());
        assertEquals("y", root.latex());
        assertSame(root, cursor.getParent());
        assertTrue(cursor.isAtEnd());
    }

    @Test
    void deleteForwardAtEndOfFilledBlockStepsPastOwner() throws LatexParseException {
        load("\\sqrt{x}y");
        cursor.moveLeft();
        cursor.moveLeft();

        assertTrue(cursor.deleteForward());
        assertEquals("\\sqrt{x}y", root.latex());
        assertSame(root, cursor.getParent());
        assertTrue(cursor.deleteForward());
        assertEquals("\\sqrt{x}", root.latex());
    }

    @Test
    void deleteAtRootEdgesDoesNothing() throws LatexParseException {
        load("ab");

        assertFalse(cursor.deleteForward());
        cursor.moveToStart();
        assertFalse(cursor.backspace());
        assertEquals("ab", root.latex());
    }

    @Test
    void selectingLeftCollectsNodes() throws LatexParseException {
        load("abc");

        cursor.select(Direction.LEFT);
        cursor.select(Direction.LEFT);

        assertTrue(cursor.hasSelection());
        assertEquals("bc", cursor.selectionLatex());
        assertEquals(Direction.LEFT, cursor.getSelection().getDirection());
        assertEquals(2, cursor.getSelectedNodes().size());

        assertTrue(cursor.deleteSelection());
        assertEquals("a", root.latex());
        assertFalse(cursor.hasSelection());
    }

    @Test
    void selectingBackOverAnchorEmptiesSelection() throws LatexParseException {
        load("ab");

        cursor.select(Direction.LEFT);
        cursor.select(Direction.RIGHT);

        assertFalse(cursor.hasSelection());
        assertEquals("", cursor.selectionLatex());
    }

    @Test
    void selectionGrowsToWholeCompositeAtBlockEdge() throws LatexParseException {
        load("\\frac{a}{b}c");
        Fraction fraction = (Fraction) root.getFirstChild();
        cursor.moveToStart();
        cursor.moveRight();
        cursor.moveRight();

        assertTrue(cursor.select(Direction.RIGHT));

        assertSame(root, cursor.getParent());
        assertEquals(1, cursor.getSelectedNodes().size());
        assertSame(fraction, cursor.getSelectedNodes().get(0));
    }

    @Test
    void selectAllCoversRootFromAnyDepthAndNavigationClearsIt() throws LatexParseException {
        load("\\frac{a}{b}c");
        cursor.moveToStart();
        cursor.moveRight();

        assertTrue(cursor.selectAll());
        assertEquals("\\frac{a}{b}c", cursor.selectionLatex());
        assertSame(root, cursor.getParent());

        cursor.moveLeft();
        assertFalse(cursor.hasSelection());

        cursor.selectAll();
        cursor.clearSelection();
        assertFalse(cursor.hasSelection());
    }

    @Test
    void insertReplacesSelection() throws LatexParseException {
        load("ab");
        cursor.selectAll();

        cursor.insert(new Variable(ids, "z"));

        assertEquals("z", root.latex());
        assertFalse(cursor.hasSelection());
    }

    @Test
    void restoringSavedPositionReturnsToIt() throws LatexParseException {
        load("abc");
        cursor.moveLeft();
        CursorPosition saved = cursor.getPosition();
        cursor.moveToStart();

        cursor.restorePosition(saved);

        assertEquals(2, cursor.offset());
    }

    @Test
    void stalePositionCannotBeRestored() throws LatexParseException {
        load("abc");
        CursorPosition saved = cursor.getPosition();
        MathNode last = root.getLastChild();
        cursor.moveToStart();
        last.remove();

        assertThrows(StructuralIntegrityException.class, () -> cursor.restorePosition(saved));
    }

    @Test
    void consistencyCheckDetectsTreeChangedBehindCursor() throws LatexParseException {
        load("ab");
        root.getLastChild().remove();

        assertThrows(StructuralIntegrityException.class, cursor::verifyConsistency);
    }
}

package org.dxworks.mathframe.model.command;

import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.model.Direction;
import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.VerticalDirection;
import org.dxworks.mathframe.model.symbol.Variable;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MatrixTest {

    private final NodeIdGenerator ids = new NodeIdGenerator();

    @Test
    void cellsAreLaidOutRowMajor() {
        Matrix matrix = new Matrix(ids, MatrixType.BMATRIX, 2, 3);

        assertEquals(6, matrix.getBlocks().size());
        MatrixCell cell = matrix.getCell(1, 2);
        assertEquals(1, cell.getRow());
        assertEquals(2, cell.getColumn());
        assertSame(matrix, cell.getMatrix());
        assertSame(cell, matrix.getBlocks().get(5));
        assertEquals(3, matrix.getRow(0).size());
    }

    @Test
    void outOfRangeCellsAreNull() {
        Matrix matrix = new Matrix(ids, MatrixType.MATRIX, 2, 2);

        assertNull(matrix.getCell(-1, 0));
        assertNull(matrix.getCell(0, 2));
        assertNull(matrix.getCell(2, 0));
        assertTrue(matrix.getRow(5).isEmpty());
    }

    @Test
    void neighbouringCellsStopAtEdges() {
        Matrix matrix = new Matrix(ids, MatrixType.PMATRIX, 2, 2);
        MatrixCell topLeft = matrix.getCell(0, 0);
        MatrixCell bottomRight = matrix.getCell(1, 1);

        assertNull(matrix.cellLeft(topLeft));
        assertNull(matrix.cellUp(topLeft));
        assertSame(matrix.getCell(0, 1), matrix.cellRight(topLeft));
        assertSame(matrix.getCell(1, 0), matrix.cellDown(topLeft));
        assertNull(matrix.cellRight(bottomRight));
        assertNull(matrix.cellDown(bottomRight));
    }

    @Test
    void verticalMovementMapsToColumnNeighbours() {
        Matrix matrix = new Matrix(ids, MatrixType.VMATRIX, 3, 1);

        assertSame(matrix.getCell(1, 0), matrix.blockInDirection(matrix.getCell(0, 0), VerticalDirection.DOWN));
        assertSame(matrix.getCell(1, 0), matrix.blockInDirection(matrix.getCell(2, 0), VerticalDirection.UP));
        assertNull(matrix.blockInDirection(matrix.getCell(0, 0), VerticalDirection.UP));
    }

    @Test
    void horizontalMovementWalksCellsInReadingOrder() {
        Matrix matrix = new Matrix(ids, MatrixType.MATRIX, 2, 2);

        assertSame(matrix.getCell(1, 0), matrix.adjacentBlock(matrix.getCell(0, 1), Direction.RIGHT));
        assertSame(matrix.getCell(0, 1), matrix.adjacentBlock(matrix.getCell(1, 0), Direction.LEFT));
        assertNull(matrix.adjacentBlock(matrix.getCell(1, 1), Direction.RIGHT));
    }

    @Test
    void rejectsEmptyDimensions() {
        assertThrows(IllegalArgumentException.class, () -> new Matrix(ids, MatrixType.MATRIX, 0, 2));
        assertThrows(IllegalArgumentException.class, () -> new Matrix(ids, MatrixType.MATRIX, 2, 0));
    }

    @Test
    void serializesRowsAndCells() {
        Block root = Block.root(ids);
        Matrix matrix = new Matrix(ids, MatrixType.PMATRIX, 2, 2);
        root.append(matrix);
        matrix.getCell(0, 0).append(new Variable(ids, "a"));
        matrix.getCell(0, 1).append(new Variable(ids, "b"));
        matrix.getCell(1, 0).append(new Variable(ids, "c"));
        matrix.getCell(1, 1).append(new Variable(ids, "d"));

        assertEquals("\\begin{pmatrix}a & b \\\\ c & d\\end{pmatrix}", root.latex());
        assertEquals("[[a, b], [c, d]]", root.text());
        assertEquals("2 by 2 matrix. Row 1: Entry 1: a, Entry 2: b. Row 2: Entry 1: c, Entry 2: d.", root.speech());
    }

    @Test
    void environmentNamesMapToTypes() {
        assertEquals(Optional.of(MatrixType.BRACE_MATRIX), MatrixType.fromEnvironment("Bmatrix"));
        assertEquals(Optional.of(MatrixType.NORM_MATRIX), MatrixType.fromEnvironment("Vmatrix"));
        assertEquals(Optional.empty(), MatrixType.fromEnvironment("array"));
    }
}

package org.dxworks.mathframe.model.command;

import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.model.CompositeNode;
import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.NodeKind;
import org.dxworks.mathframe.model.NodeVisitor;
import org.dxworks.mathframe.model.VerticalDirection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rectangular grid of cells. Cells are kept in row-major order, which is also the
 * order horizontal cursor movement walks them.
 */
public class Matrix extends CompositeNode {

    private final MatrixType type;
    private final int rows;
    private final int columns;
    private final List<Block> cells;

    public Matrix(NodeIdGenerator ids, MatrixType type, int rows, int columns) {
        super(ids);
        if (rows < 1 || columns < 1) {
            throw new IllegalArgumentException("Matrix needs at least one row and one column, got " + rows + "x" + columns);
        }
        this.type = type;
        this.rows = rows;
        this.columns = columns;
        List<Block> created = new ArrayList<>(rows * columns);
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                created.add(new MatrixCell(ids, this, r, c));
            }
        }
        this.cells = Collections.unmodifiableList(created);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.MATRIX;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitMatrix(this);
    }

    @Override
    public List<Block> getBlocks() {
        return cells;
    }

    @Override
    public Block blockInDirection(Block block, VerticalDirection direction) {
        MatrixCell cell = (MatrixCell) block;
        return direction == VerticalDirection.UP ? cellUp(cell) : cellDown(cell);
    }

    public MatrixType getType() {
        return type;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    /**
     * Cell at the given coordinates, or null when either is out of range.
     */
    public MatrixCell getCell(int row, int column) {
        if (row < 0 || row >= rows || column < 0 || column >= columns) {
            return null;
        }
        return (MatrixCell) cells.get(row * columns + column);
    }

    public List<MatrixCell> getRow(int row) {
        List<MatrixCell> result = new ArrayList<>();
        for (int c = 0; c < columns; c++) {
            MatrixCell cell = getCell(row, c);
            if (cell != null) {
                result.add(cell);
            }
        }
        return result;
    }

    public MatrixCell cellLeft(MatrixCell cell) {
        return getCell(cell.getRow(), cell.getColumn() - 1);
    }

    public MatrixCell cellRight(MatrixCell cell) {
        return getCell(cell.getRow(), cell.getColumn() + 1);
    }

    public MatrixCell cellUp(MatrixCell cell) {
        return getCell(cell.getRow() - 1, cell.getColumn());
    }

    public MatrixCell cellDown(MatrixCell cell) {
        return getCell(cell.getRow() + 1, cell.getColumn());
    }
}

package org.dxworks.mathframe.parser.ast;

import org.dxworks.mathframe.model.command.MatrixType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Matrix environment body split into rows of cells. Rows may be ragged.
 */
public class MatrixNode extends LatexNode {

    private final MatrixType matrixType;
    private final List<List<List<LatexNode>>> rows;

    public MatrixNode(int position, MatrixType matrixType, List<List<List<LatexNode>>> rows) {
        super(position);
        this.matrixType = matrixType;
        List<List<List<LatexNode>>> copy = new ArrayList<>(rows.size());
        for (List<List<LatexNode>> row : rows) {
            List<List<LatexNode>> rowCopy = new ArrayList<>(row.size());
            for (List<LatexNode> cell : row) {
                rowCopy.add(List.copyOf(cell));
            }
            copy.add(List.copyOf(rowCopy));
        }
        this.rows = List.copyOf(copy);
    }

    @Override
    public LatexNodeType getType() {
        return LatexNodeType.MATRIX;
    }

    public MatrixType getMatrixType() {
        return matrixType;
    }

    public List<List<List<LatexNode>>> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    /**
     * Width of the widest row.
     */
    public int getColumnCount() {
        int columns = 0;
        for (List<List<LatexNode>> row : rows) {
            columns = Math.max(columns, row.size());
        }
        return columns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MatrixNode)) return false;
        MatrixNode that = (MatrixNode) o;
        return matrixType == that.matrixType && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(matrixType, rows);
    }

    @Override
    public String toString() {
        return matrixType.getEnvironment() + rows;
    }
}

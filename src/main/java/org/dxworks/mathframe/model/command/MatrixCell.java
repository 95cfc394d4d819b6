package org.dxworks.mathframe.model.command;

import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.model.NodeIdGenerator;

public class MatrixCell extends Block {

    private final Matrix matrix;
    private final int row;
    private final int column;

    MatrixCell(NodeIdGenerator ids, Matrix matrix, int row, int column) {
        super(ids, matrix);
        this.matrix = matrix;
        this.row = row;
        this.column = column;
    }

    public Matrix getMatrix() {
        return matrix;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }
}

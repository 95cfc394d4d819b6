package org.dxworks.mathframe.editor;

/**
 * Called after every operation that changes the content of a {@link MathField}.
 */
public interface EditListener {

    void onEdit(MathField field);
}

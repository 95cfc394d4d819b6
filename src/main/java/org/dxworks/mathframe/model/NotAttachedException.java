package org.dxworks.mathframe.model;

public class NotAttachedException extends StructuralIntegrityException {

    public NotAttachedException(MathNode node) {
        super("Node " + node.getId() + " (" + node.getKind() + ") is not attached to a block");
    }
}

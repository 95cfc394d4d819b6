package org.dxworks.mathframe.model;

import org.dxworks.mathframe.serializer.LatexSerializer;
import org.dxworks.mathframe.serializer.TextSerializer;

import java.util.ArrayList;
import java.util.List;

/**
 * A contiguous run of siblings inside one block, from {@code leftEnd} to {@code rightEnd} inclusive.
 */
public class NodeFragment {

    private final MathNode leftEnd;
    private final MathNode rightEnd;

    public NodeFragment(MathNode leftEnd, MathNode rightEnd) {
        if (leftEnd.getParent() == null || leftEnd.getParent() != rightEnd.getParent()) {
            throw new StructuralIntegrityException("Fragment ends must share a block");
        }
        this.leftEnd = leftEnd;
        this.rightEnd = rightEnd;
    }

    public MathNode getLeftEnd() {
        return leftEnd;
    }

    public MathNode getRightEnd() {
        return rightEnd;
    }

    public Block getParent() {
        return leftEnd.getParent();
    }

    public List<MathNode> nodes() {
        List<MathNode> nodes = new ArrayList<>();
        MathNode current = leftEnd;
        while (current != null) {
            nodes.add(current);
            if (current == rightEnd) {
                return nodes;
            }
            current = current.getRight();
        }
        throw new StructuralIntegrityException("Fragment end " + rightEnd.getId() + " is not right of " + leftEnd.getId());
    }

    public int size() {
        return nodes().size();
    }

    /**
     * Unlinks the fragment from its block and returns the detached nodes.
     */
    public List<MathNode> remove() {
        return getParent().removeRange(leftEnd, rightEnd);
    }

    public String latex() {
        return LatexSerializer.serializeNodes(nodes());
    }

    public String text() {
        return TextSerializer.serializeNodes(nodes());
    }
}

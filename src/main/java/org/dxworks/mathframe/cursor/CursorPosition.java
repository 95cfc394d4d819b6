package org.dxworks.mathframe.cursor;

import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.model.MathNode;
import org.dxworks.mathframe.model.NotAttachedException;

/**
 * Snapshot of a cursor location: a block and the two nodes the cursor sits between.
 */
public class CursorPosition {

    private final Block block;
    private final MathNode left;
    private final MathNode right;

    public CursorPosition(Block block, MathNode left, MathNode right) {
        this.block = block;
        this.left = left;
        this.right = right;
    }

    public static CursorPosition start(Block block) {
        return new CursorPosition(block, null, block.getFirstChild());
    }

    public static CursorPosition end(Block block) {
        return new CursorPosition(block, block.getLastChild(), null);
    }

    public static CursorPosition before(MathNode node) {
        if (node.getParent() == null) {
            throw new NotAttachedException(node);
        }
        return new CursorPosition(node.getParent(), node.getLeft(), node);
    }

    public static CursorPosition after(MathNode node) {
        if (node.getParent() == null) {
            throw new NotAttachedException(node);
        }
        return new CursorPosition(node.getParent(), node, node.getRight());
    }

    /**
     * Position after the first {@code offset} children of {@code block}, clamped to its length.
     */
    public static CursorPosition atOffset(Block block, int offset) {
        int clamped = Math.min(offset, block.size());
        if (clamped <= 0) {
            return start(block);
        }
        MathNode left = block.childAt(clamped - 1);
        return new CursorPosition(block, left, left.getRight());
    }

    public Block getBlock() {
        return block;
    }

    public MathNode getLeft() {
        return left;
    }

    public MathNode getRight() {
        return right;
    }

    /**
     * Number of nodes to the left of this position.
     */
    public int offset() {
        return left == null ? 0 : block.indexOf(left) + 1;
    }

    /**
     * True while both neighbours are still children of the block and adjacent to each other.
     */
    public boolean isValid() {
        if (block == null) {
            return false;
        }
        if (left != null && left.getParent() != block) {
            return false;
        }
        if (right != null && right.getParent() != block) {
            return false;
        }
        MathNode expectedRight = left == null ? block.getFirstChild() : left.getRight();
        return expectedRight == right;
    }

    @Override
    public String toString() {
        return "block#" + block.getId() + "@" + offset();
    }
}

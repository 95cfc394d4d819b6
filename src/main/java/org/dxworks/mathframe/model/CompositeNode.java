package org.dxworks.mathframe.model;

import java.util.List;

/**
 * A node that owns one or more blocks. Subclasses decide how the cursor enters them
 * and how vertical movement maps between their blocks.
 */
public abstract class CompositeNode extends MathNode {

    protected CompositeNode(NodeIdGenerator ids) {
        super(ids);
    }

    @Override
    public abstract List<Block> getBlocks();

    /**
     * True when the blocks are stacked vertically (fraction, scripts, limits).
     * Such nodes are entered at the preferred vertical block rather than the first one.
     */
    public boolean isVerticalStack() {
        return false;
    }

    /**
     * Block the cursor lands in when it crosses into this node moving in {@code direction}.
     */
    public Block entryBlock(Direction direction, VerticalDirection preference) {
        List<Block> blocks = getBlocks();
        if (isVerticalStack() && blocks.size() > 1) {
            Block preferred = preference == VerticalDirection.UP ? upperBlock() : lowerBlock();
            if (preferred != null) {
                return preferred;
            }
        }
        return direction == Direction.RIGHT ? blocks.get(0) : blocks.get(blocks.size() - 1);
    }

    /**
     * Next block in horizontal reading order, or null if leaving {@code block} in
     * {@code direction} exits the node.
     */
    public Block adjacentBlock(Block block, Direction direction) {
        if (isVerticalStack()) {
            return null;
        }
        List<Block> blocks = getBlocks();
        int index = indexOfBlock(block);
        int next = direction == Direction.RIGHT ? index + 1 : index - 1;
        return next >= 0 && next < blocks.size() ? blocks.get(next) : null;
    }

    /**
     * Block reached from {@code block} by moving up or down, or null when there is none.
     */
    public Block blockInDirection(Block block, VerticalDirection direction) {
        if (!isVerticalStack()) {
            return null;
        }
        if (direction == VerticalDirection.UP && block == lowerBlock()) {
            return upperBlock();
        }
        if (direction == VerticalDirection.DOWN && block == upperBlock()) {
            return lowerBlock();
        }
        return null;
    }

    protected Block upperBlock() {
        return null;
    }

    protected Block lowerBlock() {
        return null;
    }

    public boolean allBlocksEmpty() {
        for (Block block : getBlocks()) {
            if (!block.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
     * True if {@code block} is owned by this node or nested anywhere inside it.
     */
    public boolean isAncestorOfBlock(Block block) {
        CompositeNode current = block.getOwner();
        while (current != null) {
            if (current == this) {
                return true;
            }
            current = current.getOwner();
        }
        return false;
    }

    public int indexOfBlock(Block block) {
        List<Block> blocks = getBlocks();
        for (int i = 0; i < blocks.size(); i++) {
            if (blocks.get(i) == block) {
                return i;
            }
        }
        throw new StructuralIntegrityException("Block " + block.getId() + " is not owned by node " + getId());
    }
}

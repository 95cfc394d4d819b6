package org.dxworks.mathframe.model;

import org.dxworks.mathframe.serializer.LatexSerializer;
import org.dxworks.mathframe.serializer.SpeechSerializer;
import org.dxworks.mathframe.serializer.TextSerializer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * A node of the formula tree. Every node sits in exactly one {@link Block} while attached,
 * linked to its neighbours in a doubly-linked sibling list.
 */
public abstract class MathNode {

    private final int id;

    // sibling links are maintained exclusively by Block
    Block parent;
    MathNode left;
    MathNode right;

    protected MathNode(NodeIdGenerator ids) {
        this.id = ids.next();
    }

    public int getId() {
        return id;
    }

    public abstract NodeKind getKind();

    public abstract <R> R accept(NodeVisitor<R> visitor);

    /**
     * Blocks owned by this node in reading order. Empty for leaves.
     */
    public List<Block> getBlocks() {
        return Collections.emptyList();
    }

    public boolean isLeaf() {
        return !getKind().isComposite();
    }

    public Block getParent() {
        return parent;
    }

    public boolean isAttached() {
        return parent != null;
    }

    public MathNode getLeft() {
        return left;
    }

    public MathNode getRight() {
        return right;
    }

    public MathNode sibling(Direction direction) {
        return direction == Direction.LEFT ? left : right;
    }

    /**
     * Composite node owning the block this node sits in, or null at the top level.
     */
    public CompositeNode getOwner() {
        return parent == null ? null : parent.getOwner();
    }

    /**
     * Outermost ancestor node, or this node when it sits in a root block.
     */
    public MathNode root() {
        MathNode current = this;
        while (current.getOwner() != null) {
            current = current.getOwner();
        }
        return current;
    }

    /**
     * Number of composite ancestors. Top-level nodes have depth 0.
     */
    public int depth() {
        int depth = 0;
        CompositeNode owner = getOwner();
        while (owner != null) {
            depth++;
            owner = owner.getOwner();
        }
        return depth;
    }

    public boolean isAncestorOf(MathNode other) {
        CompositeNode owner = other.getOwner();
        while (owner != null) {
            if (owner == this) {
                return true;
            }
            owner = owner.getOwner();
        }
        return false;
    }

    /**
     * First-level content of every owned block, in block order.
     */
    public List<MathNode> children() {
        List<MathNode> children = new ArrayList<>();
        for (Block block : getBlocks()) {
            for (MathNode child : block.children()) {
                children.add(child);
            }
        }
        return children;
    }

    public List<MathNode> childrenReverse() {
        List<MathNode> children = children();
        Collections.reverse(children);
        return children;
    }

    public void preOrder(Consumer<MathNode> action) {
        action.accept(this);
        for (Block block : getBlocks()) {
            block.preOrder(action);
        }
    }

    public void postOrder(Consumer<MathNode> action) {
        for (Block block : getBlocks()) {
            block.postOrder(action);
        }
        action.accept(this);
    }

    public List<MathNode> descendants() {
        List<MathNode> result = new ArrayList<>();
        for (Block block : getBlocks()) {
            block.preOrder(result::add);
        }
        return result;
    }

    public MathNode leftmostLeaf() {
        MathNode current = this;
        while (!current.isLeaf()) {
            MathNode next = null;
            for (Block block : current.getBlocks()) {
                if (!block.isEmpty()) {
                    next = block.getFirstChild();
                    break;
                }
            }
            if (next == null) {
                return current;
            }
            current = next;
        }
        return current;
    }

    public MathNode rightmostLeaf() {
        MathNode current = this;
        while (!current.isLeaf()) {
            MathNode next = null;
            List<Block> blocks = current.getBlocks();
            for (int i = blocks.size() - 1; i >= 0; i--) {
                if (!blocks.get(i).isEmpty()) {
                    next = blocks.get(i).getLastChild();
                    break;
                }
            }
            if (next == null) {
                return current;
            }
            current = next;
        }
        return current;
    }

    /**
     * Detaches this node from its block.
     *
     * @throws NotAttachedException if the node is not in a block
     */
    public void remove() {
        if (parent == null) {
            throw new NotAttachedException(this);
        }
        parent.removeChild(this);
    }

    public String latex() {
        return LatexSerializer.serialize(this);
    }

    public String text() {
        return TextSerializer.serialize(this);
    }

    public String speech() {
        return SpeechSerializer.serialize(this);
    }

    @Override
    public String toString() {
        return getKind().getName() + "#" + id + "[" + latex() + "]";
    }
}

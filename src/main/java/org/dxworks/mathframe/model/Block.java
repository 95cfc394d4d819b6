package org.dxworks.mathframe.model;

import org.dxworks.mathframe.serializer.LatexSerializer;
import org.dxworks.mathframe.serializer.SpeechSerializer;
import org.dxworks.mathframe.serializer.TextSerializer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Consumer;

/**
 * Ordered container of sibling nodes. A block is either the root of a document or
 * owned by exactly one composite node.
 */
public class Block {

    private final int id;
    private final CompositeNode owner;
    private MathNode firstChild;
    private MathNode lastChild;

    public Block(NodeIdGenerator ids, CompositeNode owner) {
        this.id = ids.next();
        this.owner = owner;
    }

    public static Block root(NodeIdGenerator ids) {
        return new Block(ids, null);
    }

    public int getId() {
        return id;
    }

    public CompositeNode getOwner() {
        return owner;
    }

    public boolean isRoot() {
        return owner == null;
    }

    public MathNode getFirstChild() {
        return firstChild;
    }

    public MathNode getLastChild() {
        return lastChild;
    }

    public MathNode end(Direction direction) {
        return direction == Direction.LEFT ? firstChild : lastChild;
    }

    public boolean isEmpty() {
        return firstChild == null;
    }

    /**
     * Outermost block reachable by walking owners upwards.
     */
    public Block rootBlock() {
        Block current = this;
        while (current.owner != null && current.owner.getParent() != null) {
            current = current.owner.getParent();
        }
        return current;
    }

    public void append(MathNode node) {
        insertChild(node, null);
    }

    public void prepend(MathNode node) {
        insertChild(node, firstChild);
    }

    /**
     * Links {@code node} immediately before {@code before}, or at the end when {@code before} is null.
     *
     * @throws StructuralIntegrityException if the node is already attached or {@code before} is not a child
     */
    public void insertChild(MathNode node, MathNode before) {
        if (node.parent != null) {
            throw new StructuralIntegrityException("Node " + node.getId() + " is already attached to block " + node.parent.id);
        }
        if (before != null && before.parent != this) {
            throw new StructuralIntegrityException("Node " + before.getId() + " is not a child of block " + id);
        }
        if (node instanceof CompositeNode && ((CompositeNode) node).isAncestorOfBlock(this)) {
            throw new StructuralIntegrityException("Node " + node.getId() + " cannot be inserted into its own descendant");
        }
        MathNode after = before == null ? lastChild : before.left;
        node.parent = this;
        node.left = after;
        node.right = before;
        if (after == null) {
            firstChild = node;
        } else {
            after.right = node;
        }
        if (before == null) {
            lastChild = node;
        } else {
            before.left = node;
        }
    }

    void removeChild(MathNode node) {
        if (node.parent != this) {
            throw new NotAttachedException(node);
        }
        if (node.left == null) {
            firstChild = node.right;
        } else {
            node.left.right = node.right;
        }
        if (node.right == null) {
            lastChild = node.left;
        } else {
            node.right.left = node.left;
        }
        node.parent = null;
        node.left = null;
        node.right = null;
    }

    /**
     * Unlinks the contiguous run {@code leftEnd..rightEnd} and returns it in order.
     */
    public List<MathNode> removeRange(MathNode leftEnd, MathNode rightEnd) {
        List<MathNode> removed = new ArrayList<>();
        if (leftEnd.parent != this || rightEnd.parent != this) {
            throw new StructuralIntegrityException("Range is not contained in block " + id);
        }
        MathNode current = leftEnd;
        while (true) {
            if (current == null) {
                throw new StructuralIntegrityException("Range end " + rightEnd.getId() + " does not follow " + leftEnd.getId());
            }
            removed.add(current);
            if (current == rightEnd) {
                break;
            }
            current = current.right;
        }
        for (MathNode node : removed) {
            removeChild(node);
        }
        return removed;
    }

    /**
     * Moves every child of this block to the end of {@code target}, keeping order.
     */
    public void moveChildrenTo(Block target) {
        while (firstChild != null) {
            MathNode node = firstChild;
            removeChild(node);
            target.append(node);
        }
    }

    public void clear() {
        while (firstChild != null) {
            removeChild(firstChild);
        }
    }

    public int size() {
        int size = 0;
        for (MathNode node = firstChild; node != null; node = node.right) {
            size++;
        }
        return size;
    }

    /**
     * Child at zero-based {@code index}, or null if out of range.
     */
    public MathNode childAt(int index) {
        int i = 0;
        for (MathNode node = firstChild; node != null; node = node.right) {
            if (i++ == index) {
                return node;
            }
        }
        return null;
    }

    public int indexOf(MathNode node) {
        int i = 0;
        for (MathNode current = firstChild; current != null; current = current.right) {
            if (current == node) {
                return i;
            }
            i++;
        }
        return -1;
    }

    public Iterable<MathNode> children() {
        return () -> new SiblingIterator(firstChild, Direction.RIGHT);
    }

    public Iterable<MathNode> childrenReverse() {
        return () -> new SiblingIterator(lastChild, Direction.LEFT);
    }

    public List<MathNode> childList() {
        List<MathNode> list = new ArrayList<>();
        children().forEach(list::add);
        return Collections.unmodifiableList(list);
    }

    public void preOrder(Consumer<MathNode> action) {
        for (MathNode child : children()) {
            child.preOrder(action);
        }
    }

    public void postOrder(Consumer<MathNode> action) {
        for (MathNode child : children()) {
            child.postOrder(action);
        }
    }

    /**
     * Checks the sibling links of this block and every nested block.
     *
     * @throws StructuralIntegrityException on the first broken link
     */
    public void verify() {
        MathNode previous = null;
        for (MathNode node = firstChild; node != null; node = node.right) {
            if (node.parent != this) {
                throw new StructuralIntegrityException("Node " + node.getId() + " has wrong parent in block " + id);
            }
            if (node.left != previous) {
                throw new StructuralIntegrityException("Broken left link at node " + node.getId());
            }
            for (Block block : node.getBlocks()) {
                if (block.owner != node) {
                    throw new StructuralIntegrityException("Block " + block.id + " has wrong owner");
                }
                block.verify();
            }
            previous = node;
        }
        if (lastChild != previous) {
            throw new StructuralIntegrityException("Block " + id + " has a stale last child");
        }
    }

    public String latex() {
        return LatexSerializer.serializeBlock(this);
    }

    public String text() {
        return TextSerializer.serializeBlock(this);
    }

    public String speech() {
        return SpeechSerializer.serializeBlock(this);
    }

    @Override
    public String toString() {
        return "block#" + id + "[" + latex() + "]";
    }

    private static class SiblingIterator implements Iterator<MathNode> {
        private MathNode next;
        private final Direction direction;

        SiblingIterator(MathNode start, Direction direction) {
            this.next = start;
            this.direction = direction;
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public MathNode next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            MathNode current = next;
            next = current.sibling(direction);
            return current;
        }
    }
}

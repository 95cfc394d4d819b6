package org.dxworks.mathframe.cursor;

import org.dxworks.mathframe.model.Block;
import org.dxworks.mathframe.model.CompositeNode;
import org.dxworks.mathframe.model.Direction;
import org.dxworks.mathframe.model.MathNode;
import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.StructuralIntegrityException;
import org.dxworks.mathframe.model.VerticalDirection;
import org.dxworks.mathframe.model.command.TextStyleSpan;
import org.dxworks.mathframe.model.symbol.MathSymbol;

import java.util.Collections;
import java.util.List;

/**
 * Insertion point inside a block, between {@code left} and {@code right}.
 * Either neighbour may be null at the block edges.
 * <p>
 * Navigation methods return false when there is nowhere to go and leave the tree untouched.
 * Every navigation clears the active selection.
 */
public class Cursor {

    private final NodeIdGenerator ids;
    private final VerticalDirection verticalEntry;

    private Block parent;
    private MathNode left;
    private MathNode right;

    private CursorPosition anchor;
    private Selection selection;

    public Cursor(Block root, NodeIdGenerator ids, VerticalDirection verticalEntry) {
        this.ids = ids;
        this.verticalEntry = verticalEntry;
        this.parent = root;
        this.left = null;
        this.right = root.getFirstChild();
    }

    public Block getParent() {
        return parent;
    }

    public MathNode getLeft() {
        return left;
    }

    public MathNode getRight() {
        return right;
    }

    public MathNode neighbor(Direction direction) {
        return direction == Direction.LEFT ? left : right;
    }

    public VerticalDirection getVerticalEntry() {
        return verticalEntry;
    }

    // ---- positioning ----

    public CursorPosition getPosition() {
        return new CursorPosition(parent, left, right);
    }

    /**
     * Moves back to a position saved earlier.
     *
     * @throws StructuralIntegrityException if the tree changed so that the position no longer exists
     */
    public void restorePosition(CursorPosition position) {
        if (!position.isValid()) {
            throw new StructuralIntegrityException("Cannot restore stale cursor position " + position);
        }
        clearSelection();
        this.parent = position.getBlock();
        this.left = position.getLeft();
        this.right = position.getRight();
    }

    public void moveToStartOf(Block block) {
        parent = block;
        left = null;
        right = block.getFirstChild();
    }

    public void moveToEndOf(Block block) {
        parent = block;
        left = block.getLastChild();
        right = null;
    }

    public void placeBefore(MathNode node) {
        restorePosition(CursorPosition.before(node));
    }

    public void placeAfter(MathNode node) {
        restorePosition(CursorPosition.after(node));
    }

    public int offset() {
        return left == null ? 0 : parent.indexOf(left) + 1;
    }

    public boolean isAtStart() {
        return left == null;
    }

    public boolean isAtEnd() {
        return right == null;
    }

    // ---- navigation ----

    public boolean moveLeft() {
        return move(Direction.LEFT);
    }

    public boolean moveRight() {
        return move(Direction.RIGHT);
    }

    public boolean moveUp() {
        return moveVertical(VerticalDirection.UP);
    }

    public boolean moveDown() {
        return moveVertical(VerticalDirection.DOWN);
    }

    public boolean move(Direction direction) {
        clearSelection();
        verifyConsistency();
        MathNode sibling = neighbor(direction);
        if (sibling == null) {
            return exitBlock(direction);
        }
        if (sibling instanceof CompositeNode) {
            enterBlock(((CompositeNode) sibling).entryBlock(direction, verticalEntry), direction);
        } else {
            stepOver(sibling, direction);
        }
        return true;
    }

    public boolean moveToStart() {
        clearSelection();
        boolean moved = left != null;
        moveToStartOf(parent);
        return moved;
    }

    public boolean moveToEnd() {
        clearSelection();
        boolean moved = right != null;
        moveToEndOf(parent);
        return moved;
    }

    /**
     * Moves to the block above or below, keeping the horizontal offset where the target is long enough.
     * Climbs through enclosing composites until one of them has a block in that direction.
     */
    public boolean moveVertical(VerticalDirection direction) {
        clearSelection();
        verifyConsistency();
        Block block = parent;
        int offset = offset();
        while (block.getOwner() != null) {
            CompositeNode owner = block.getOwner();
            Block target = owner.blockInDirection(block, direction);
            if (target != null) {
                restorePosition(CursorPosition.atOffset(target, offset));
                return true;
            }
            if (owner.getParent() == null) {
                return false;
            }
            block = owner.getParent();
            offset = block.indexOf(owner);
        }
        return false;
    }

    private void enterBlock(Block block, Direction direction) {
        if (direction == Direction.RIGHT) {
            moveToStartOf(block);
        } else {
            moveToEndOf(block);
        }
    }

    private void stepOver(MathNode node, Direction direction) {
        if (direction == Direction.RIGHT) {
            left = node;
            right = node.getRight();
        } else {
            right = node;
            left = node.getLeft();
        }
    }

    private boolean exitBlock(Direction direction) {
        CompositeNode owner = parent.getOwner();
        if (owner == null) {
            return false;
        }
        Block adjacent = owner.adjacentBlock(parent, direction);
        if (adjacent != null) {
            enterBlock(adjacent, direction);
            return true;
        }
        if (owner.getParent() == null) {
            return false;
        }
        if (direction == Direction.RIGHT) {
            placeAfter(owner);
        } else {
            placeBefore(owner);
        }
        return true;
    }

    // ---- editing ----

    public void insert(MathNode node) {
        insert(node, true);
    }

    /**
     * Links {@code node} at the cursor and moves the cursor past it. An active selection is
     * replaced. With {@code autoExit}, typing a leaf into an auto-exit style span ejects the
     * cursor right after the span.
     */
    public void insert(MathNode node, boolean autoExit) {
        deleteSelection();
        verifyConsistency();
        parent.insertChild(node, right);
        left = node;
        if (autoExit && node.isLeaf()) {
            CompositeNode owner = parent.getOwner();
            if (owner instanceof TextStyleSpan && ((TextStyleSpan) owner).isAutoExit() && owner.getParent() != null) {
                placeAfter(owner);
            }
        }
    }

    public boolean backspace() {
        return delete(Direction.LEFT);
    }

    public boolean deleteForward() {
        return delete(Direction.RIGHT);
    }

    private boolean delete(Direction direction) {
        if (selection != null) {
            return deleteSelection();
        }
        anchor = null;
        verifyConsistency();
        MathNode target = neighbor(direction);
        if (target == null) {
            return deleteOutOf(direction);
        }
        if (direction == Direction.LEFT && target instanceof MathSymbol && ((MathSymbol) target).canDegrade()) {
            MathSymbol degraded = ((MathSymbol) target).createDegraded(ids);
            parent.insertChild(degraded, target);
            target.remove();
            left = degraded;
            return true;
        }
        MathNode next = target.sibling(direction);
        target.remove();
        if (direction == Direction.LEFT) {
            left = next;
        } else {
            right = next;
        }
        return true;
    }

    /**
     * Deleting past the edge of an inner block removes the owning composite only when all of
     * its blocks are empty. Otherwise the cursor steps out of the composite and nothing is lost.
     */
    private boolean deleteOutOf(Direction direction) {
        CompositeNode owner = parent.getOwner();
        if (owner == null || owner.getParent() == null) {
            return false;
        }
        if (owner.allBlocksEmpty()) {
            Block outer = owner.getParent();
            MathNode before = owner.getLeft();
            MathNode after = owner.getRight();
            owner.remove();
            parent = outer;
            left = before;
            right = after;
            return true;
        }
        if (direction == Direction.LEFT) {
            placeBefore(owner);
        } else {
            placeAfter(owner);
        }
        return true;
    }

    // ---- selection ----

    public Selection getSelection() {
        return selection;
    }

    public boolean hasSelection() {
        return selection != null;
    }

    public List<MathNode> getSelectedNodes() {
        return selection == null ? Collections.emptyList() : selection.nodes();
    }

    public String selectionLatex() {
        return selection == null ? "" : selection.latex();
    }

    /**
     * Extends the selection by one step. At the edge of an inner block the selection grows
     * to cover the whole enclosing composite.
     */
    public boolean select(Direction direction) {
        verifyConsistency();
        if (anchor == null) {
            anchor = getPosition();
        }
        MathNode sibling = neighbor(direction);
        if (sibling != null) {
            stepOver(sibling, direction);
        } else {
            CompositeNode owner = parent.getOwner();
            if (owner == null || owner.getParent() == null) {
                return false;
            }
            CursorPosition newAnchor = direction == Direction.RIGHT
                    ? CursorPosition.before(owner)
                    : CursorPosition.after(owner);
            CursorPosition focus = direction == Direction.RIGHT
                    ? CursorPosition.after(owner)
                    : CursorPosition.before(owner);
            parent = focus.getBlock();
            left = focus.getLeft();
            right = focus.getRight();
            anchor = newAnchor;
        }
        updateSelection();
        return true;
    }

    public boolean selectAll() {
        Block root = parent.rootBlock();
        anchor = CursorPosition.start(root);
        moveToEndOf(root);
        updateSelection();
        return selection != null;
    }

    public void clearSelection() {
        selection = null;
        anchor = null;
    }

    public boolean deleteSelection() {
        if (selection == null) {
            anchor = null;
            return false;
        }
        Block block = selection.getParent();
        MathNode before = selection.getLeftEnd().getLeft();
        MathNode after = selection.getRightEnd().getRight();
        selection.remove();
        parent = block;
        left = before;
        right = after;
        clearSelection();
        return true;
    }

    private void updateSelection() {
        int anchorOffset = anchor.offset();
        int cursorOffset = offset();
        if (anchorOffset == cursorOffset) {
            selection = null;
        } else if (anchorOffset < cursorOffset) {
            selection = new Selection(parent.childAt(anchorOffset), parent.childAt(cursorOffset - 1), Direction.RIGHT);
        } else {
            selection = new Selection(parent.childAt(cursorOffset), parent.childAt(anchorOffset - 1), Direction.LEFT);
        }
    }

    /**
     * @throws StructuralIntegrityException if the cursor's neighbours are no longer where it thinks they are
     */
    public void verifyConsistency() {
        if (parent == null) {
            throw new StructuralIntegrityException("Cursor has no parent block");
        }
        if (left != null && left.getParent() != parent) {
            throw new StructuralIntegrityException("Cursor left neighbour " + left.getId() + " is not in block " + parent.getId());
        }
        if (right != null && right.getParent() != parent) {
            throw new StructuralIntegrityException("Cursor right neighbour " + right.getId() + " is not in block " + parent.getId());
        }
        MathNode expectedRight = left == null ? parent.getFirstChild() : left.getRight();
        if (expectedRight != right) {
            throw new StructuralIntegrityException("Cursor neighbours are not adjacent in block " + parent.getId());
        }
    }

    @Override
    public String toString() {
        return "cursor@" + getPosition();
    }
}

package org.dxworks.mathframe.editor;

import java.util.ArrayList;
import java.util.List;

/**
 * Linear undo history of LaTeX snapshots. Recording after an undo discards the redo tail.
 */
public class EditHistory {

    private final int maxSize;
    private final List<String> snapshots = new ArrayList<>();
    private int index = -1;

    public EditHistory(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("History size must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
    }

    /**
     * Records {@code snapshot} as the current state. A snapshot equal to the current one is ignored.
     *
     * @return true if a new entry was added
     */
    public boolean record(String snapshot) {
        if (index >= 0 && snapshots.get(index).equals(snapshot)) {
            return false;
        }
        while (snapshots.size() > index + 1) {
            snapshots.remove(snapshots.size() - 1);
        }
        snapshots.add(snapshot);
        if (snapshots.size() > maxSize) {
            snapshots.remove(0);
        }
        index = snapshots.size() - 1;
        return true;
    }

    public boolean canUndo() {
        return index > 0;
    }

    public boolean canRedo() {
        return index < snapshots.size() - 1;
    }

    /**
     * @return the snapshot to restore, or null when there is nothing to undo
     */
    public String undo() {
        if (!canUndo()) {
            return null;
        }
        index--;
        return snapshots.get(index);
    }

    /**
     * @return the snapshot to restore, or null when there is nothing to redo
     */
    public String redo() {
        if (!canRedo()) {
            return null;
        }
        index++;
        return snapshots.get(index);
    }

    public String current() {
        return index >= 0 ? snapshots.get(index) : null;
    }

    public int size() {
        return snapshots.size();
    }

    public int getMaxSize() {
        return maxSize;
    }

    public void clear() {
        snapshots.clear();
        index = -1;
    }
}

package org.mazerun.maze.grid;

import java.util.BitSet;

/**
 * Compact store of open passages in a rectangular grid.
 * <p>
 * Every interior wall belongs to exactly one cell: the wall on its east side or the
 * wall on its south side. Two {@link java.util.BitSet}s indexed by {@code row * columns + column}
 * hold one bit per wall, so a grid costs about two bits per cell.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> This class is NOT thread-safe for writes. Concurrent
 * reads without writers are safe.
 * </p>
 */
final class PassageSet {

    private final int columns;
    private final BitSet eastOpen;
    private final BitSet southOpen;

    /**
     * Creates a fully walled passage set.
     *
     * @param rows number of grid rows.
     * @param columns number of grid columns.
     */
    PassageSet(int rows, int columns) {
        this.columns = columns;
        this.eastOpen = new BitSet(rows * columns);
        this.southOpen = new BitSet(rows * columns);
    }

    /**
     * Opens or closes the wall on the east side of {@code (row, column)}.
     */
    void setEast(int row, int column, boolean open) {
        eastOpen.set(index(row, column), open);
    }

    /**
     * Opens or closes the wall on the south side of {@code (row, column)}.
     */
    void setSouth(int row, int column, boolean open) {
        southOpen.set(index(row, column), open);
    }

    boolean isEastOpen(int row, int column) {
        return eastOpen.get(index(row, column));
    }

    boolean isSouthOpen(int row, int column) {
        return southOpen.get(index(row, column));
    }

    /**
     * Number of open passages currently stored.
     */
    int openCount() {
        return eastOpen.cardinality() + southOpen.cardinality();
    }

    /**
     * Walls every passage again.
     */
    void clear() {
        eastOpen.clear();
        southOpen.clear();
    }

    private int index(int row, int column) {
        return row * columns + column;
    }
}

package org.mazerun.maze.grid;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rectangular wall-based maze.
 *
 * <p>A new maze is fully walled; callers carve it with {@link #openPassage(Cell, Direction)}.
 * Open neighbors are always listed in {@link Direction} declaration order
 * (NORTH, EAST, SOUTH, WEST), which makes solver tie-breaking reproducible.</p>
 *
 * <p><strong>Thread Safety:</strong> reads may run concurrently; passage mutation must be
 * externally coordinated, and solvers bound to the maze must be invalidated afterwards.</p>
 */
public final class GridMaze implements MazeView {
    private static final Direction[] ENUMERATION_ORDER = Direction.values();

    @Getter
    @Accessors(fluent = true)
    private final int rows;
    @Getter
    @Accessors(fluent = true)
    private final int columns;
    private final Cell entry;
    private final Cell exit;
    private final PassageSet passages;

    /**
     * Creates a fully walled maze.
     *
     * @param rows number of rows, at least 1.
     * @param columns number of columns, at least 1.
     * @param entry start cell, inside the grid.
     * @param exit goal cell, inside the grid.
     * @throws IllegalArgumentException when dimensions or endpoints are out of range.
     */
    public GridMaze(int rows, int columns, Cell entry, Cell exit) {
        if (rows <= 0 || columns <= 0) {
            throw new IllegalArgumentException("grid dimensions must be positive: " + rows + "x" + columns);
        }
        if ((long) rows * columns > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("grid too large: " + rows + "x" + columns);
        }
        this.rows = rows;
        this.columns = columns;
        this.entry = requireInside(Objects.requireNonNull(entry, "entry"), "entry");
        this.exit = requireInside(Objects.requireNonNull(exit, "exit"), "exit");
        this.passages = new PassageSet(rows, columns);
    }

    /**
     * Creates a grid with every interior wall removed.
     */
    public static GridMaze open(int rows, int columns, Cell entry, Cell exit) {
        GridMaze maze = new GridMaze(rows, columns, entry, exit);
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                if (c + 1 < columns) {
                    maze.passages.setEast(r, c, true);
                }
                if (r + 1 < rows) {
                    maze.passages.setSouth(r, c, true);
                }
            }
        }
        return maze;
    }

    @Override
    public Cell entry() {
        return entry;
    }

    @Override
    public Cell exit() {
        return exit;
    }

    @Override
    public List<Neighbor> openNeighbors(Cell cell) {
        if (cell == null || !contains(cell)) {
            return List.of();
        }
        List<Neighbor> neighbors = new ArrayList<>(ENUMERATION_ORDER.length);
        for (Direction direction : ENUMERATION_ORDER) {
            if (isOpen(cell, direction)) {
                neighbors.add(new Neighbor(cell.neighbor(direction), direction));
            }
        }
        return neighbors;
    }

    /**
     * Checks whether a coordinate lies inside the grid.
     */
    public boolean contains(Cell cell) {
        return cell.row() >= 0 && cell.row() < rows && cell.column() >= 0 && cell.column() < columns;
    }

    /**
     * Total number of cells.
     */
    public int cellCount() {
        return rows * columns;
    }

    /**
     * Number of open passages in the grid.
     */
    public int openPassageCount() {
        return passages.openCount();
    }

    /**
     * Checks whether the wall between {@code cell} and its neighbor in {@code direction} is open.
     *
     * @return false for border walls and for cells outside the grid.
     */
    public boolean isOpen(Cell cell, Direction direction) {
        Objects.requireNonNull(direction, "direction");
        if (!contains(cell) || !contains(cell.neighbor(direction))) {
            return false;
        }
        return switch (direction) {
            case EAST -> passages.isEastOpen(cell.row(), cell.column());
            case SOUTH -> passages.isSouthOpen(cell.row(), cell.column());
            case WEST -> passages.isEastOpen(cell.row(), cell.column() - 1);
            case NORTH -> passages.isSouthOpen(cell.row() - 1, cell.column());
        };
    }

    /**
     * Removes the wall between {@code cell} and its neighbor in {@code direction}.
     *
     * @throws IllegalArgumentException when either side of the wall is outside the grid.
     */
    public void openPassage(Cell cell, Direction direction) {
        setPassage(cell, direction, true);
    }

    /**
     * Restores the wall between {@code cell} and its neighbor in {@code direction}.
     *
     * @throws IllegalArgumentException when either side of the wall is outside the grid.
     */
    public void closePassage(Cell cell, Direction direction) {
        setPassage(cell, direction, false);
    }

    /**
     * Walls every interior passage again.
     */
    public void closeAll() {
        passages.clear();
    }

    private void setPassage(Cell cell, Direction direction, boolean open) {
        Objects.requireNonNull(cell, "cell");
        Objects.requireNonNull(direction, "direction");
        Cell target = cell.neighbor(direction);
        if (!contains(cell) || !contains(target)) {
            throw new IllegalArgumentException("passage " + cell + " -> " + direction + " leaves the "
                    + rows + "x" + columns + " grid");
        }
        switch (direction) {
            case EAST -> passages.setEast(cell.row(), cell.column(), open);
            case SOUTH -> passages.setSouth(cell.row(), cell.column(), open);
            case WEST -> passages.setEast(target.row(), target.column(), open);
            case NORTH -> passages.setSouth(target.row(), target.column(), open);
        }
    }

    private Cell requireInside(Cell cell, String name) {
        if (!contains(cell)) {
            throw new IllegalArgumentException(name + " " + cell + " outside " + rows + "x" + columns + " grid");
        }
        return cell;
    }
}

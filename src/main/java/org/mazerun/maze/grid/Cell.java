package org.mazerun.maze.grid;

/**
 * Immutable grid coordinate.
 *
 * <p>Cells carry no bounds; whether a coordinate lies inside a maze is decided by the
 * {@link MazeView} that owns the grid.</p>
 *
 * @param row zero-based row, growing southwards.
 * @param column zero-based column, growing eastwards.
 */
public record Cell(int row, int column) {

    /**
     * Returns the coordinate one step away in the given direction.
     *
     * @param direction direction of travel.
     * @return adjacent coordinate (possibly outside any grid).
     */
    public Cell neighbor(Direction direction) {
        return new Cell(row + direction.rowDelta(), column + direction.columnDelta());
    }

    @Override
    public String toString() {
        return "(" + row + "," + column + ")";
    }
}

package org.mazerun.maze.grid;

import java.util.List;

/**
 * Read-only maze contract consumed by the solver.
 *
 * <p>Implementations must keep {@link #openNeighbors(Cell)} a pure query with a stable
 * order: among equal-length routes, the solver returns the one discovered first, so the
 * enumeration order decides which shortest path callers see.</p>
 */
public interface MazeView {

    /**
     * Cell where every route starts. Fixed for the lifetime of the maze.
     */
    Cell entry();

    /**
     * Cell every route must reach. Fixed for the lifetime of the maze.
     */
    Cell exit();

    /**
     * Lists cells reachable from {@code cell} in one step through an open passage.
     *
     * @param cell source cell.
     * @return neighbors in deterministic order; empty for isolated or out-of-grid cells.
     */
    List<Neighbor> openNeighbors(Cell cell);
}

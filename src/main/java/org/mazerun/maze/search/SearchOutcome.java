package org.mazerun.maze.search;

import org.mazerun.maze.grid.Direction;

import java.util.List;
import java.util.Objects;

/**
 * Result of one breadth-first search.
 *
 * <p>When {@code reachable=false}, {@code path} is empty. A reachable outcome with an
 * empty path means entry and exit are the same cell.</p>
 *
 * @param path unmodifiable moves from entry to exit.
 * @param reachable whether the exit was dequeued.
 * @param visitedCells number of cells discovered, entry included.
 */
public record SearchOutcome(List<Direction> path, boolean reachable, int visitedCells) {
    public SearchOutcome {
        path = List.copyOf(Objects.requireNonNull(path, "path"));
    }

    /**
     * Creates the canonical unreachable outcome.
     */
    static SearchOutcome unreachable(int visitedCells) {
        return new SearchOutcome(List.of(), false, visitedCells);
    }

    /**
     * Number of moves in the path.
     */
    public int length() {
        return path.size();
    }
}

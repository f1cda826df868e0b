package org.mazerun.maze.search;

import org.mazerun.maze.grid.Cell;
import org.mazerun.maze.grid.Direction;

import java.util.Objects;

/**
 * How a cell was first discovered during a search.
 *
 * <p>The entry cell is recorded as {@link Root}; every other discovered cell as a
 * {@link Step} naming its parent and the move taken from it.</p>
 */
public sealed interface Visit permits Visit.Root, Visit.Step {

    /**
     * Shared marker for the search origin.
     */
    Root ROOT = new Root();

    /**
     * Search origin; has no parent.
     */
    record Root() implements Visit {
    }

    /**
     * Discovery through one open passage.
     *
     * @param parent cell the search was expanding.
     * @param direction move from {@code parent} to the discovered cell.
     */
    record Step(Cell parent, Direction direction) implements Visit {
        public Step {
            Objects.requireNonNull(parent, "parent");
            Objects.requireNonNull(direction, "direction");
        }
    }
}

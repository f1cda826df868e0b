package org.mazerun.maze.grid;

import java.util.Objects;

/**
 * One open passage out of a cell.
 *
 * @param target cell reached through the passage.
 * @param direction direction of travel from the source cell.
 */
public record Neighbor(Cell target, Direction direction) {
    public Neighbor {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(direction, "direction");
    }
}

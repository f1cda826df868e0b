package org.mazerun.maze.core;

import lombok.experimental.UtilityClass;
import org.mazerun.maze.grid.Cell;
import org.mazerun.maze.grid.Direction;
import org.mazerun.maze.grid.MazeView;
import org.mazerun.maze.grid.Neighbor;

import java.util.List;
import java.util.Objects;

/**
 * Replays a move sequence against a maze's open passages.
 */
@UtilityClass
public final class PathReplay {
    public static final String REASON_PATH_MOVE_BLOCKED = "SOLVER_PATH_MOVE_BLOCKED";

    /**
     * Walks {@code path} from the maze entry.
     *
     * @param maze maze supplying open passages.
     * @param path moves to apply in order.
     * @return cell reached after the last move.
     * @throws SolverException when a move crosses a closed wall.
     */
    public static Cell replay(MazeView maze, List<Direction> path) {
        Objects.requireNonNull(maze, "maze");
        Objects.requireNonNull(path, "path");
        Cell current = maze.entry();
        for (int i = 0; i < path.size(); i++) {
            Direction direction = Objects.requireNonNull(path.get(i), "direction");
            current = step(maze, current, direction, i);
        }
        return current;
    }

    /**
     * Checks that {@code path} is walkable and ends on the maze exit.
     */
    public static boolean leadsToExit(MazeView maze, List<Direction> path) {
        try {
            return replay(maze, path).equals(maze.exit());
        } catch (SolverException ex) {
            return false;
        }
    }

    private static Cell step(MazeView maze, Cell from, Direction direction, int moveIndex) {
        for (Neighbor neighbor : maze.openNeighbors(from)) {
            if (neighbor.direction() == direction) {
                return neighbor.target();
            }
        }
        throw new SolverException(
                REASON_PATH_MOVE_BLOCKED,
                "move " + moveIndex + " (" + direction + ") from " + from + " crosses a closed wall"
        );
    }
}

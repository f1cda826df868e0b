package org.mazerun.app;

import org.mazerun.maze.core.MazeSolver;
import org.mazerun.maze.core.SolverConfig;
import org.mazerun.maze.grid.GridMaze;
import org.mazerun.maze.grid.MazeTextFormat;
import org.mazerun.maze.search.SearchOutcome;

import java.nio.file.Path;

/**
 * Minimal application entry point used for local smoke runs.
 */
public class Main {
    static final String SAMPLE_MAZE = String.join("\n",
            "#########",
            "#S#     #",
            "# # ### #",
            "#   #  E#",
            "#########"
    );

    /**
     * Solves the maze drawn in the file named by the first argument, or a built-in sample.
     *
     * @param args optional path to a text maze.
     */
    public static void main(String[] args) {
        GridMaze maze = args.length > 0
                ? MazeTextFormat.read(Path.of(args[0]))
                : MazeTextFormat.parse(SAMPLE_MAZE);

        MazeSolver solver = new MazeSolver(maze, SolverConfig.fromSystemProperties());
        SearchOutcome outcome = solver.lastOutcome();

        System.out.printf("Maze %dx%d, entry %s, exit %s%n",
                maze.rows(), maze.columns(), maze.entry(), maze.exit());
        if (!outcome.reachable()) {
            System.out.println("No path found");
            return;
        }
        System.out.println("Path: " + solver.pathAsString());
        System.out.println("Moves: " + outcome.length());
    }
}

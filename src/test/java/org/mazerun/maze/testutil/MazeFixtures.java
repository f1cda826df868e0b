package org.mazerun.maze.testutil;

import org.mazerun.maze.grid.Cell;
import org.mazerun.maze.grid.Direction;
import org.mazerun.maze.grid.GridMaze;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Random;

/**
 * Shared maze fixtures for solver tests.
 */
public final class MazeFixtures {
    public static final int UNREACHABLE = -1;

    private MazeFixtures() {
    }

    /**
     * Carves a perfect maze (one route between any two cells) by randomized depth-first walk.
     */
    public static GridMaze perfectMaze(int rows, int columns, Cell entry, Cell exit, Random random) {
        GridMaze maze = new GridMaze(rows, columns, entry, exit);
        boolean[][] seen = new boolean[rows][columns];
        Deque<Cell> stack = new ArrayDeque<>();
        stack.push(new Cell(0, 0));
        seen[0][0] = true;
        while (!stack.isEmpty()) {
            Cell current = stack.peek();
            List<Direction> options = new ArrayList<>(Arrays.asList(Direction.values()));
            Collections.shuffle(options, random);
            boolean advanced = false;
            for (Direction direction : options) {
                Cell next = current.neighbor(direction);
                if (maze.contains(next) && !seen[next.row()][next.column()]) {
                    maze.openPassage(current, direction);
                    seen[next.row()][next.column()] = true;
                    stack.push(next);
                    advanced = true;
                    break;
                }
            }
            if (!advanced) {
                stack.pop();
            }
        }
        return maze;
    }

    /**
     * Perfect maze with extra walls knocked down so several routes of different lengths exist.
     */
    public static GridMaze braidedMaze(int rows, int columns, Cell entry, Cell exit, Random random, double extraOpenRatio) {
        GridMaze maze = perfectMaze(rows, columns, entry, exit, random);
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                Cell cell = new Cell(r, c);
                if (c + 1 < columns && random.nextDouble() < extraOpenRatio) {
                    maze.openPassage(cell, Direction.EAST);
                }
                if (r + 1 < rows && random.nextDouble() < extraOpenRatio) {
                    maze.openPassage(cell, Direction.SOUTH);
                }
            }
        }
        return maze;
    }

    /**
     * Fully open grid split in two by a closed vertical wall between {@code wallColumn - 1} and {@code wallColumn}.
     */
    public static GridMaze partitionedMaze(int rows, int columns, int wallColumn, Cell entry, Cell exit) {
        GridMaze maze = GridMaze.open(rows, columns, entry, exit);
        for (int r = 0; r < rows; r++) {
            maze.closePassage(new Cell(r, wallColumn - 1), Direction.EAST);
        }
        return maze;
    }

    /**
     * Hop distance between entry and exit computed from raw wall state.
     *
     * @return distance in moves, or {@link #UNREACHABLE}.
     */
    public static int graphDistance(GridMaze maze) {
        int[][] distance = new int[maze.rows()][maze.columns()];
        for (int[] row : distance) {
            Arrays.fill(row, UNREACHABLE);
        }
        Deque<Cell> queue = new ArrayDeque<>();
        Cell entry = maze.entry();
        distance[entry.row()][entry.column()] = 0;
        queue.add(entry);
        while (!queue.isEmpty()) {
            Cell current = queue.poll();
            for (Direction direction : Direction.values()) {
                if (!maze.isOpen(current, direction)) {
                    continue;
                }
                Cell next = current.neighbor(direction);
                if (distance[next.row()][next.column()] == UNREACHABLE) {
                    distance[next.row()][next.column()] = distance[current.row()][current.column()] + 1;
                    queue.add(next);
                }
            }
        }
        return distance[maze.exit().row()][maze.exit().column()];
    }
}

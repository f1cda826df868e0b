package org.mazerun.maze.search;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayFIFOQueue;
import org.mazerun.maze.grid.Cell;
import org.mazerun.maze.grid.Direction;
import org.mazerun.maze.grid.MazeView;
import org.mazerun.maze.grid.Neighbor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fewest-moves search from a maze's entry to its exit.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Seed a FIFO frontier with the entry, recorded as {@link Visit#ROOT}.</li>
 * <li>Dequeue cells layer by layer; stop as soon as the exit is dequeued.</li>
 * <li>Expand neighbors in the order the maze reports them. The first discovery of a cell
 * wins and is never revisited, so among equal-length routes the earliest-enumerated one
 * is returned.</li>
 * <li>Walk {@link Visit.Step} records back from the exit and reverse them.</li>
 * </ul>
 *
 * <p>The maze is only queried, never modified. Instances hold no per-search state and may be
 * shared across threads when the maze supports concurrent reads.</p>
 */
public final class BreadthFirstSearch {
    private final SearchBudget budget;

    public BreadthFirstSearch() {
        this(SearchBudget.unbounded());
    }

    /**
     * @param budget bound on discovered cells per search.
     */
    public BreadthFirstSearch(SearchBudget budget) {
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    /**
     * Runs one search over the given maze.
     *
     * @param maze maze to search.
     * @return shortest path, or an unreachable outcome when the exit is never dequeued.
     * @throws SearchBudget.BudgetExceededException when more cells are discovered than the budget allows.
     */
    public SearchOutcome search(MazeView maze) {
        Objects.requireNonNull(maze, "maze");
        Cell entry = Objects.requireNonNull(maze.entry(), "entry");
        Cell exit = Objects.requireNonNull(maze.exit(), "exit");

        Object2ObjectOpenHashMap<Cell, Visit> visits = new Object2ObjectOpenHashMap<>();
        ObjectArrayFIFOQueue<Cell> frontier = new ObjectArrayFIFOQueue<>();
        visits.put(entry, Visit.ROOT);
        frontier.enqueue(entry);

        while (!frontier.isEmpty()) {
            Cell current = frontier.dequeue();
            if (current.equals(exit)) {
                return new SearchOutcome(reconstruct(visits, exit), true, visits.size());
            }
            for (Neighbor neighbor : maze.openNeighbors(current)) {
                Cell target = neighbor.target();
                if (visits.containsKey(target)) {
                    continue;
                }
                visits.put(target, new Visit.Step(current, neighbor.direction()));
                budget.checkVisitedCells(visits.size());
                frontier.enqueue(target);
            }
        }
        return SearchOutcome.unreachable(visits.size());
    }

    /**
     * Follows parent links from {@code exit} back to the root.
     */
    private static List<Direction> reconstruct(Object2ObjectOpenHashMap<Cell, Visit> visits, Cell exit) {
        List<Direction> reversed = new ArrayList<>();
        Cell cursor = exit;
        while (visits.get(cursor) instanceof Visit.Step step) {
            reversed.add(step.direction());
            cursor = step.parent();
        }
        Collections.reverse(reversed);
        return reversed;
    }
}

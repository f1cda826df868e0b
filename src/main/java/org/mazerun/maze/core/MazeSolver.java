package org.mazerun.maze.core;

import lombok.extern.slf4j.Slf4j;
import org.mazerun.maze.grid.Direction;
import org.mazerun.maze.grid.MazeView;
import org.mazerun.maze.search.BreadthFirstSearch;
import org.mazerun.maze.search.SearchBudget;
import org.mazerun.maze.search.SearchOutcome;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shortest entry-to-exit path for one bound maze.
 *
 * <p>The first {@link #solve()} runs a breadth-first search and caches its result, empty
 * paths included. Later calls return the identical list instance until {@link #invalidate()}
 * is called. The cache does not observe the maze: callers that mutate it must invalidate.</p>
 *
 * <p>An unreachable exit is a normal outcome and yields an empty path. So does a maze whose
 * entry equals its exit; callers that need to tell the two apart check
 * {@link SearchOutcome#reachable()} through {@link #lastOutcome()}.</p>
 *
 * <p><strong>Thread Safety:</strong> the cache check, search and cache write run under one
 * lock, so a shared solver searches at most once per invalidation.</p>
 */
@Slf4j
public final class MazeSolver {
    public static final String REASON_SEARCH_BUDGET_EXCEEDED = "SOLVER_SEARCH_BUDGET_EXCEEDED";

    private final MazeView maze;
    private final SolverConfig config;
    private final BreadthFirstSearch search;
    private final ReentrantLock lock = new ReentrantLock();

    private SearchOutcome cached;

    /**
     * Binds a solver to a maze with default configuration.
     *
     * @param maze maze to solve; never modified.
     */
    public MazeSolver(MazeView maze) {
        this(maze, SolverConfig.defaults());
    }

    /**
     * Binds a solver to a maze.
     *
     * @param maze maze to solve; never modified.
     * @param config caching and search-bound options.
     */
    public MazeSolver(MazeView maze, SolverConfig config) {
        this.maze = Objects.requireNonNull(maze, "maze");
        this.config = Objects.requireNonNull(config, "config");
        this.search = new BreadthFirstSearch(config.searchBudget());
    }

    /**
     * Returns the moves from entry to exit, computing them on first use.
     *
     * @return unmodifiable path; empty when no path exists or entry equals exit.
     * @throws SolverException when a configured search bound is exceeded.
     */
    public List<Direction> solve() {
        return lastOutcome().path();
    }

    /**
     * Returns the path as direction symbols, for example {@code "ESSE"}.
     *
     * @return concatenated symbols; empty iff {@link #solve()} is empty.
     */
    public String pathAsString() {
        List<Direction> path = solve();
        StringBuilder sb = new StringBuilder(path.size());
        for (Direction direction : path) {
            sb.append(direction.symbol());
        }
        return sb.toString();
    }

    /**
     * Drops the cached result so the next {@link #solve()} searches again.
     */
    public void invalidate() {
        lock.lock();
        try {
            if (cached != null) {
                log.debug("Invalidating cached path of length {}", cached.length());
            }
            cached = null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether a result is currently cached.
     */
    public boolean isCached() {
        lock.lock();
        try {
            return cached != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the full search outcome behind {@link #solve()}, computing it on first use.
     *
     * @throws SolverException when a configured search bound is exceeded.
     */
    public SearchOutcome lastOutcome() {
        lock.lock();
        try {
            if (cached != null) {
                log.debug("Returning cached path of length {}", cached.length());
                return cached;
            }
            SearchOutcome outcome = compute();
            if (config.isCacheEnabled()) {
                cached = outcome;
            }
            return outcome;
        } finally {
            lock.unlock();
        }
    }

    private SearchOutcome compute() {
        SearchOutcome outcome;
        try {
            outcome = search.search(maze);
        } catch (SearchBudget.BudgetExceededException ex) {
            throw new SolverException(REASON_SEARCH_BUDGET_EXCEEDED, ex.getMessage(), ex);
        }
        if (outcome.reachable()) {
            log.debug("Solved {} -> {}: {} moves, {} cells visited",
                    maze.entry(), maze.exit(), outcome.length(), outcome.visitedCells());
        } else {
            log.info("Exit {} unreachable from entry {} after visiting {} cells",
                    maze.exit(), maze.entry(), outcome.visitedCells());
        }
        return outcome;
    }
}

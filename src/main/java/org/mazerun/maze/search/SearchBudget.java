package org.mazerun.maze.search;

/**
 * Per-search bound on discovered cells.
 */
public final class SearchBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    static final String REASON_VISITED_EXCEEDED = "SEARCH_BUDGET_VISITED_EXCEEDED";

    private static final SearchBudget UNLIMITED = new SearchBudget(UNBOUNDED);

    private final int maxVisitedCells;

    private SearchBudget(int maxVisitedCells) {
        this.maxVisitedCells = normalizeBound(maxVisitedCells);
    }

    /**
     * Creates a budget; non-positive bounds mean unbounded.
     */
    public static SearchBudget of(int maxVisitedCells) {
        return new SearchBudget(maxVisitedCells);
    }

    public static SearchBudget unbounded() {
        return UNLIMITED;
    }

    public int maxVisitedCells() {
        return maxVisitedCells;
    }

    /**
     * Validates the discovered-cell count against the configured bound.
     *
     * @throws BudgetExceededException when the bound is exceeded.
     */
    void checkVisitedCells(int visitedCells) {
        if (visitedCells > maxVisitedCells) {
            throw new BudgetExceededException(
                    REASON_VISITED_EXCEEDED,
                    "visited-cell budget exceeded: " + visitedCells + " > " + maxVisitedCells
            );
        }
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    /**
     * Deterministic exception for budget fail-fast paths.
     */
    public static final class BudgetExceededException extends RuntimeException {
        private final String reasonCode;

        BudgetExceededException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }

        public String reasonCode() {
            return reasonCode;
        }
    }
}

package org.mazerun.maze.core;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.mazerun.maze.search.SearchBudget;

/**
 * Runtime options for {@link MazeSolver}.
 */
@Slf4j
@Value
@Builder
public class SolverConfig {
    public static final String PROP_CACHE_ENABLED = "mazerun.solver.cacheEnabled";
    public static final String PROP_MAX_VISITED_CELLS = "mazerun.solver.maxVisitedCells";

    private static final SolverConfig DEFAULTS = SolverConfig.builder().build();

    /**
     * When false, every {@code solve()} call recomputes the path.
     */
    @Builder.Default
    boolean cacheEnabled = true;

    /**
     * Upper bound on cells discovered per search. Non-positive or {@link SearchBudget#UNBOUNDED} means no bound.
     */
    @Builder.Default
    int maxVisitedCells = SearchBudget.UNBOUNDED;

    /**
     * Default configuration: caching on, no search bound.
     */
    public static SolverConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Loads options from system properties, falling back to defaults for missing or malformed values.
     */
    public static SolverConfig fromSystemProperties() {
        return SolverConfig.builder()
                .cacheEnabled(readBoolean(PROP_CACHE_ENABLED, DEFAULTS.cacheEnabled))
                .maxVisitedCells(readBound(PROP_MAX_VISITED_CELLS, DEFAULTS.maxVisitedCells))
                .build();
    }

    SearchBudget searchBudget() {
        return SearchBudget.of(maxVisitedCells);
    }

    private static boolean readBoolean(String property, boolean fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String value = raw.trim();
        if (value.equalsIgnoreCase("true")) {
            return true;
        }
        if (value.equalsIgnoreCase("false")) {
            return false;
        }
        log.warn("Ignoring malformed {}={}, using {}", property, raw, fallback);
        return fallback;
    }

    private static int readBound(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            log.warn("Ignoring malformed {}={}, using {}", property, raw, fallback);
            return fallback;
        }
    }
}

package org.mazerun.maze.grid;

/**
 * Cardinal move between two adjacent cells.
 *
 * <p>Declaration order is the canonical enumeration order used by {@link GridMaze}
 * when listing open neighbors.</p>
 */
public enum Direction {
    NORTH('N', -1, 0),
    EAST('E', 0, 1),
    SOUTH('S', 1, 0),
    WEST('W', 0, -1);

    private static final Direction[] BY_SYMBOL = new Direction[128];

    static {
        for (Direction direction : values()) {
            BY_SYMBOL[direction.symbol] = direction;
        }
    }

    private final char symbol;
    private final int rowDelta;
    private final int columnDelta;

    Direction(char symbol, int rowDelta, int columnDelta) {
        this.symbol = symbol;
        this.rowDelta = rowDelta;
        this.columnDelta = columnDelta;
    }

    /**
     * Single-character display symbol ({@code N}, {@code E}, {@code S}, {@code W}).
     */
    public char symbol() {
        return symbol;
    }

    public int rowDelta() {
        return rowDelta;
    }

    public int columnDelta() {
        return columnDelta;
    }

    /**
     * Returns the direction pointing back the way this one came.
     */
    public Direction opposite() {
        return switch (this) {
            case NORTH -> SOUTH;
            case EAST -> WEST;
            case SOUTH -> NORTH;
            case WEST -> EAST;
        };
    }

    /**
     * Resolves a display symbol back to its direction.
     *
     * @param symbol one of {@code N}, {@code E}, {@code S}, {@code W}.
     * @return matching direction.
     * @throws IllegalArgumentException when the symbol is not a direction.
     */
    public static Direction fromSymbol(char symbol) {
        Direction direction = symbol < BY_SYMBOL.length ? BY_SYMBOL[symbol] : null;
        if (direction == null) {
            throw new IllegalArgumentException("unknown direction symbol: '" + symbol + "'");
        }
        return direction;
    }
}

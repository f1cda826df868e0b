package org.mazerun.maze.grid;

import lombok.experimental.UtilityClass;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Loads {@link GridMaze} instances from a plain-text drawing.
 *
 * <p>Layout: cell {@code (r, c)} sits at character {@code (2r + 1, 2c + 1)}. Characters
 * between two cells are the shared wall ({@code #}) or passage ({@code ' '} or {@code '.'}).
 * Characters at even/even positions are wall corners and must be {@code #}. The outer
 * border must be fully walled. {@code S} marks the entry cell and {@code E} the exit.</p>
 *
 * <pre>
 * #####
 * #S  #
 * # # #
 * #  E#
 * #####
 * </pre>
 */
@UtilityClass
public final class MazeTextFormat {
    public static final String REASON_EMPTY = "MAZE_TEXT_EMPTY";
    public static final String REASON_RAGGED = "MAZE_TEXT_RAGGED";
    public static final String REASON_DIMENSIONS = "MAZE_TEXT_DIMENSIONS";
    public static final String REASON_MARKER = "MAZE_TEXT_MARKER";
    public static final String REASON_BORDER = "MAZE_TEXT_BORDER";
    public static final String REASON_CHARACTER = "MAZE_TEXT_CHARACTER";

    private static final char WALL = '#';
    private static final char ENTRY = 'S';
    private static final char EXIT = 'E';

    /**
     * Parses a whole drawing; line terminators may be any of {@code \n}, {@code \r\n}, {@code \r}.
     */
    public static GridMaze parse(String text) {
        Objects.requireNonNull(text, "text");
        return parse(Arrays.asList(text.split("\\R")));
    }

    /**
     * Reads and parses a UTF-8 drawing from disk.
     *
     * @throws UncheckedIOException when the file cannot be read.
     */
    public static GridMaze read(Path file) {
        Objects.requireNonNull(file, "file");
        try {
            return parse(Files.readAllLines(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read maze file " + file, e);
        }
    }

    /**
     * Parses a drawing given line by line. Trailing blank lines are ignored.
     */
    public static GridMaze parse(List<String> lines) {
        Objects.requireNonNull(lines, "lines");
        List<String> grid = trimTrailingBlankLines(lines);
        if (grid.isEmpty()) {
            throw new MazeFormatException(REASON_EMPTY, "maze text has no lines");
        }

        int height = grid.size();
        int width = grid.get(0).length();
        for (int y = 1; y < height; y++) {
            if (grid.get(y).length() != width) {
                throw new MazeFormatException(REASON_RAGGED,
                        "line " + (y + 1) + " has length " + grid.get(y).length() + ", expected " + width);
            }
        }
        if (height < 3 || width < 3 || height % 2 == 0 || width % 2 == 0) {
            throw new MazeFormatException(REASON_DIMENSIONS,
                    "maze text must be odd-sized and at least 3x3, got " + height + "x" + width);
        }

        checkBorder(grid, height, width);

        int rows = (height - 1) / 2;
        int columns = (width - 1) / 2;
        Cell entry = null;
        Cell exit = null;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                char ch = grid.get(2 * r + 1).charAt(2 * c + 1);
                if (ch == ENTRY) {
                    entry = requireUnique(entry, new Cell(r, c), "entry 'S'");
                } else if (ch == EXIT) {
                    exit = requireUnique(exit, new Cell(r, c), "exit 'E'");
                } else if (!isOpen(ch)) {
                    throw unexpected(ch, 2 * r + 1, 2 * c + 1);
                }
            }
        }
        if (entry == null || exit == null) {
            throw new MazeFormatException(REASON_MARKER, "maze text needs exactly one 'S' and one 'E'");
        }

        GridMaze maze = new GridMaze(rows, columns, entry, exit);
        for (int y = 1; y < height - 1; y++) {
            String line = grid.get(y);
            for (int x = 1; x < width - 1; x++) {
                boolean rowIsCell = y % 2 == 1;
                boolean columnIsCell = x % 2 == 1;
                if (rowIsCell == columnIsCell) {
                    if (!rowIsCell && line.charAt(x) != WALL) {
                        throw unexpected(line.charAt(x), y, x);
                    }
                    continue;
                }
                char ch = line.charAt(x);
                if (ch == WALL) {
                    continue;
                }
                if (!isOpen(ch)) {
                    throw unexpected(ch, y, x);
                }
                if (rowIsCell) {
                    maze.openPassage(new Cell((y - 1) / 2, (x - 2) / 2), Direction.EAST);
                } else {
                    maze.openPassage(new Cell((y - 2) / 2, (x - 1) / 2), Direction.SOUTH);
                }
            }
        }
        return maze;
    }

    private static void checkBorder(List<String> grid, int height, int width) {
        String top = grid.get(0);
        String bottom = grid.get(height - 1);
        for (int x = 0; x < width; x++) {
            if (top.charAt(x) != WALL || bottom.charAt(x) != WALL) {
                throw new MazeFormatException(REASON_BORDER, "outer border must be walled at column " + x);
            }
        }
        for (int y = 0; y < height; y++) {
            String line = grid.get(y);
            if (line.charAt(0) != WALL || line.charAt(width - 1) != WALL) {
                throw new MazeFormatException(REASON_BORDER, "outer border must be walled on line " + (y + 1));
            }
        }
    }

    private static Cell requireUnique(Cell existing, Cell found, String marker) {
        if (existing != null) {
            throw new MazeFormatException(REASON_MARKER, "duplicate " + marker + " at " + existing + " and " + found);
        }
        return found;
    }

    private static boolean isOpen(char ch) {
        return ch == ' ' || ch == '.';
    }

    private static MazeFormatException unexpected(char ch, int y, int x) {
        return new MazeFormatException(REASON_CHARACTER,
                "unexpected character '" + ch + "' at line " + (y + 1) + ", column " + (x + 1));
    }

    private static List<String> trimTrailingBlankLines(List<String> lines) {
        List<String> trimmed = new ArrayList<>(lines);
        while (!trimmed.isEmpty() && trimmed.get(trimmed.size() - 1).isBlank()) {
            trimmed.remove(trimmed.size() - 1);
        }
        return trimmed;
    }
}

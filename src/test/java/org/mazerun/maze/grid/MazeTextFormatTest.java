package org.mazerun.maze.grid;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("MazeTextFormat Tests")
class MazeTextFormatTest {

    private static final String SMALL = String.join("\n",
            "#####",
            "#S  #",
            "# # #",
            "#  E#",
            "#####"
    );

    @Test
    @DisplayName("Parses dimensions, markers and passages")
    void testParseSmallMaze() {
        GridMaze maze = MazeTextFormat.parse(SMALL);

        assertEquals(2, maze.rows());
        assertEquals(2, maze.columns());
        assertEquals(new Cell(0, 0), maze.entry());
        assertEquals(new Cell(1, 1), maze.exit());
        assertEquals(4, maze.openPassageCount());
        assertTrue(maze.isOpen(new Cell(0, 0), Direction.EAST));
        assertTrue(maze.isOpen(new Cell(0, 0), Direction.SOUTH));
        assertTrue(maze.isOpen(new Cell(0, 1), Direction.SOUTH));
        assertTrue(maze.isOpen(new Cell(1, 0), Direction.EAST));
    }

    @Test
    @DisplayName("Walls and dot passages are honored")
    void testWallsAndDots() {
        GridMaze maze = MazeTextFormat.parse(String.join("\r\n",
                "#####",
                "#S#.#",
                "#.###",
                "#. E#",
                "#####",
                "",
                ""
        ));
        assertFalse(maze.isOpen(new Cell(0, 0), Direction.EAST));
        assertFalse(maze.isOpen(new Cell(0, 1), Direction.SOUTH));
        assertTrue(maze.isOpen(new Cell(0, 0), Direction.SOUTH));
        assertTrue(maze.isOpen(new Cell(1, 0), Direction.EAST));
        assertEquals(2, maze.openPassageCount());
    }

    @Test
    @DisplayName("Reads maze files as UTF-8")
    void testReadFromClasspathResource() throws URISyntaxException {
        Path file = Path.of(MazeTextFormatTest.class.getResource("/mazes/corridor.txt").toURI());
        GridMaze maze = MazeTextFormat.read(file);
        assertEquals(2, maze.rows());
        assertEquals(5, maze.columns());
        assertEquals(new Cell(1, 0), maze.exit());
        assertEquals(9, maze.openPassageCount());
    }

    @Test
    @DisplayName("Missing files surface as UncheckedIOException")
    void testMissingFile(@TempDir Path dir) {
        assertThrows(UncheckedIOException.class, () -> MazeTextFormat.read(dir.resolve("absent.txt")));
    }

    @Test
    @DisplayName("Files written on disk round through read")
    void testReadWrittenFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("small.txt");
        Files.writeString(file, SMALL, StandardCharsets.UTF_8);
        assertEquals(new Cell(1, 1), MazeTextFormat.read(file).exit());
    }

    @Test
    @DisplayName("Validation: empty input")
    void testEmpty() {
        assertReason(MazeTextFormat.REASON_EMPTY, "");
        MazeFormatException ex = assertThrows(MazeFormatException.class, () -> MazeTextFormat.parse(List.of()));
        assertEquals(MazeTextFormat.REASON_EMPTY, ex.getReasonCode());
    }

    @Test
    @DisplayName("Validation: ragged lines")
    void testRagged() {
        assertReason(MazeTextFormat.REASON_RAGGED, "#####\n#S E#\n####");
    }

    @Test
    @DisplayName("Validation: even or tiny dimensions")
    void testDimensions() {
        assertReason(MazeTextFormat.REASON_DIMENSIONS, "####\n#SE#\n####");
        assertReason(MazeTextFormat.REASON_DIMENSIONS, "##\n##");
    }

    @Test
    @DisplayName("Validation: open outer border")
    void testBorder() {
        assertReason(MazeTextFormat.REASON_BORDER, "## ##\n#S  #\n# # #\n#  E#\n#####");
        assertReason(MazeTextFormat.REASON_BORDER, "#####\n S  #\n# # #\n#  E#\n#####");
    }

    @Test
    @DisplayName("Validation: entry and exit markers")
    void testMarkers() {
        assertReason(MazeTextFormat.REASON_MARKER, "#####\n#S  #\n# # #\n#   #\n#####");
        assertReason(MazeTextFormat.REASON_MARKER, "#####\n#S  #\n# # #\n#S E#\n#####");
        assertReason(MazeTextFormat.REASON_MARKER, "#####\n#E  #\n# # #\n#S E#\n#####");
    }

    @Test
    @DisplayName("Validation: unexpected characters")
    void testCharacters() {
        assertReason(MazeTextFormat.REASON_CHARACTER, "#####\n#S x#\n# # #\n#  E#\n#####");
        assertReason(MazeTextFormat.REASON_CHARACTER, "#####\n#S  #\n#   #\n#  E#\n#####");
        assertReason(MazeTextFormat.REASON_CHARACTER, "#####\n#S  #\n# # #\n#  ##\n#####");
    }

    private static void assertReason(String reasonCode, String text) {
        MazeFormatException ex = assertThrows(MazeFormatException.class, () -> MazeTextFormat.parse(text));
        assertEquals(reasonCode, ex.getReasonCode());
        assertTrue(ex.getMessage().startsWith("[" + reasonCode + "]"));
    }
}

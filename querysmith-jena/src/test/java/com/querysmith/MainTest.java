package com.querysmith;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the command-line entry point.
 */
public class MainTest {

    private static final String CYCLE =
        "SELECT * WHERE { ?a <http://example.org/p> ?b . ?b <http://example.org/p> ?c . "
            + "?c <http://example.org/p> ?a }";

    private static final String CYCLE_RENAMED =
        "SELECT * WHERE { ?y <http://example.org/p> ?z . ?x <http://example.org/p> ?y . "
            + "?z <http://example.org/p> ?x }";

    private static final String PATH =
        "SELECT * WHERE { ?a <http://example.org/p> ?b . ?b <http://example.org/p> ?c . "
            + "?c <http://example.org/p> ?d }";

    @TempDir
    Path tempDir;

    private String write(final String name, final String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file.toString();
    }

    @Test
    @DisplayName("Test isomorphic files exit with 0")
    public void testIsomorphic() throws IOException {
        String left = write("left.rq", CYCLE);
        String right = write("right.rq", CYCLE_RENAMED);

        assertEquals(Main.EXIT_ISOMORPHIC, Main.run(new String[] {left, right}, null));
    }

    @Test
    @DisplayName("Test non-isomorphic files exit with 1")
    public void testNotIsomorphic() throws IOException {
        String left = write("left.rq", CYCLE);
        String right = write("right.rq", PATH);

        assertEquals(Main.EXIT_NOT_ISOMORPHIC, Main.run(new String[] {left, right}, ""));
    }

    @Test
    @DisplayName("Test exhausted budget exits with 2")
    public void testIndeterminate() throws IOException {
        String left = write("left.rq", CYCLE);
        String right = write("right.rq", CYCLE_RENAMED);

        assertEquals(Main.EXIT_INDETERMINATE, Main.run(new String[] {left, right}, "1"));
    }

    @Test
    @DisplayName("Test a generous budget still reaches a verdict")
    public void testBudgetSufficient() throws IOException {
        String left = write("left.rq", CYCLE);
        String right = write("right.rq", CYCLE_RENAMED);

        assertEquals(Main.EXIT_ISOMORPHIC, Main.run(new String[] {left, right}, " 10000 "));
    }

    @Test
    @DisplayName("Test invalid budget values exit with 3")
    public void testInvalidBudget() throws IOException {
        String left = write("left.rq", CYCLE);
        String right = write("right.rq", CYCLE_RENAMED);

        assertEquals(Main.EXIT_ERROR, Main.run(new String[] {left, right}, "lots"));
        assertEquals(Main.EXIT_ERROR, Main.run(new String[] {left, right}, "-5"));
    }

    @Test
    @DisplayName("Test usage, missing file and parse errors exit with 3")
    public void testErrors() throws IOException {
        String left = write("left.rq", CYCLE);
        String broken = write("broken.rq", "SELECT * WHERE { ?s ?p ");
        String missing = tempDir.resolve("missing.rq").toString();

        assertEquals(Main.EXIT_ERROR, Main.run(new String[] {left}, null));
        assertEquals(Main.EXIT_ERROR, Main.run(new String[] {left, missing}, null));
        assertEquals(Main.EXIT_ERROR, Main.run(new String[] {left, broken}, null));
    }
}

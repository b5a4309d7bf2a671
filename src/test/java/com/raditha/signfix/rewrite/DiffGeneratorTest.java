package com.raditha.signfix.rewrite;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DiffGenerator - unified diff of a single rewritten line.
 */
class DiffGeneratorTest {

    private DiffGenerator diffGenerator;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        diffGenerator = new DiffGenerator();
    }

    @Test
    void testUnifiedDiffGeneration() throws IOException {
        String originalCode = """
                int f(int a, unsigned int b)
                {
                    return a + b;
                }
                """;
        Path originalFile = tempDir.resolve("f.c");
        Files.writeString(originalFile, originalCode);

        String diff = diffGenerator.generateUnifiedDiff(originalFile, 3, "    return a + (int)b;");

        assertTrue(diff.contains("--- a/f.c"), "Should have original file marker");
        assertTrue(diff.contains("+++ b/f.c"), "Should have modified file marker");
        assertTrue(diff.contains("-    return a + b;"));
        assertTrue(diff.contains("+    return a + (int)b;"));
    }

    @Test
    void testUnchangedLineGivesEmptyDiff() {
        List<String> lines = List.of("a;", "b;");

        assertEquals("", diffGenerator.generateUnifiedDiff("x.c", lines, 2, "b;"));
    }

    @Test
    void testContextLines() {
        List<String> lines = List.of("l1", "l2", "l3", "l4", "l5", "l6", "l7");

        String diff = new DiffGenerator(1).generateUnifiedDiff("x.c", lines, 4, "L4");

        assertTrue(diff.contains(" l3"));
        assertTrue(diff.contains(" l5"));
        assertFalse(diff.contains("l2"));
        assertFalse(diff.contains("l6"));
    }

    @Test
    void testLineOutOfRange() {
        assertThrows(IllegalArgumentException.class,
                () -> diffGenerator.generateUnifiedDiff("x.c", List.of("a"), 3, "b"));
    }

    @Test
    void testFirstDifference() {
        assertEquals(0, DiffGenerator.firstDifference("x = a + b;", "x = a + b;"));
        assertEquals(9, DiffGenerator.firstDifference("x = a + b;", "x = a + (int)b;"));
        assertEquals(4, DiffGenerator.firstDifference("abc", "abcd"));
    }
}

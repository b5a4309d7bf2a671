package com.raditha.signfix.preprocess;

import com.raditha.signfix.alias.MacroTable;
import com.raditha.signfix.frontend.ParseFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MacroExpandingPreprocessorTest {

    private MacroExpandingPreprocessor preprocessor;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        preprocessor = new MacroExpandingPreprocessor();
    }

    private String expand(String line, String... defines) {
        List<String> lines = List.of(defines);
        return preprocessor.expandLine(line, lines.size() + 1, MacroTable.parse("t.c", lines));
    }

    @Test
    void testObjectLikeMacros() {
        assertEquals("y = 10 + x;", expand("y = LIMIT + x;", "#define LIMIT 10"));
        assertEquals("y = (10 * 2);", expand("y = TWICE;", "#define LIMIT 10", "#define TWICE (LIMIT * 2)"));
    }

    @Test
    void testFunctionLikeMacros() {
        assertEquals("r = ((a + 1) * (a + 1));", expand("r = SQUARE(a + 1);", "#define SQUARE(v) ((v) * (v))"));
        assertEquals("r = MAX;", expand("r = MAX;", "#define MAX(a, b) ((a) > (b) ? (a) : (b))"));
    }

    @Test
    void testStringizeAndPaste() {
        assertEquals("s = \"abc\";", expand("s = STR(abc);", "#define STR(x) #x"));
        assertEquals("v = var1;", expand("v = CAT(var, 1);", "#define CAT(a, b) a ## b"));
    }

    @Test
    void testVariadic() {
        assertEquals("printf(\"%d %d\", 1, 2);",
                expand("LOG(\"%d %d\", 1, 2);", "#define LOG(fmt, ...) printf(fmt, __VA_ARGS__)"));
    }

    @Test
    void testSelfReferenceIsNotReexpanded() {
        assertEquals("x = A;", expand("x = A;", "#define A A"));
        assertEquals("x = (B + 1);", expand("x = B;", "#define B (B + 1)"));
    }

    @Test
    void testMacroIsVisibleOnlyAfterItsDefinition() {
        List<String> lines = List.of("int a = N;", "#define N 3", "int b = N;");
        PreprocessedSource out = preprocessor.preprocess("t.c", lines, MacroTable.parse("t.c", lines));

        assertEquals("int a = N;", out.line(2));
        assertEquals("", out.line(3));
        assertEquals("int b = 3;", out.line(4));
    }

    @Test
    void testDirectivesAreBlankedAndLinesPreserved() throws ParseFailureException, IOException {
        Path file = tempDir.resolve("p.c");
        Files.writeString(file, "#define M(a) \\\n    ((a) + 1)\nint x = M(2);\n");

        PreprocessedSource out = preprocessor.preprocess(file);

        assertTrue(LineMapper.isMarker(out.line(1)));
        assertEquals("", out.line(2));
        assertEquals("", out.line(3));
        assertEquals("int x = ((2) + 1);", out.line(4));
        assertEquals(3, out.lineMap().toOriginal(4).line());
    }
}

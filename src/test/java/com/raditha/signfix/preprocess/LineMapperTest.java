package com.raditha.signfix.preprocess;

import com.raditha.signfix.model.SourcePosition;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LineMapperTest {

    @TempDir
    Path tempDir;

    @Test
    void testMarkersAndInterpolation() {
        String text = String.join("\n",
                "int before;",
                "# 1 \"main.c\"",
                "int a;",
                "int b;",
                "# 7 \"inc.h\" 1",
                "int c;",
                "#line 20 \"main.c\"",
                "int d;") + "\n";

        LineMap map = LineMapper.build("main.i", text);

        assertEquals(8, map.size());
        assertEquals(new SourcePosition("main.i", 1, 0), map.toOriginal(1));
        assertEquals(new SourcePosition("main.c", 1, 0), map.toOriginal(2));
        assertEquals(new SourcePosition("main.c", 1, 0), map.toOriginal(3));
        assertEquals(new SourcePosition("main.c", 2, 0), map.toOriginal(4));
        assertEquals(new SourcePosition("inc.h", 7, 0), map.toOriginal(6));
        assertEquals(new SourcePosition("main.c", 20, 0), map.toOriginal(8));
    }

    @Test
    void testReverseQuery() {
        String text = "# 1 \"main.c\"\nint a;\n# 2 \"main.c\"\nint again;\n";

        LineMap map = LineMapper.build("main.i", text);

        assertEquals(List.of(3, 4), map.toPreprocessed("main.c", 2));
        assertTrue(map.belongsTo(2, "main.c"));
        assertFalse(map.belongsTo(2, "other.c"));
    }

    @Test
    void testUnreadableFileGivesEmptyMapWithIdentityFallback() {
        LineMap map = LineMapper.read(tempDir.resolve("missing.i"));

        assertTrue(map.isEmpty());
        assertEquals(List.of(12), map.toPreprocessed("anything.c", 12));
        assertEquals(12, map.toOriginal(12).line());
    }

    @Test
    void testIsMarker() {
        assertTrue(LineMapper.isMarker("# 1 \"a.c\""));
        assertTrue(LineMapper.isMarker("#line 4 \"a.c\""));
        assertFalse(LineMapper.isMarker("#define X 1"));
        assertFalse(LineMapper.isMarker("int x;"));
    }

    @Property
    void linesAfterAMarkerAreConsecutive(@ForAll @IntRange(min = 1, max = 5000) int start,
                                         @ForAll @IntRange(min = 0, max = 40) int offset) {
        StringBuilder text = new StringBuilder("# ").append(start).append(" \"f.c\"\n");
        for (int i = 0; i <= offset; i++) {
            text.append("x;\n");
        }

        LineMap map = LineMapper.build("f.i", text.toString());

        SourcePosition mapped = map.toOriginal(2 + offset);
        assertEquals("f.c", mapped.file());
        assertEquals(start + offset, mapped.line());
    }

    @Test
    void testFilesMatchByPathNotByBaseName() {
        assertTrue(LineMap.sameFile("src/./a.c", "src/a.c"));
        assertTrue(LineMap.sameFile("src/a.c", "src/a.c"));
        assertFalse(LineMap.sameFile("other/a.c", "src/a.c"));
        assertFalse(LineMap.sameFile(null, "src/a.c"));
    }
}

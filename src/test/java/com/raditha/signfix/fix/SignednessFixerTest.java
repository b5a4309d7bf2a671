package com.raditha.signfix.fix;

import com.raditha.signfix.TestFixtures;
import com.raditha.signfix.model.FixRequest;
import com.raditha.signfix.model.FixResult;
import com.raditha.signfix.resolve.CastRecord;
import com.raditha.signfix.session.Session;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end fixes on the example C file.
 */
class SignednessFixerTest {

    private static Session session;
    private final SignednessFixer fixer = new SignednessFixer(false);

    @TempDir
    Path tempDir;

    @BeforeAll
    static void openSession() throws Exception {
        session = TestFixtures.openExample();
    }

    private FixResult fix(int line, String operator, int occurrence) {
        return fixer.fix(session, new FixRequest("R" + line, line, operator, occurrence));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "24|+|1|'    x = a + (int)b + c;'",
            "24|+|2|'    x = a + (int)b + c;'",
            "27|<|1|'    if (a < (int)b) {'",
            "28|+|1|'        x = total(a + (int)b, c + 1);'",
            "30|>|1|'    while (n > (unsigned int)a) n--;'",
            "31|<|1|'    for (x = 0; x < (int)b; x++) {'",
            "35|-|1|'    return a - (int)b;'",
            "40|+|1|'    return n * 2 + (int)m;'"
    })
    void testCastIsInserted(int line, String operator, int occurrence, String expected) {
        FixResult result = fix(line, operator, occurrence);

        assertTrue(result.success(), result.message());
        assertEquals(expected, result.rewrittenLine());
        assertTrue(result.changed());
    }

    @Test
    void testObjectLikeMacroIsKeptAndCast() {
        FixResult result = fix(25, "+", 1);

        assertEquals("    x = (unsigned int)LIMIT + b;", result.rewrittenLine());
        CastRecord cast = result.casts().get(0);
        assertTrue(cast.literal());
        assertEquals(CastRecord.Side.LEFT, cast.side());
        assertEquals("10U", cast.replacement());
    }

    @Test
    void testExplicitCastOfChangedSubtreeIsDropped() {
        FixResult result = fix(26, "+", 1);

        assertTrue(result.success(), result.message());
        assertEquals("    s = (unsigned int)EFGHIJK + b;", result.rewrittenLine());
    }

    @Test
    void testFunctionLikeMacroIsRestored() {
        FixResult result = fix(34, "+", 1);

        assertEquals("    x = SQUARE(a) + (int)b;", result.rewrittenLine());
    }

    @Test
    void testNoConflictLeavesLineByteIdentical() {
        FixResult result = fix(28, "+", 2);

        assertTrue(result.success());
        assertFalse(result.changed());
        assertEquals("        x = total(a + b, c + 1);", result.rewrittenLine());
        assertTrue(result.casts().isEmpty());
        assertEquals("No cast needed", result.message());
    }

    @Test
    void testUnknownOccurrenceFails() {
        FixResult result = fix(24, "*", 1);

        assertFalse(result.success());
        assertNull(result.rewrittenLine());
        assertEquals("    x = a + b + c;", result.originalLine());
    }

    @Test
    void testTypeNameMismatchPolicy() throws Exception {
        Session typedefs = TestFixtures.openSource(tempDir, "names.c", """
                typedef unsigned int u32;

                unsigned long widen(u32 a, unsigned long b)
                {
                    return a + b;
                }
                """);
        FixRequest request = new FixRequest("names", 5, "+", 1);

        FixResult lenient = new SignednessFixer(false).fix(typedefs, request);
        FixResult strict = new SignednessFixer(true).fix(typedefs, request);

        assertFalse(lenient.changed());
        assertEquals("    return a + (unsigned int)b;", strict.rewrittenLine());
    }

    @Test
    void testMacroAfterEqualLiteralIsRestoredInPlace() throws Exception {
        Session limits = TestFixtures.openSource(tempDir, "limits.c", """
                #define LIMIT 10

                int check(int a, unsigned int b)
                {
                    if (10 + LIMIT < b) {
                        return a;
                    }
                    return 0;
                }
                """);

        FixResult result = fixer.fix(limits, new FixRequest("limits", 5, "<", 1));

        assertTrue(result.success(), result.message());
        assertEquals("    if (10 + LIMIT < (int)b) {", result.rewrittenLine());
    }
}

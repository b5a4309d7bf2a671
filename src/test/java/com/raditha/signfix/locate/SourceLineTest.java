package com.raditha.signfix.locate;

import com.raditha.signfix.alias.MacroTable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceLineTest {

    private static final MacroTable MACROS = MacroTable.parse("t.c", List.of(
            "#define LIMIT 10",
            "#define ADD(a, b) ((a) + (b))"));

    @Test
    void testOccurrencesAreOperatorTokens() {
        SourceLine line = SourceLine.of("x = a + b + c; i++; j += 2;", MACROS);

        List<Integer> plus = line.occurrences("+");
        assertEquals(2, plus.size());
        assertEquals(6, line.tokens().get(plus.get(0)).start());
        assertEquals(10, line.tokens().get(plus.get(1)).start());
        assertEquals(1, line.occurrences("+=").size());
    }

    @Test
    void testOccurrencesSkipStringsCommentsAndMacroArguments() {
        SourceLine line = SourceLine.of("y = ADD(a + 1, b) + s[\"+\"] /* + */;", MACROS);

        List<Integer> plus = line.occurrences("+");
        assertEquals(1, plus.size());
        assertEquals(18, line.tokens().get(plus.get(0)).start());
    }

    @Test
    void testInvocations() {
        SourceLine line = SourceLine.of("z = LIMIT + ADD(x, 2);", MACROS);

        List<MacroInvocation> invocations = line.invocations();
        assertEquals(2, invocations.size());

        MacroInvocation limit = invocations.get(0);
        assertEquals("LIMIT", limit.sourceText());
        assertFalse(limit.functionLike());
        assertEquals(List.of("10"), limit.expansion());

        MacroInvocation add = invocations.get(1);
        assertEquals("ADD(x, 2)", add.sourceText());
        assertTrue(add.functionLike());
        assertEquals(12, add.start());
        assertEquals(21, add.end());
        assertTrue(add.within(4, 21));
        assertFalse(add.within(13, 21));
    }

    @Test
    void testFunctionLikeNameWithoutArgumentsIsStillAnInvocation() {
        SourceLine line = SourceLine.of("p = ADD;", MACROS);

        assertEquals(1, line.invocations().size());
        assertEquals("ADD", line.invocations().get(0).sourceText());
    }
}

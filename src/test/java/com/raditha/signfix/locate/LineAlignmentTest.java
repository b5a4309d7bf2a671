package com.raditha.signfix.locate;

import com.raditha.signfix.alias.MacroTable;
import com.raditha.signfix.lexer.CLexer;
import com.raditha.signfix.lexer.LexToken;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LineAlignmentTest {

    private static final MacroTable MACROS = MacroTable.parse("t.c", List.of(
            "#define LIMIT 10",
            "#define EMPTY",
            "#define SQUARE(v) ((v) * (v))"));

    private static LineAlignment align(String source, String expanded) {
        List<LexToken> tokens = CLexer.tokenize(expanded);
        Optional<LineAlignment> alignment = LineAlignment.align(SourceLine.of(source, MACROS), tokens);
        assertTrue(alignment.isPresent(), "expected an alignment of '" + source + "'");
        return alignment.get();
    }

    @Test
    void testIdentityAlignment() {
        LineAlignment a = align("x = a + b;", "x = a + b;");

        int plus = a.expandedIndexAt(7);
        assertEquals(3, plus);
        assertEquals(3, a.sourceToken(plus));
        assertEquals(-1, a.invocation(plus));
        assertEquals(6, a.sourceStart(plus));
        assertEquals(7, a.sourceEnd(plus));
    }

    @Test
    void testObjectLikeMacroIsAWildcard() {
        LineAlignment a = align("y = LIMIT + x;", "y = 10 + x;");

        int literal = a.expandedIndexAt(5);
        assertEquals(-1, a.sourceToken(literal));
        assertEquals(0, a.invocation(literal));
        assertEquals(4, a.sourceStart(literal));
        assertEquals(9, a.sourceEnd(literal));

        int plus = a.expandedIndexAt(8);
        assertEquals("+", a.source().tokens().get(a.sourceToken(plus)).text());
        assertEquals(10, a.source().tokens().get(a.sourceToken(plus)).start());
    }

    @Test
    void testFunctionLikeExpansionIsRecorded() {
        LineAlignment a = align("r = SQUARE(n) + 1;", "r = ((n) * (n)) + 1;");

        MacroInvocation square = a.source().invocations().get(0);
        assertEquals(List.of("(", "(", "n", ")", "*", "(", "n", ")", ")"), square.expansion());
        int star = a.expandedIndexAt(10);
        assertEquals(-1, a.sourceToken(star));
        int plus = a.expandedIndexAt(17);
        assertEquals(6, a.sourceToken(plus));
    }

    @Test
    void testMacroExpandingToNothing() {
        LineAlignment a = align("EMPTY x = a - b;", " x = a - b;");

        assertTrue(a.source().invocations().get(0).expansion().isEmpty());
        int minus = a.expandedIndexAt(8);
        assertEquals("-", a.source().tokens().get(a.sourceToken(minus)).text());
    }

    @Test
    void testMismatchedLinesDoNotAlign() {
        Optional<LineAlignment> alignment = LineAlignment.align(SourceLine.of("x = a + b;", MACROS),
                CLexer.tokenize("x = a - b;"));

        assertTrue(alignment.isEmpty());
    }
}

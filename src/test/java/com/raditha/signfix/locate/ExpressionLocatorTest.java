package com.raditha.signfix.locate;

import com.raditha.signfix.TestFixtures;
import com.raditha.signfix.frontend.Cursor;
import com.raditha.signfix.model.FixRequest;
import com.raditha.signfix.session.Session;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionLocatorTest {

    private static Session session;
    private final ExpressionLocator locator = new ExpressionLocator();

    @BeforeAll
    static void openSession() throws Exception {
        session = TestFixtures.openExample();
    }

    private LocatedExpression locate(int line, String operator, int occurrence) throws LocateException {
        return locator.locate(session, new FixRequest("t", line, operator, occurrence));
    }

    @Test
    void testOccurrencesAreCountedLeftToRight() throws LocateException {
        LocatedExpression first = locate(24, "+", 1);
        LocatedExpression second = locate(24, "+", 2);

        assertEquals("a + b", first.target().text());
        assertEquals("a + b", first.spanText());
        assertEquals("a + b + c", second.target().text());
        assertEquals("a + b + c", second.spanText());
        assertEquals(2, first.candidates().size());
    }

    @Test
    void testTopLevelStopsAtCallArguments() throws LocateException {
        LocatedExpression first = locate(28, "+", 1);
        LocatedExpression second = locate(28, "+", 2);

        assertEquals("a + b", first.target().text());
        assertSame(first.target(), first.topLevel());
        assertEquals("c + 1", second.target().text());
        assertSame(second.target(), second.topLevel());
    }

    @Test
    void testTopLevelClimbsToAssignment() throws LocateException {
        LocatedExpression located = locate(24, "+", 1);

        assertNotSame(located.target(), located.topLevel());
        assertEquals("x = a + b + c", located.topLevel().text());
    }

    @Test
    void testMacroInvocationInsideSpan() throws LocateException {
        LocatedExpression located = locate(25, "+", 1);

        assertEquals("LIMIT + b", located.spanText());
        assertEquals(1, located.macros().size());
        MacroInvocation limit = located.macros().get(0);
        assertEquals("LIMIT", limit.name());
        assertEquals(List.of("10"), limit.expansion());
    }

    @Test
    void testOperatorsProducedByMacrosAreNotCandidates() {
        assertTrue(locator.candidates(session, 34, "*").isEmpty());
        assertThrows(LocateException.class, () -> locate(34, "*", 1));

        List<Candidate> plus = locator.candidates(session, 34, "+");
        assertEquals(1, plus.size());
        Cursor node = plus.get(0).node();
        assertEquals("((a) * (a)) + b", node.text());
    }

    @Test
    void testSourceColumnsAreReported() {
        List<Candidate> candidates = locator.candidates(session, 24, "+");

        assertEquals(List.of(11, 15), candidates.stream().map(Candidate::sourceColumn).toList());
        assertEquals(List.of(1, 2), candidates.stream().map(Candidate::occurrenceIndex).toList());
    }

    @Test
    void testMissingOccurrence() {
        LocateException ex = assertThrows(LocateException.class, () -> locate(24, "+", 3));
        assertTrue(ex.getMessage().contains("occurrence 3"));
    }

    @Test
    void testLineOutsideFile() {
        assertThrows(LocateException.class, () -> locate(500, "+", 1));
        assertTrue(locator.candidates(session, 500, "+").isEmpty());
    }
}

package com.raditha.signfix.scan;

import com.raditha.signfix.TestFixtures;
import com.raditha.signfix.fix.SignednessFixer;
import com.raditha.signfix.model.Finding;
import com.raditha.signfix.model.FixResult;
import com.raditha.signfix.session.Session;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SignednessScannerTest {

    private static Session session;
    private static List<Finding> findings;

    @TempDir
    Path tempDir;

    @BeforeAll
    static void scanExample() throws Exception {
        session = TestFixtures.openExample();
        findings = new SignednessScanner().scan(session);
    }

    private static Optional<Finding> find(int line, String operator, int occurrence) {
        return findings.stream()
                .filter(f -> f.line() == line && f.operator().equals(operator) && f.occurrenceIndex() == occurrence)
                .findFirst();
    }

    @Test
    void testComparisonIsReported() {
        Finding f = find(27, "<", 1).orElseThrow();

        assertEquals("compute", f.function());
        assertEquals("a", f.leftText());
        assertEquals("int", f.leftType());
        assertEquals("b", f.rightText());
        assertEquals("unsigned int", f.rightType());
    }

    @Test
    void testTypedefOperandIsResolved() {
        Finding f = find(30, ">", 1).orElseThrow();

        assertEquals("unsigned int", f.leftType());
        assertEquals("int", f.rightType());
    }

    @Test
    void testBothOccurrencesOfChainedAdditionAreReported() {
        assertTrue(find(24, "+", 1).isPresent());
        assertTrue(find(24, "+", 2).isPresent());
    }

    @Test
    void testExplicitCastRemovesConflict() {
        assertTrue(find(26, "+", 1).isEmpty());
        assertTrue(find(28, "+", 2).isEmpty());
    }

    @Test
    void testMacroOperatorsAreNotReported() {
        assertTrue(findings.stream().noneMatch(f -> f.line() == 34 && f.operator().equals("*")));
        assertTrue(find(34, "+", 1).isPresent());
    }

    @Test
    void testFunctionOfSecondDefinition() {
        assertEquals("total", find(40, "+", 1).orElseThrow().function());
    }

    @Test
    void testEveryFindingCanBeFixed() {
        SignednessFixer fixer = new SignednessFixer(false);
        for (Finding f : findings) {
            FixResult result = fixer.fix(session, f.toRequest("scan"));
            assertTrue(result.success(), () -> f + ": " + result.message());
        }
    }

    @Test
    void testCleanFileHasNoFindings() throws Exception {
        Session clean = TestFixtures.openSource(tempDir, "clean.c", """
                int add(int a, int b)
                {
                    return a + b;
                }
                """);

        assertTrue(new SignednessScanner().scan(clean).isEmpty());
    }

    @Test
    void testOperandTypeFollowsTheWrittenCast() throws Exception {
        Session casts = TestFixtures.openSource(tempDir, "casts.c", """
                int mix(int a, unsigned int b)
                {
                    int x;
                    x = a + (int)b;
                    x = ((int)b) - a;
                    x = a + (unsigned int)a;
                    return x;
                }
                """);

        List<Finding> found = new SignednessScanner().scan(casts);

        assertEquals(1, found.size(), found::toString);
        assertEquals(6, found.get(0).line());
        assertEquals("unsigned int", found.get(0).rightType());
    }
}

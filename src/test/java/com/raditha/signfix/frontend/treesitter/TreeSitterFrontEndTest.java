package com.raditha.signfix.frontend.treesitter;

import com.raditha.signfix.frontend.Cursor;
import com.raditha.signfix.frontend.CursorKind;
import com.raditha.signfix.frontend.Cursors;
import com.raditha.signfix.frontend.ParseFailureException;
import com.raditha.signfix.frontend.TranslationUnit;
import com.raditha.signfix.preprocess.PreprocessedSource;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TreeSitterFrontEndTest {

    private static final String SOURCE = """
            # 1 "typed.c"
            typedef unsigned int uint32;
            typedef uint32 count_t;
            struct point { int x; unsigned short y; };

            long f(count_t n, int k, struct point *p, char c)
            {
                long r = n + k;
                r = k < n;
                r = p->y * c;
                r = sizeof(k) - k;
                return r;
            }
            """;

    private static TranslationUnit unit;

    @BeforeAll
    static void parse() throws ParseFailureException {
        unit = new TreeSitterFrontEnd().parse(PreprocessedSource.of("typed.c", SOURCE));
    }

    private static Cursor binary(String text) {
        List<Cursor> found = Cursors.descendants(unit.root(),
                c -> c.kind() == CursorKind.BINARY_OPERATOR && c.text().equals(text));
        assertEquals(1, found.size(), text);
        return found.get(0);
    }

    @Test
    void testFunctionsAreTopLevel() {
        assertEquals(1, unit.functions().size());
        Cursor f = unit.functions().get(0);
        assertEquals("f", f.spelling());
        assertTrue(unit.enclosingTopLevel(8).isPresent());
    }

    @Test
    void testDeclaredTypeKeepsTypedefName() {
        Cursor sum = binary("n + k");
        Cursor n = sum.children().get(0);

        assertEquals("count_t", n.typeSpelling());
        assertEquals("unsigned int", n.canonicalTypeSpelling());
        assertEquals("unsigned int", sum.typeSpelling());
    }

    @Test
    void testComparisonIsInt() {
        assertEquals("int", binary("k < n").typeSpelling());
    }

    @Test
    void testMemberAndPromotion() {
        Cursor product = binary("p->y * c");

        assertEquals("unsigned short", product.children().get(0).typeSpelling());
        assertEquals("int", product.typeSpelling());
    }

    @Test
    void testSizeofIsUnsignedLong() {
        Cursor diff = binary("sizeof(k) - k");

        assertEquals("unsigned long", diff.children().get(0).typeSpelling());
        assertEquals("unsigned long", diff.typeSpelling());
    }

    @Test
    void testMarkerLinesAreBlanked() {
        String blanked = TreeSitterFrontEnd.blankMarkers("# 1 \"a.c\"\nint x;\n");

        assertEquals(" ".repeat(9) + "\nint x;\n", blanked);
    }

    @Test
    void testOperatorToken() {
        Cursor sum = binary("n + k");

        assertEquals("+", Cursors.operatorSpelling(sum));
        assertEquals(8, Cursors.operatorToken(sum).orElseThrow().line());
    }
}

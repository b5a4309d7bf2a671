package com.raditha.signfix.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CLexerTest {

    private static List<String> spellings(String text) {
        return CLexer.tokenize(text).stream().map(LexToken::text).toList();
    }

    @Test
    void testLongestPunctuatorFirst() {
        assertEquals(List.of("a", "<<=", "b", "+", "+", "c"), spellings("a <<= b + +c"));
        assertEquals(List.of("i", "++", "+", "j"), spellings("i+++j"));
    }

    @Test
    void testCommentsAndStringsAreSkippedOrSingleTokens() {
        List<LexToken> tokens = CLexer.tokenize("x = \"a + b\" /* + */ + 'c'; // + tail");
        assertEquals(List.of("x", "=", "\"a + b\"", "+", "'c'", ";"), tokens.stream().map(LexToken::text).toList());
        assertEquals(LexTokenKind.STRING, tokens.get(2).kind());
        assertEquals(LexTokenKind.CHAR, tokens.get(4).kind());
    }

    @Test
    void testOffsetsAndColumns() {
        List<LexToken> tokens = CLexer.tokenize("  y = 10U;");
        LexToken literal = tokens.get(2);
        assertEquals(LexTokenKind.NUMBER, literal.kind());
        assertEquals("10U", literal.text());
        assertEquals(6, literal.start());
        assertEquals(9, literal.end());
        assertEquals(7, literal.column());
    }

    @Test
    void testNullAndEmpty() {
        assertTrue(CLexer.tokenize(null).isEmpty());
        assertTrue(CLexer.tokenize("   ").isEmpty());
    }
}

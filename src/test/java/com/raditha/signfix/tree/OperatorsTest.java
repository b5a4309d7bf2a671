package com.raditha.signfix.tree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OperatorsTest {

    @Test
    void testPrecedenceOrder() {
        assertTrue(Operators.precedence("=") < Operators.precedence("||"));
        assertTrue(Operators.precedence("||") < Operators.precedence("&&"));
        assertTrue(Operators.precedence("&&") < Operators.precedence("|"));
        assertTrue(Operators.precedence("|") < Operators.precedence("^"));
        assertTrue(Operators.precedence("^") < Operators.precedence("&"));
        assertTrue(Operators.precedence("&") < Operators.precedence("=="));
        assertTrue(Operators.precedence("==") < Operators.precedence("<="));
        assertTrue(Operators.precedence("<=") < Operators.precedence("<<"));
        assertTrue(Operators.precedence("<<") < Operators.precedence("-"));
        assertTrue(Operators.precedence("-") < Operators.precedence("%"));
        assertEquals(Operators.ASSIGNMENT, Operators.precedence("<<="));
        assertEquals(Operators.COMMA, Operators.precedence(","));
    }

    @Test
    void testNeedsParentheses() {
        int additive = Operators.precedence("+");
        assertTrue(Operators.needsParentheses(additive, "*", false));
        assertFalse(Operators.needsParentheses(additive, "+", false));
        assertTrue(Operators.needsParentheses(additive, "-", true));
        assertFalse(Operators.needsParentheses(Operators.precedence("*"), "+", true));
        assertFalse(Operators.needsParentheses(Operators.UNARY, "*", true));
        assertFalse(Operators.needsParentheses(Operators.ASSIGNMENT, "=", true));
        assertTrue(Operators.needsParentheses(Operators.ASSIGNMENT, "=", false));
    }
}

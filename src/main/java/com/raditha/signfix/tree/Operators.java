package com.raditha.signfix.tree;

import java.util.Map;

/**
 * C operator precedence and associativity, higher binds tighter.
 */
public final class Operators {

    public static final int COMMA = 1;
    public static final int ASSIGNMENT = 2;
    public static final int CONDITIONAL = 3;
    public static final int UNARY = 14;
    public static final int ATOMIC = 100;

    private static final Map<String, Integer> BINARY = Map.ofEntries(
            Map.entry("=", ASSIGNMENT), Map.entry("+=", ASSIGNMENT), Map.entry("-=", ASSIGNMENT),
            Map.entry("*=", ASSIGNMENT), Map.entry("/=", ASSIGNMENT), Map.entry("%=", ASSIGNMENT),
            Map.entry("<<=", ASSIGNMENT), Map.entry(">>=", ASSIGNMENT), Map.entry("&=", ASSIGNMENT),
            Map.entry("^=", ASSIGNMENT), Map.entry("|=", ASSIGNMENT),
            Map.entry("||", 4),
            Map.entry("&&", 5),
            Map.entry("|", 6),
            Map.entry("^", 7),
            Map.entry("&", 8),
            Map.entry("==", 9), Map.entry("!=", 9),
            Map.entry("<", 10), Map.entry(">", 10), Map.entry("<=", 10), Map.entry(">=", 10),
            Map.entry("<<", 11), Map.entry(">>", 11),
            Map.entry("+", 12), Map.entry("-", 12),
            Map.entry("*", 13), Map.entry("/", 13), Map.entry("%", 13));

    private Operators() {
    }

    public static int precedence(String operator) {
        return BINARY.getOrDefault(operator, COMMA);
    }

    public static boolean isRightAssociative(String operator) {
        return precedence(operator) == ASSIGNMENT;
    }

    /**
     * True when an operand of the given precedence must be parenthesized as the left or
     * right operand of {@code parentOperator}.
     */
    public static boolean needsParentheses(int operandPrecedence, String parentOperator, boolean rightOperand) {
        int parent = precedence(parentOperator);
        if (operandPrecedence != parent) {
            return operandPrecedence < parent;
        }
        return rightOperand != isRightAssociative(parentOperator);
    }
}

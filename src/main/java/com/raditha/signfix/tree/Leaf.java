package com.raditha.signfix.tree;

import com.raditha.signfix.types.TypeSpelling;

/**
 * An operand that is not a binary operation, or a binary operation already reduced.
 *
 * @param text           operand text without the enclosing parentheses
 * @param type           type spelling
 * @param canonicalType  front-end canonical type
 * @param classification what the operand is
 * @param precedence     binding strength of the text's outermost operator,
 *                       {@link Operators#ATOMIC} for primary and postfix expressions
 * @param parenthesized  true when written inside one pair of parentheses
 * @param changed        true when casts were inserted into the text
 */
public record Leaf(
        String text,
        String type,
        String canonicalType,
        Classification classification,
        int precedence,
        boolean parenthesized,
        boolean changed) implements ExprNode {

    public boolean isIntegerLiteral() {
        return classification == Classification.CONSTANT && TypeSpelling.isIntegerLiteral(text);
    }

    /**
     * True when a cast in front of the text would not bind to the whole operand.
     */
    public boolean isCompound() {
        return !parenthesized && precedence < Operators.ATOMIC;
    }

    /**
     * Text as it appears in an enclosing expression, with its parentheses.
     */
    public String rendered() {
        return parenthesized ? "(" + text + ")" : text;
    }

    /**
     * Precedence of {@link #rendered()}.
     */
    public int effectivePrecedence() {
        return parenthesized ? Operators.ATOMIC : precedence;
    }

    /**
     * Copy with rewritten text. A cast expression binds like a unary operator and already
     * contains the operand's parentheses.
     */
    public Leaf withText(String newText, boolean cast) {
        return new Leaf(newText, type, canonicalType, classification,
                cast ? Operators.UNARY : Operators.ATOMIC, !cast && parenthesized, true);
    }
}

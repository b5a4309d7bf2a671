package com.raditha.signfix.resolve;

/**
 * One cast applied while resolving an expression.
 *
 * @param side        operand that was cast
 * @param original    operand text before the cast
 * @param replacement operand text after the cast
 * @param castType    type the operand was cast to
 * @param literal     true when the cast was a literal suffix rewrite
 */
public record CastRecord(Side side, String original, String replacement, String castType, boolean literal) {

    public enum Side {
        LEFT,
        RIGHT
    }
}

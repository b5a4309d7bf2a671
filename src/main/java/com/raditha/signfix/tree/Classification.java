package com.raditha.signfix.tree;

/**
 * What a leaf operand is.
 */
public enum Classification {
    VARIABLE,
    MACRO,
    FUNCTION,
    CONSTANT,
    OTHER
}

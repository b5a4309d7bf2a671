package com.raditha.signfix.tree;

/**
 * Node of an expression tree: an operand or a binary operation.
 */
public sealed interface ExprNode permits Leaf, Binary {

    /**
     * Declared or computed type spelling, typedef names kept.
     */
    String type();

    /**
     * Type with typedefs resolved by the front-end, used when the Type Table cannot resolve {@link #type()}.
     */
    String canonicalType();

    boolean parenthesized();
}

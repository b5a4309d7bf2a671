package com.raditha.signfix.frontend;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * A node of the C syntax tree, positioned in preprocessed coordinates.
 * <p>
 * Children are the semantic children: the two operands of a binary operator, the callee
 * followed by the arguments of a call, the operand of a cast or parenthesized expression,
 * the declarations of a declaration statement, and so on.
 */
public interface Cursor {

    CursorKind kind();

    /**
     * Name for declarations and references, the literal text for literals, empty otherwise.
     */
    String spelling();

    List<Cursor> children();

    @Nullable
    Cursor parent();

    SourceExtent extent();

    /**
     * Exact text of the extent in the preprocessed source.
     */
    String text();

    /**
     * Tokens inside the extent, in order.
     */
    List<CursorToken> tokens();

    /**
     * Declaration this cursor refers to: variables and functions for references and calls.
     */
    Optional<Cursor> referenced();

    /**
     * Type as declared or computed, keeping typedef names. Empty when unknown.
     */
    String typeSpelling();

    /**
     * Type with typedefs known to the translation unit resolved. Empty when unknown.
     */
    String canonicalTypeSpelling();
}

package com.raditha.signfix.locate;

import com.raditha.signfix.frontend.Cursor;

import java.util.List;

/**
 * Result of locating a flagged operator.
 *
 * @param target           the flagged binary node
 * @param topLevel         outermost expression containing the target, stopping at statement
 *                         boundaries and at call arguments
 * @param sourceLine       the original line text
 * @param preprocessedLine line of the target's operator in the preprocessed text
 * @param spanStart        0-based offset of the target's source text on the line, -1 when unknown
 * @param spanEnd          0-based offset after the target's source text, -1 when unknown
 * @param macros           macro invocations inside the span (or on the whole line when the
 *                         span is unknown), left to right
 * @param candidates       every candidate found on the line, by source column
 */
public record LocatedExpression(
        Cursor target,
        Cursor topLevel,
        String sourceLine,
        int preprocessedLine,
        int spanStart,
        int spanEnd,
        List<MacroInvocation> macros,
        List<Candidate> candidates) {

    public LocatedExpression {
        macros = List.copyOf(macros);
        candidates = List.copyOf(candidates);
    }

    public boolean hasSpan() {
        return spanStart >= 0 && spanEnd >= spanStart;
    }

    /**
     * Source text of the target, or null when the span is unknown.
     */
    public String spanText() {
        return hasSpan() ? sourceLine.substring(spanStart, spanEnd) : null;
    }
}

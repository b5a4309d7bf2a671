package com.raditha.signfix.resolve;

import java.util.List;

/**
 * Result of reducing an expression tree.
 *
 * @param text       rendered expression text
 * @param type       type of the reduced expression
 * @param casts      casts applied, innermost first
 * @param reductions number of binary nodes reduced
 */
public record Resolution(String text, String type, List<CastRecord> casts, int reductions) {

    public Resolution {
        casts = List.copyOf(casts);
    }

    public boolean changed() {
        return !casts.isEmpty();
    }
}

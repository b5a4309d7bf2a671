package com.raditha.signfix.alias;

import java.util.Set;

/**
 * Result of resolving a name or spelling through an {@link AliasTable}.
 *
 * @param value         resolved text; partially resolved when a cycle or the depth cap was hit
 * @param related       table names substituted along the way
 * @param cycleDetected true when resolution stopped on a name already being resolved, on
 *                      the depth cap or on the length cap
 */
public record AliasResolution(String value, Set<String> related, boolean cycleDetected) {

    public AliasResolution {
        related = Set.copyOf(related);
    }

    static AliasResolution unresolved(String value) {
        return new AliasResolution(value, Set.of(), false);
    }
}

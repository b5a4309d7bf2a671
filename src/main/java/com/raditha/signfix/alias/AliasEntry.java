package com.raditha.signfix.alias;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One row of a Macro Table or Type Table.
 *
 * @param name          macro or typedef name
 * @param resolvedValue fully substituted value (macro) or underlying type (typedef)
 * @param relatedNames  other table names that took part in the resolution
 * @param usageFile     file the usage lines refer to
 * @param usageLines    lines (1-indexed) where the name occurs as a whole word
 */
public record AliasEntry(
        String name,
        String resolvedValue,
        SortedSet<String> relatedNames,
        String usageFile,
        List<Integer> usageLines) {

    public AliasEntry {
        relatedNames = Collections.unmodifiableSortedSet(new TreeSet<>(relatedNames));
        usageLines = List.copyOf(usageLines);
    }
}

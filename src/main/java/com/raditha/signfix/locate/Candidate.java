package com.raditha.signfix.locate;

import com.raditha.signfix.frontend.Cursor;

/**
 * A binary node whose operator matched the requested spelling on the requested line.
 *
 * @param node            the binary or compound-assignment cursor
 * @param expandedColumn  1-based column of its operator in the preprocessed line
 * @param sourceColumn    1-based column of the operator occurrence on the source line
 * @param occurrenceIndex 1-based occurrence index on the source line
 */
public record Candidate(Cursor node, int expandedColumn, int sourceColumn, int occurrenceIndex) {
}

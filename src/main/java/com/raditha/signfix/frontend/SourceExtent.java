package com.raditha.signfix.frontend;

/**
 * Range of a cursor in the preprocessed text.
 *
 * @param startLine   first line (1-indexed)
 * @param startColumn column of the first character (1-indexed)
 * @param endLine     last line (1-indexed)
 * @param endColumn   column after the last character (1-indexed, exclusive)
 * @param startOffset character offset of the first character
 * @param endOffset   character offset after the last character
 */
public record SourceExtent(int startLine, int startColumn, int endLine, int endColumn,
                           int startOffset, int endOffset) {

    public boolean containsLine(int line) {
        return startLine <= line && line <= endLine;
    }
}

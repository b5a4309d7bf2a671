package com.raditha.signfix.model;

/**
 * A position in a source file.
 *
 * @param file   path of the file the position refers to
 * @param line   line number (1-indexed)
 * @param column column number (1-indexed, 0 when unknown)
 */
public record SourcePosition(String file, int line, int column) {

    /**
     * Format as "file:line:column" for display.
     */
    @Override
    public String toString() {
        return file + ":" + line + (column > 0 ? ":" + column : "");
    }
}

package com.raditha.signfix.frontend;

import com.raditha.signfix.lexer.LexTokenKind;

/**
 * A token of the preprocessed text with its position.
 *
 * @param kind        lexical category
 * @param spelling    exact text
 * @param line        line (1-indexed)
 * @param column      column of the first character (1-indexed)
 * @param startOffset character offset of the first character
 * @param endOffset   character offset after the last character
 */
public record CursorToken(LexTokenKind kind, String spelling, int line, int column, int startOffset, int endOffset) {

    public boolean is(String text) {
        return spelling.equals(text);
    }
}

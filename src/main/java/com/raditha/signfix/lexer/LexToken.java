package com.raditha.signfix.lexer;

/**
 * A token of C source text.
 *
 * @param kind  token category
 * @param text  exact spelling
 * @param start offset of the first character (0-based, inclusive)
 * @param end   offset after the last character (exclusive)
 */
public record LexToken(LexTokenKind kind, String text, int start, int end) {

    /**
     * 1-based column of the first character.
     */
    public int column() {
        return start + 1;
    }

    public boolean is(String spelling) {
        return text.equals(spelling);
    }

    public boolean isIdentifier() {
        return kind == LexTokenKind.IDENTIFIER;
    }
}

package com.raditha.signfix.lexer;

/**
 * Category of a {@link LexToken}.
 */
public enum LexTokenKind {
    IDENTIFIER,
    NUMBER,
    STRING,
    CHAR,
    PUNCTUATOR
}

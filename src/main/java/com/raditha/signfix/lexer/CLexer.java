package com.raditha.signfix.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Tokenizer for C source text at the preprocessing-token level.
 * <p>
 * Comments and whitespace are skipped, string and character literals are single tokens and
 * punctuators are matched longest first, so {@code <<=} is one token and never three.
 * The lexer has no state across calls; an unterminated block comment runs to the end of the
 * given text.
 */
public final class CLexer {

    private static final Set<String> PUNCT_3 = Set.of("<<=", ">>=", "...");

    private static final Set<String> PUNCT_2 = Set.of(
            "->", "++", "--", "<<", ">>", "<=", ">=", "==", "!=", "&&", "||",
            "*=", "/=", "%=", "+=", "-=", "&=", "^=", "|=", "##");

    private CLexer() {
    }

    /**
     * Tokenize the whole text.
     */
    public static List<LexToken> tokenize(String text) {
        List<LexToken> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        int n = text.length();
        int i = 0;
        while (i < n) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (c == '/' && i + 1 < n && text.charAt(i + 1) == '/') {
                break;
            }
            if (c == '/' && i + 1 < n && text.charAt(i + 1) == '*') {
                int close = text.indexOf("*/", i + 2);
                i = close < 0 ? n : close + 2;
                continue;
            }
            int start = i;
            if (Character.isLetter(c) || c == '_') {
                i++;
                while (i < n && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
                    i++;
                }
                if (i < n && (text.charAt(i) == '"' || text.charAt(i) == '\'') && isEncodingPrefix(text, start, i)) {
                    char quote = text.charAt(i);
                    i = skipQuoted(text, i, quote);
                    tokens.add(new LexToken(quote == '"' ? LexTokenKind.STRING : LexTokenKind.CHAR,
                            text.substring(start, i), start, i));
                    continue;
                }
                tokens.add(new LexToken(LexTokenKind.IDENTIFIER, text.substring(start, i), start, i));
                continue;
            }
            if (Character.isDigit(c) || (c == '.' && i + 1 < n && Character.isDigit(text.charAt(i + 1)))) {
                i = skipNumber(text, i);
                tokens.add(new LexToken(LexTokenKind.NUMBER, text.substring(start, i), start, i));
                continue;
            }
            if (c == '"' || c == '\'') {
                i = skipQuoted(text, i, c);
                tokens.add(new LexToken(c == '"' ? LexTokenKind.STRING : LexTokenKind.CHAR,
                        text.substring(start, i), start, i));
                continue;
            }
            String punct = punctuatorAt(text, i);
            i += punct.length();
            tokens.add(new LexToken(LexTokenKind.PUNCTUATOR, punct, start, i));
        }
        return tokens;
    }

    /**
     * Longest punctuator starting at {@code pos}.
     */
    static String punctuatorAt(String text, int pos) {
        int n = text.length();
        if (pos + 3 <= n && PUNCT_3.contains(text.substring(pos, pos + 3))) {
            return text.substring(pos, pos + 3);
        }
        if (pos + 2 <= n && PUNCT_2.contains(text.substring(pos, pos + 2))) {
            return text.substring(pos, pos + 2);
        }
        return text.substring(pos, pos + 1);
    }

    private static boolean isEncodingPrefix(String text, int start, int end) {
        String prefix = text.substring(start, end);
        return prefix.equals("L") || prefix.equals("u") || prefix.equals("U") || prefix.equals("u8");
    }

    private static int skipQuoted(String text, int pos, char quote) {
        int i = pos + 1;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            i++;
            if (c == quote) {
                break;
            }
        }
        return Math.min(i, n);
    }

    private static int skipNumber(String text, int pos) {
        int i = pos;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                i++;
            } else if ((c == '+' || c == '-') && i > pos && "eEpP".indexOf(text.charAt(i - 1)) >= 0
                    && !text.substring(pos, Math.min(pos + 2, n)).matches("0[xX]")) {
                i++;
            } else if ((c == '+' || c == '-') && i > pos && "pP".indexOf(text.charAt(i - 1)) >= 0) {
                i++;
            } else {
                break;
            }
        }
        return i;
    }
}

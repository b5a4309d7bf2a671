package com.raditha.signfix.locate;

import com.raditha.signfix.alias.MacroTable;
import com.raditha.signfix.lexer.CLexer;
import com.raditha.signfix.lexer.LexToken;
import com.raditha.signfix.lexer.LexTokenKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * Lexical view of one original source line: its tokens, the macro invocations on it and the
 * source-visible occurrences of an operator.
 * <p>
 * A token belongs to an invocation when it is the macro name or lies inside the argument
 * list of a function-like invocation. An argument list left open at the end of the line runs
 * to the end of the line.
 */
public final class SourceLine {

    private final String text;
    private final List<LexToken> tokens;
    private final List<MacroInvocation> invocations = new ArrayList<>();
    private final int[] owner;

    private SourceLine(String text, Predicate<String> isMacro, Predicate<String> isFunctionLike) {
        this.text = text;
        this.tokens = CLexer.tokenize(text);
        this.owner = new int[tokens.size()];
        Arrays.fill(owner, -1);
        int i = 0;
        while (i < tokens.size()) {
            LexToken token = tokens.get(i);
            if (!token.isIdentifier() || !isMacro.test(token.text())) {
                i++;
                continue;
            }
            int last = i;
            boolean call = i + 1 < tokens.size() && tokens.get(i + 1).is("(") && isFunctionLike.test(token.text());
            if (call) {
                last = closingParen(i + 1);
            }
            int index = invocations.size();
            int end = tokens.get(last).end();
            invocations.add(new MacroInvocation(token.text(), text.substring(token.start(), end), token.start(), end,
                    call, List.of()));
            for (int k = i; k <= last; k++) {
                owner[k] = index;
            }
            i = last + 1;
        }
    }

    /**
     * Analyze a line using the macros of a table. Expansions are taken from the table for
     * object-like macros.
     */
    public static SourceLine of(String text, MacroTable macros) {
        SourceLine line = new SourceLine(text, macros::isMacro, macros::isFunctionLike);
        for (int k = 0; k < line.invocations.size(); k++) {
            MacroInvocation inv = line.invocations.get(k);
            if (!inv.functionLike()) {
                String value = macros.resolvedValue(inv.name());
                if (value != null) {
                    line.invocations.set(k, inv.withExpansion(spellings(CLexer.tokenize(value))));
                }
            }
        }
        return line;
    }

    /**
     * Analyze a line with an arbitrary notion of which identifiers are macros.
     */
    static SourceLine of(String text, Predicate<String> isMacro, Predicate<String> isFunctionLike) {
        return new SourceLine(text, isMacro, isFunctionLike);
    }

    private int closingParen(int open) {
        int depth = 0;
        for (int k = open; k < tokens.size(); k++) {
            if (tokens.get(k).is("(")) {
                depth++;
            } else if (tokens.get(k).is(")")) {
                depth--;
                if (depth == 0) {
                    return k;
                }
            }
        }
        return tokens.size() - 1;
    }

    static List<String> spellings(List<LexToken> tokens) {
        List<String> result = new ArrayList<>(tokens.size());
        for (LexToken t : tokens) {
            result.add(t.text());
        }
        return result;
    }

    public String text() {
        return text;
    }

    public List<LexToken> tokens() {
        return Collections.unmodifiableList(tokens);
    }

    public List<MacroInvocation> invocations() {
        return Collections.unmodifiableList(invocations);
    }

    void setExpansion(int invocation, List<String> expansion) {
        invocations.set(invocation, invocations.get(invocation).withExpansion(expansion));
    }

    /**
     * Index of the invocation a token belongs to, or -1.
     */
    int invocationOf(int tokenIndex) {
        return owner[tokenIndex];
    }

    /**
     * Token indexes of the operator's source-visible occurrences, in column order: punctuator
     * tokens spelled exactly as the operator that are not part of a macro invocation.
     */
    public List<Integer> occurrences(String operator) {
        List<Integer> result = new ArrayList<>();
        for (int k = 0; k < tokens.size(); k++) {
            LexToken t = tokens.get(k);
            if (t.kind() == LexTokenKind.PUNCTUATOR && t.is(operator) && owner[k] < 0) {
                result.add(k);
            }
        }
        return result;
    }
}

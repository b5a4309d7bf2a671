package com.raditha.signfix.locate;

import com.raditha.signfix.lexer.LexToken;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Token alignment of an expanded line against its source line.
 * <p>
 * Source tokens outside macro invocations must match expanded tokens one to one; each
 * invocation matches any run of expanded tokens, possibly empty. The result maps every
 * expanded token either to the source token it came from or to the invocation that
 * produced it.
 */
public final class LineAlignment {

    private final SourceLine source;
    private final List<LexToken> expanded;
    /** Per expanded token: source token index, or {@code -(invocation + 1)} for macro output. */
    private final int[] origin;

    private LineAlignment(SourceLine source, List<LexToken> expanded, int[] origin) {
        this.source = source;
        this.expanded = expanded;
        this.origin = origin;
    }

    /**
     * Align, or empty when no alignment exists. On success the expansions of the source
     * line's invocations are replaced by the expanded tokens they matched.
     */
    public static Optional<LineAlignment> align(SourceLine source, List<LexToken> expanded) {
        List<Element> elements = elements(source);
        int n = elements.size();
        int m = expanded.size();
        boolean[][] dp = new boolean[n + 1][m + 1];
        dp[0][0] = true;
        for (int i = 0; i < n; i++) {
            Element e = elements.get(i);
            boolean reachable = false;
            for (int j = 0; j <= m; j++) {
                if (e.isMacro()) {
                    reachable |= dp[i][j];
                    dp[i + 1][j] = reachable;
                } else if (j < m && dp[i][j] && e.token().text().equals(expanded.get(j).text())) {
                    dp[i + 1][j + 1] = true;
                }
            }
        }
        if (!dp[n][m]) {
            return Optional.empty();
        }

        int[] origin = new int[m];
        int j = m;
        for (int i = n; i > 0; i--) {
            Element e = elements.get(i - 1);
            if (!e.isMacro()) {
                j--;
                origin[j] = e.tokenIndex();
                continue;
            }
            int k = j;
            while (!dp[i - 1][k]) {
                k--;
            }
            List<String> produced = new ArrayList<>();
            for (int t = k; t < j; t++) {
                origin[t] = -(e.invocation() + 1);
                produced.add(expanded.get(t).text());
            }
            source.setExpansion(e.invocation(), produced);
            j = k;
        }
        return Optional.of(new LineAlignment(source, expanded, origin));
    }

    private static List<Element> elements(SourceLine source) {
        List<Element> elements = new ArrayList<>();
        List<LexToken> tokens = source.tokens();
        int lastInvocation = -1;
        for (int k = 0; k < tokens.size(); k++) {
            int inv = source.invocationOf(k);
            if (inv < 0) {
                elements.add(new Element(tokens.get(k), k, -1));
            } else if (inv != lastInvocation) {
                elements.add(new Element(null, k, inv));
                lastInvocation = inv;
            }
        }
        return elements;
    }

    public SourceLine source() {
        return source;
    }

    /**
     * Source token index an expanded token came from, or -1 when a macro produced it.
     */
    public int sourceToken(int expandedIndex) {
        return origin[expandedIndex] >= 0 ? origin[expandedIndex] : -1;
    }

    /**
     * Invocation that produced an expanded token, or -1 when it was written in the source.
     */
    public int invocation(int expandedIndex) {
        return origin[expandedIndex] < 0 ? -origin[expandedIndex] - 1 : -1;
    }

    /**
     * Index of the expanded token starting at a 1-based column, or -1.
     */
    public int expandedIndexAt(int column) {
        for (int k = 0; k < expanded.size(); k++) {
            if (expanded.get(k).column() == column) {
                return k;
            }
        }
        return -1;
    }

    /**
     * 0-based source offset where the expanded token's origin starts.
     */
    public int sourceStart(int expandedIndex) {
        int inv = invocation(expandedIndex);
        return inv >= 0 ? source.invocations().get(inv).start()
                : source.tokens().get(origin[expandedIndex]).start();
    }

    /**
     * 0-based source offset after the expanded token's origin.
     */
    public int sourceEnd(int expandedIndex) {
        int inv = invocation(expandedIndex);
        return inv >= 0 ? source.invocations().get(inv).end()
                : source.tokens().get(origin[expandedIndex]).end();
    }

    @Override
    public String toString() {
        return "LineAlignment" + Arrays.toString(origin);
    }

    private record Element(LexToken token, int tokenIndex, int invocation) {
        boolean isMacro() {
            return invocation >= 0;
        }
    }
}

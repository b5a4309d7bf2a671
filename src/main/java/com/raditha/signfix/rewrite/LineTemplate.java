package com.raditha.signfix.rewrite;

/**
 * A source line with one hole where the rewritten expression goes.
 *
 * @param prefix text before the hole
 * @param suffix text after the hole
 */
public record LineTemplate(String prefix, String suffix) {

    public static final String PLACEHOLDER = "@";

    /**
     * Template that keeps everything of the line outside {@code [start, end)}.
     */
    public static LineTemplate ofSpan(String line, int start, int end) {
        return new LineTemplate(line.substring(0, start), line.substring(end));
    }

    public String fill(String expression) {
        return prefix + expression + suffix;
    }

    @Override
    public String toString() {
        return prefix + PLACEHOLDER + suffix;
    }
}

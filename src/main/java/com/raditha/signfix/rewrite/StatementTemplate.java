package com.raditha.signfix.rewrite;

import com.raditha.signfix.lexer.CLexer;
import com.raditha.signfix.lexer.LexToken;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical statement shapes used when the expression's span on the line is unknown.
 * <p>
 * The statement is rewritten in its canonical form with the expression in the slot that
 * contains the operator; the indentation, a declaration prefix and whatever follows the
 * statement header are kept.
 */
public enum StatementTemplate {
    IF("if"),
    WHILE("while"),
    FOR("for"),
    RETURN("return"),
    CASE("case"),
    BREAK("break"),
    EXPRESSION(null);

    private static final Pattern INDENT = Pattern.compile("^\\s*");
    private static final Pattern DECLARATION_PREFIX = Pattern.compile(
            "^((?:[A-Za-z_]\\w*\\s+)+\\**\\s*[A-Za-z_]\\w*\\s*(?:\\[[^\\]]*\\]\\s*)*=(?!=)\\s*)");

    private final String keyword;

    StatementTemplate(String keyword) {
        this.keyword = keyword;
    }

    /**
     * The shape of a line, judged by its first token.
     */
    public static StatementTemplate of(String line) {
        List<LexToken> tokens = CLexer.tokenize(line);
        if (!tokens.isEmpty() && tokens.get(0).isIdentifier()) {
            String first = tokens.get(0).text();
            for (StatementTemplate t : values()) {
                if (first.equals(t.keyword)) {
                    return t;
                }
            }
        }
        return EXPRESSION;
    }

    /**
     * Build the template for a line.
     *
     * @param line   the source line
     * @param column 1-based source column of the operator, used to pick the slot of a
     *               {@code for} header
     * @return the template, or empty when the shape has no slot for an expression
     */
    public Optional<LineTemplate> template(String line, int column) {
        Matcher m = INDENT.matcher(line);
        String indent = m.find() ? m.group() : "";
        String body = line.substring(indent.length());
        List<LexToken> tokens = CLexer.tokenize(line);

        switch (this) {
            case IF, WHILE -> {
                int[] parens = header(tokens);
                if (parens == null) {
                    return Optional.empty();
                }
                return Optional.of(new LineTemplate(indent + keyword + "( ", " )" + line.substring(parens[1] + 1)));
            }
            case FOR -> {
                int[] parens = header(tokens);
                if (parens == null) {
                    return Optional.empty();
                }
                List<String> clauses = clauses(line, tokens, parens);
                int slot = slot(tokens, parens, column - 1);
                if (clauses.size() != 3 || slot < 0) {
                    return Optional.empty();
                }
                StringBuilder before = new StringBuilder(indent + "for( ");
                StringBuilder after = new StringBuilder();
                for (int k = 0; k < 3; k++) {
                    StringBuilder target = k < slot ? before : after;
                    if (k == slot) {
                        continue;
                    }
                    if (k > slot) {
                        target.append("; ");
                    }
                    target.append(clauses.get(k).trim());
                    if (k < slot) {
                        target.append("; ");
                    }
                }
                after.append(" )").append(line.substring(parens[1] + 1));
                return Optional.of(new LineTemplate(before.toString(), after.toString()));
            }
            case RETURN -> {
                return Optional.of(new LineTemplate(indent + "return ", ";" + afterSemicolon(line, tokens)));
            }
            case CASE -> {
                int colon = firstTopLevel(tokens, ":");
                String rest = colon < 0 ? "" : line.substring(tokens.get(colon).end());
                return Optional.of(new LineTemplate(indent + "case ", ":" + rest));
            }
            case BREAK -> {
                return Optional.empty();
            }
            default -> {
                Matcher decl = DECLARATION_PREFIX.matcher(body);
                String prefix = decl.find() ? decl.group(1) : "";
                return Optional.of(new LineTemplate(indent + prefix, ";" + afterSemicolon(line, tokens)));
            }
        }
    }

    /**
     * Offsets of the parentheses following the keyword.
     */
    private static int[] header(List<LexToken> tokens) {
        if (tokens.size() < 2 || !tokens.get(1).is("(")) {
            return null;
        }
        int depth = 0;
        for (int k = 1; k < tokens.size(); k++) {
            if (tokens.get(k).is("(")) {
                depth++;
            } else if (tokens.get(k).is(")") && --depth == 0) {
                return new int[]{tokens.get(1).start(), tokens.get(k).start()};
            }
        }
        return null;
    }

    private static List<String> clauses(String line, List<LexToken> tokens, int[] parens) {
        List<String> result = new ArrayList<>();
        int depth = 0;
        int from = parens[0] + 1;
        for (LexToken t : tokens) {
            if (t.start() <= parens[0] || t.start() >= parens[1]) {
                continue;
            }
            if (t.is("(") || t.is("[")) {
                depth++;
            } else if (t.is(")") || t.is("]")) {
                depth--;
            } else if (t.is(";") && depth == 0) {
                result.add(line.substring(from, t.start()));
                from = t.end();
            }
        }
        result.add(line.substring(from, parens[1]));
        return result;
    }

    private static int slot(List<LexToken> tokens, int[] parens, int offset) {
        if (offset <= parens[0] || offset >= parens[1]) {
            return -1;
        }
        int depth = 0;
        int slot = 0;
        for (LexToken t : tokens) {
            if (t.start() <= parens[0] || t.start() >= offset) {
                continue;
            }
            if (t.is("(") || t.is("[")) {
                depth++;
            } else if (t.is(")") || t.is("]")) {
                depth--;
            } else if (t.is(";") && depth == 0) {
                slot++;
            }
        }
        return slot;
    }

    private static int firstTopLevel(List<LexToken> tokens, String spelling) {
        int depth = 0;
        for (int k = 0; k < tokens.size(); k++) {
            LexToken t = tokens.get(k);
            if (t.is("(") || t.is("[")) {
                depth++;
            } else if (t.is(")") || t.is("]")) {
                depth--;
            } else if (t.is(spelling) && depth == 0) {
                return k;
            }
        }
        return -1;
    }

    private static String afterSemicolon(String line, List<LexToken> tokens) {
        int semi = firstTopLevel(tokens, ";");
        return semi < 0 ? "" : line.substring(tokens.get(semi).end());
    }
}

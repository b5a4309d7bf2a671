package com.raditha.signfix.rewrite;

import com.raditha.signfix.lexer.CLexer;
import com.raditha.signfix.lexer.LexToken;
import com.raditha.signfix.lexer.LexTokenKind;
import com.raditha.signfix.locate.Candidate;
import com.raditha.signfix.locate.LocatedExpression;
import com.raditha.signfix.locate.MacroInvocation;
import com.raditha.signfix.resolve.CastRecord;
import com.raditha.signfix.resolve.Resolution;
import com.raditha.signfix.types.TypeSpelling;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Turns a resolved expression back into a source line.
 * <p>
 * The rendered text is in expanded form. Each macro invocation of the located span is put
 * back, left to right, in place of a token run equal to its expansion. Runs that the source
 * line already spells out before the invocation are passed over, so {@code 10 + LIMIT} with
 * {@code LIMIT} defined as {@code 10} keeps the literal in front. The result is
 * then written into the line over the located span, or into a canonical statement template
 * when the span is unknown.
 */
public class SourceReconstructor {

    private static final Logger logger = LoggerFactory.getLogger(SourceReconstructor.class);

    /**
     * Build the replacement line.
     *
     * @param located    where the expression is on the line
     * @param resolution the rewritten expression
     * @return the new line, identical to the source line when nothing was cast
     * @throws ReconstructionException when the text cannot be placed
     */
    public String reconstruct(LocatedExpression located, Resolution resolution) throws ReconstructionException {
        String line = located.sourceLine();
        if (!resolution.changed()) {
            return line;
        }
        String restored = restoreMacros(resolution.text(), line, located.spanStart(), located.macros(),
                resolution.casts());
        LineTemplate template = template(located);
        String result = template.fill(restored);
        logger.debug("Template '{}' filled with '{}'", template, restored);
        return result;
    }

    LineTemplate template(LocatedExpression located) throws ReconstructionException {
        String line = located.sourceLine();
        if (located.hasSpan()) {
            return LineTemplate.ofSpan(line, located.spanStart(), located.spanEnd());
        }
        if (located.target() != located.topLevel()) {
            throw new ReconstructionException("Expression span is unknown and the expression is not a whole statement slot");
        }
        int column = located.candidates().stream()
                .filter(c -> c.node() == located.target())
                .mapToInt(Candidate::sourceColumn)
                .findFirst()
                .orElse(0);
        StatementTemplate shape = StatementTemplate.of(line);
        return shape.template(line, column)
                .orElseThrow(() -> new ReconstructionException("No placeholder in a '" + shape + "' statement"));
    }

    /**
     * Put macro invocations back into expanded text.
     *
     * @throws ReconstructionException when an invocation's expansion is not found
     */
    static String restoreMacros(String rendered, List<MacroInvocation> macros, List<CastRecord> casts)
            throws ReconstructionException {
        return restoreMacros(rendered, null, -1, macros, casts);
    }

    /**
     * Put macro invocations back into expanded text, using the source line to tell an
     * invocation apart from equal tokens written out before it.
     *
     * @param sourceLine the line the invocations were found on, or null when unknown
     * @param spanStart  offset of the expression on that line, negative when unknown
     * @throws ReconstructionException when an invocation's expansion is not found
     */
    static String restoreMacros(String rendered, String sourceLine, int spanStart, List<MacroInvocation> macros,
                                List<CastRecord> casts) throws ReconstructionException {
        List<LexToken> tokens = CLexer.tokenize(rendered);
        StringBuilder out = new StringBuilder();
        int copied = 0;
        int next = 0;
        int gapStart = Math.max(spanStart, 0);
        for (MacroInvocation macro : macros) {
            List<String> expansion = macro.expansion();
            if (expansion.isEmpty()) {
                continue;
            }
            int skip = writtenBefore(sourceLine, gapStart, macro.start(), expansion);
            gapStart = Math.max(gapStart, macro.end());
            int at = find(tokens, next, expansion, skip);
            if (at < 0 && skip > 0) {
                logger.debug("{} runs equal to {} not found after offset {}, taking the first", skip, macro.name(), next);
                at = find(tokens, next, expansion, 0);
            }
            if (at < 0) {
                throw new ReconstructionException("Expansion of " + macro.name() + " not found in '" + rendered + "'");
            }
            LexToken first = tokens.get(at);
            LexToken last = tokens.get(at + expansion.size() - 1);
            out.append(rendered, copied, first.start());
            out.append(replacement(macro, tokens.subList(at, at + expansion.size()), casts));
            copied = last.end();
            next = at + expansion.size();
        }
        out.append(rendered.substring(copied));
        return out.toString();
    }

    private static String replacement(MacroInvocation macro, List<LexToken> matched, List<CastRecord> casts) {
        for (int k = 0; k < matched.size(); k++) {
            LexToken token = matched.get(k);
            String original = macro.expansion().get(k);
            if (TypeSpelling.isIntegerLiteral(token.text()) && !token.text().equals(original)) {
                String castType = castTypeOf(token.text(), casts);
                logger.debug("Literal of {} rewritten to {}, casting the macro to {}", macro.name(), token.text(), castType);
                return "(" + castType + ")" + macro.sourceText();
            }
        }
        return macro.sourceText();
    }

    private static String castTypeOf(String literal, List<CastRecord> casts) {
        for (CastRecord cast : casts) {
            if (cast.literal() && stripParens(cast.replacement()).equals(literal)) {
                return cast.castType();
            }
        }
        return TypeSpelling.literalType(literal);
    }

    private static String stripParens(String text) {
        String s = text.trim();
        while (s.startsWith("(") && s.endsWith(")")) {
            s = s.substring(1, s.length() - 1).trim();
        }
        return s;
    }

    /**
     * Number of separate runs equal to the expansion in the plain source text between two offsets.
     */
    private static int writtenBefore(String sourceLine, int from, int to, List<String> expansion) {
        if (sourceLine == null || from >= to || to > sourceLine.length()) {
            return 0;
        }
        List<LexToken> written = CLexer.tokenize(sourceLine.substring(from, to));
        int count = 0;
        int at = find(written, 0, expansion);
        while (at >= 0) {
            count++;
            at = find(written, at + expansion.size(), expansion);
        }
        return count;
    }

    private static int find(List<LexToken> tokens, int from, List<String> expansion, int skip) {
        int at = find(tokens, from, expansion);
        for (int k = 0; k < skip && at >= 0; k++) {
            at = find(tokens, at + expansion.size(), expansion);
        }
        return at;
    }

    private static int find(List<LexToken> tokens, int from, List<String> expansion) {
        for (int i = from; i + expansion.size() <= tokens.size(); i++) {
            boolean match = true;
            for (int k = 0; k < expansion.size() && match; k++) {
                match = sameToken(tokens.get(i + k), expansion.get(k));
            }
            if (match) {
                return i;
            }
        }
        return -1;
    }

    private static boolean sameToken(LexToken token, String spelling) {
        if (token.is(spelling)) {
            return true;
        }
        if (token.kind() == LexTokenKind.NUMBER && TypeSpelling.isIntegerLiteral(spelling)) {
            Long value = TypeSpelling.literalValue(token.text());
            return value != null && Objects.equals(value, TypeSpelling.literalValue(spelling));
        }
        return false;
    }
}

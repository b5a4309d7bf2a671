package com.raditha.signfix.locate;

import com.raditha.signfix.alias.MacroTable;
import com.raditha.signfix.frontend.Cursor;
import com.raditha.signfix.frontend.CursorKind;
import com.raditha.signfix.frontend.CursorToken;
import com.raditha.signfix.frontend.Cursors;
import com.raditha.signfix.lexer.CLexer;
import com.raditha.signfix.lexer.LexToken;
import com.raditha.signfix.model.FixRequest;
import com.raditha.signfix.preprocess.LineMapper;
import com.raditha.signfix.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the AST node of a flagged operator occurrence.
 * <p>
 * Occurrences are counted on the original source line. Each binary node of the enclosing
 * declaration whose operator sits on the line is mapped from its expanded column back to a
 * source column through a {@link LineAlignment}. Operators produced by macros are never
 * candidates. When the lines cannot be aligned, the n-th node by column is taken to be the
 * n-th source occurrence.
 */
public class ExpressionLocator {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionLocator.class);

    /**
     * Locate the node for a request.
     *
     * @throws LocateException when the line does not exist or the occurrence has no node
     */
    public LocatedExpression locate(Session session, FixRequest request) throws LocateException {
        String line = session.sourceLine(request.lineNumber());
        if (line == null) {
            throw new LocateException("Line " + request.lineNumber() + " is outside " + session.fileName());
        }
        List<Hit> hits = scan(session, request.lineNumber(), request.operatorSpelling());
        Hit chosen = null;
        for (Hit hit : hits) {
            if (hit.candidate().occurrenceIndex() == request.occurrenceIndex()) {
                chosen = hit;
                break;
            }
        }
        if (chosen == null) {
            throw new LocateException(String.format("Operator '%s' occurrence %d not found on line %d (%d candidates)",
                    request.operatorSpelling(), request.occurrenceIndex(), request.lineNumber(), hits.size()));
        }

        Cursor target = chosen.candidate().node();
        int spanStart = -1;
        int spanEnd = -1;
        List<MacroInvocation> macros = new ArrayList<>(chosen.line().invocations());
        if (chosen.alignment() != null) {
            int[] span = sourceSpan(target, chosen.preprocessedLine(), chosen.alignment());
            if (span != null) {
                spanStart = span[0];
                spanEnd = span[1];
                macros.removeIf(m -> !m.within(span[0], span[1]));
            }
        }
        logger.debug("Located '{}' #{} on line {} at source column {} ({})", request.operatorSpelling(),
                request.occurrenceIndex(), request.lineNumber(), chosen.candidate().sourceColumn(), target);
        return new LocatedExpression(target, topLevel(target), line, chosen.preprocessedLine(), spanStart, spanEnd,
                macros, hits.stream().map(Hit::candidate).toList());
    }

    /**
     * All candidates for an operator on a source line, ordered by source column.
     */
    public List<Candidate> candidates(Session session, int lineNumber, String operator) {
        if (session.sourceLine(lineNumber) == null) {
            return List.of();
        }
        return scan(session, lineNumber, operator).stream().map(Hit::candidate).toList();
    }

    private List<Hit> scan(Session session, int lineNumber, String operator) {
        String text = session.sourceLine(lineNumber);
        MacroTable macros = session.macros();
        Map<Integer, Hit> bySourceColumn = new LinkedHashMap<>();

        for (int preLine : session.lineMap().toPreprocessed(session.fileName(), lineNumber)) {
            String expandedText = session.unit().source().line(preLine);
            if (LineMapper.isMarker(expandedText)) {
                continue;
            }
            List<LexToken> expanded = CLexer.tokenize(expandedText);
            SourceLine source = SourceLine.of(text, macros);
            Optional<LineAlignment> alignment = LineAlignment.align(source, expanded);
            if (alignment.isEmpty()) {
                Set<String> present = new HashSet<>(SourceLine.spellings(expanded));
                source = SourceLine.of(text, name -> macros.isMacro(name) || !present.contains(name),
                        name -> !macros.isMacro(name) || macros.isFunctionLike(name));
                alignment = LineAlignment.align(source, expanded);
            }
            if (alignment.isEmpty()) {
                logger.debug("Line {} does not align with preprocessed line {}, ranking by column", lineNumber, preLine);
            }
            collect(session, preLine, operator, source, alignment.orElse(null), bySourceColumn);
        }
        List<Hit> hits = new ArrayList<>(bySourceColumn.values());
        hits.sort(Comparator.comparingInt(h -> h.candidate().sourceColumn()));
        return hits;
    }

    private void collect(Session session, int preLine, String operator, SourceLine source, LineAlignment alignment,
                         Map<Integer, Hit> bySourceColumn) {
        Cursor scope = session.unit().enclosingTopLevel(preLine).orElse(session.unit().root());
        List<Cursor> nodes = new ArrayList<>();
        for (Cursor node : Cursors.descendants(scope, c -> c.kind().isBinary())) {
            Optional<CursorToken> op = Cursors.operatorToken(node);
            if (op.isPresent() && op.get().line() == preLine && op.get().is(operator)) {
                nodes.add(node);
            }
        }
        nodes.sort(Comparator.comparingInt(n -> Cursors.operatorToken(n).map(CursorToken::column).orElse(0)));

        List<Integer> occurrences = source.occurrences(operator);
        for (int rank = 0; rank < nodes.size(); rank++) {
            Cursor node = nodes.get(rank);
            int column = Cursors.operatorToken(node).map(CursorToken::column).orElse(0);
            int sourceToken;
            if (alignment != null) {
                int idx = alignment.expandedIndexAt(column);
                sourceToken = idx < 0 ? -1 : alignment.sourceToken(idx);
            } else {
                sourceToken = rank < occurrences.size() ? occurrences.get(rank) : -1;
            }
            int occurrence = occurrences.indexOf(sourceToken) + 1;
            if (sourceToken < 0 || occurrence == 0) {
                logger.trace("Operator at expanded column {} has no source occurrence", column);
                continue;
            }
            int sourceColumn = source.tokens().get(sourceToken).column();
            bySourceColumn.putIfAbsent(sourceColumn, new Hit(
                    new Candidate(node, column, sourceColumn, occurrence), preLine, source, alignment));
        }
    }

    /**
     * Source offsets covering the target, or null when it does not lie on a single line.
     */
    private static int[] sourceSpan(Cursor target, int preLine, LineAlignment alignment) {
        List<CursorToken> tokens = target.tokens();
        if (tokens.isEmpty()) {
            return null;
        }
        CursorToken first = tokens.get(0);
        CursorToken last = tokens.get(tokens.size() - 1);
        if (first.line() != preLine || last.line() != preLine) {
            return null;
        }
        int i0 = alignment.expandedIndexAt(first.column());
        int i1 = alignment.expandedIndexAt(last.column());
        if (i0 < 0 || i1 < 0) {
            return null;
        }
        return new int[]{alignment.sourceStart(i0), alignment.sourceEnd(i1)};
    }

    /**
     * Outermost expression around the node, not crossing a call's argument list.
     */
    static Cursor topLevel(Cursor node) {
        Cursor current = node;
        while (current.parent() != null && current.parent().kind().isExpression()
                && current.parent().kind() != CursorKind.CALL_EXPR) {
            current = current.parent();
        }
        return current;
    }

    private record Hit(Candidate candidate, int preprocessedLine, SourceLine line, LineAlignment alignment) {
    }
}

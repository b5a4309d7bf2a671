package com.raditha.signfix.scan;

import com.raditha.signfix.frontend.Cursor;
import com.raditha.signfix.frontend.CursorKind;
import com.raditha.signfix.frontend.CursorToken;
import com.raditha.signfix.frontend.Cursors;
import com.raditha.signfix.locate.Candidate;
import com.raditha.signfix.locate.ExpressionLocator;
import com.raditha.signfix.model.Finding;
import com.raditha.signfix.model.SourcePosition;
import com.raditha.signfix.preprocess.LineMap;
import com.raditha.signfix.resolve.TypeResolver;
import com.raditha.signfix.session.Session;
import com.raditha.signfix.tree.ExpressionTreeBuilder;
import com.raditha.signfix.types.TypeSpelling;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lists the binary operations of a file whose integer operands differ in signedness.
 */
public class SignednessScanner {

    private static final Logger logger = LoggerFactory.getLogger(SignednessScanner.class);

    private final ExpressionLocator locator;

    public SignednessScanner() {
        this(new ExpressionLocator());
    }

    public SignednessScanner(ExpressionLocator locator) {
        this.locator = locator;
    }

    public List<Finding> scan(Session session) {
        ExpressionTreeBuilder builder = new ExpressionTreeBuilder(session.macros(), session.functions());
        TypeResolver types = new TypeResolver(session.types());
        LineMap lineMap = session.lineMap();
        Map<String, List<Candidate>> candidates = new HashMap<>();
        List<Finding> findings = new ArrayList<>();

        for (Cursor function : session.unit().functions()) {
            if (!lineMap.belongsTo(function.extent().startLine(), session.fileName())) {
                continue;
            }
            for (Cursor node : Cursors.descendants(function, c -> c.kind().isBinary() && c.children().size() == 2)) {
                Optional<CursorToken> op = Cursors.operatorToken(node);
                if (op.isEmpty()) {
                    continue;
                }
                String leftType = operandType(node.children().get(0), builder, types);
                String rightType = operandType(node.children().get(1), builder, types);
                if (!TypeSpelling.isInteger(leftType) || !TypeSpelling.isInteger(rightType)
                        || TypeSpelling.isUnsigned(leftType) == TypeSpelling.isUnsigned(rightType)) {
                    continue;
                }
                SourcePosition pos = lineMap.toOriginal(op.get().line());
                String operator = op.get().spelling();
                List<Candidate> onLine = candidates.computeIfAbsent(pos.line() + " " + operator,
                        k -> locator.candidates(session, pos.line(), operator));
                int occurrence = onLine.stream()
                        .filter(c -> c.node() == node)
                        .mapToInt(Candidate::occurrenceIndex)
                        .findFirst()
                        .orElse(0);
                if (occurrence == 0) {
                    logger.debug("Conflict at line {} has no source-visible '{}', skipped", pos.line(), operator);
                    continue;
                }
                findings.add(new Finding(function.spelling(), pos.line(), operator, occurrence,
                        node.children().get(0).text().trim(), leftType,
                        node.children().get(1).text().trim(), rightType));
            }
        }
        logger.info("Found {} signedness conflicts in {}", findings.size(), session.fileName());
        return findings;
    }

    /**
     * Type of an operand as written: an explicit cast decides it, otherwise the operand itself.
     */
    static String operandType(Cursor operand, ExpressionTreeBuilder builder, TypeResolver types) {
        Cursor current = operand;
        while (current.kind() == CursorKind.PAREN_EXPR && current.children().size() == 1) {
            current = current.children().get(0);
        }
        if (current.kind() == CursorKind.CSTYLE_CAST_EXPR) {
            return types.resolve(current.typeSpelling(), current.canonicalTypeSpelling());
        }
        return types.resolve(builder.build(operand));
    }
}

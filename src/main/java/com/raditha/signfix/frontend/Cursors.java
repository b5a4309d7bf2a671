package com.raditha.signfix.frontend;

import com.raditha.signfix.lexer.LexTokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Traversal and token helpers shared by every consumer of {@link Cursor} trees.
 */
public final class Cursors {

    private Cursors() {
    }

    /**
     * All cursors of the subtree in pre-order, the root included, that satisfy the filter.
     */
    public static List<Cursor> descendants(Cursor root, Predicate<Cursor> filter) {
        List<Cursor> result = new ArrayList<>();
        collect(root, filter, result);
        return result;
    }

    private static void collect(Cursor node, Predicate<Cursor> filter, List<Cursor> result) {
        if (filter.test(node)) {
            result.add(node);
        }
        for (Cursor child : node.children()) {
            collect(child, filter, result);
        }
    }

    /**
     * Operator token of a binary or compound-assignment cursor: the first punctuator strictly
     * between the end of the left operand and the start of the right operand.
     */
    public static Optional<CursorToken> operatorToken(Cursor binary) {
        List<Cursor> operands = binary.children();
        if (operands.size() != 2) {
            return Optional.empty();
        }
        int leftEnd = operands.get(0).extent().endOffset();
        int rightStart = operands.get(1).extent().startOffset();
        for (CursorToken token : binary.tokens()) {
            if (token.startOffset() >= leftEnd && token.endOffset() <= rightStart
                    && token.kind() == LexTokenKind.PUNCTUATOR) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }

    public static String operatorSpelling(Cursor binary) {
        return operatorToken(binary).map(CursorToken::spelling).orElse("");
    }
}

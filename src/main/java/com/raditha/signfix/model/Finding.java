package com.raditha.signfix.model;

/**
 * A binary operation whose operands are integers of different signedness.
 *
 * @param function        name of the enclosing function
 * @param line            original source line (1-indexed)
 * @param operator        operator spelling
 * @param occurrenceIndex 1-based occurrence of the operator on the source line
 * @param leftText        source text of the left operand
 * @param leftType        type spelling of the left operand
 * @param rightText       source text of the right operand
 * @param rightType       type spelling of the right operand
 */
public record Finding(
        String function,
        int line,
        String operator,
        int occurrenceIndex,
        String leftText,
        String leftType,
        String rightText,
        String rightType) {

    /**
     * Build the fix request that resolves this finding.
     */
    public FixRequest toRequest(String reportId) {
        return new FixRequest(reportId, line, operator, occurrenceIndex);
    }
}

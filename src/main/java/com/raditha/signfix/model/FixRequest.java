package com.raditha.signfix.model;

/**
 * A single flagged operator to resolve.
 *
 * @param reportId          identifier of the report, echoed back in the result
 * @param lineNumber        line of the original source file (1-indexed)
 * @param operatorSpelling  operator as written, for example {@code "+"} or {@code "<="}
 * @param occurrenceIndex   1-based rank of the operator among its source-visible
 *                          occurrences on the line
 */
public record FixRequest(String reportId, int lineNumber, String operatorSpelling, int occurrenceIndex) {

    public FixRequest {
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be >= 1");
        }
        if (operatorSpelling == null || operatorSpelling.isBlank()) {
            throw new IllegalArgumentException("operatorSpelling cannot be empty");
        }
        operatorSpelling = operatorSpelling.trim();
        if (occurrenceIndex < 1) {
            occurrenceIndex = 1;
        }
    }
}

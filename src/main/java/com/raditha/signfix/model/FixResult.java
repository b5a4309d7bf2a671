package com.raditha.signfix.model;

import com.raditha.signfix.resolve.CastRecord;

import java.util.List;

/**
 * Outcome of resolving one {@link FixRequest}.
 *
 * @param reportId      identifier copied from the request
 * @param lineNumber    line copied from the request
 * @param success       true when a replacement line was produced
 * @param originalLine  the line as it is in the source file
 * @param rewrittenLine the replacement line, or null when nothing could be produced
 * @param message       explanation of the outcome
 * @param casts         casts that went into the rewritten line
 */
public record FixResult(
        String reportId,
        int lineNumber,
        boolean success,
        String originalLine,
        String rewrittenLine,
        String message,
        List<CastRecord> casts) {

    public FixResult {
        casts = casts == null ? List.of() : List.copyOf(casts);
    }

    public static FixResult failure(FixRequest request, String originalLine, String message) {
        return new FixResult(request.reportId(), request.lineNumber(), false, originalLine, null, message, List.of());
    }

    /**
     * Failure that still hands back the untouched line.
     */
    public static FixResult unchanged(FixRequest request, String originalLine, String message) {
        return new FixResult(request.reportId(), request.lineNumber(), false, originalLine, originalLine, message,
                List.of());
    }

    /**
     * True when the rewritten line differs from the original.
     */
    public boolean changed() {
        return success && rewrittenLine != null && !rewrittenLine.equals(originalLine);
    }
}

package com.raditha.signfix.locate;

import java.util.List;

/**
 * A macro use on a source line.
 *
 * @param name         macro name
 * @param sourceText   invocation as written, arguments included for function-like macros
 * @param start        0-based offset of the invocation on the source line
 * @param end          0-based offset after the invocation
 * @param functionLike true when the invocation has an argument list
 * @param expansion    expanded tokens the invocation stands for; empty when unknown
 */
public record MacroInvocation(String name, String sourceText, int start, int end, boolean functionLike,
                              List<String> expansion) {

    public MacroInvocation {
        expansion = List.copyOf(expansion);
    }

    public MacroInvocation withExpansion(List<String> tokens) {
        return new MacroInvocation(name, sourceText, start, end, functionLike, tokens);
    }

    public boolean within(int spanStart, int spanEnd) {
        return start >= spanStart && end <= spanEnd;
    }
}

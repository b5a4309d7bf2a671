package com.raditha.signfix.alias;

import java.util.List;

/**
 * A {@code #define} as written in the source.
 *
 * @param name       macro name
 * @param parameters parameter names of a function-like macro, null for an object-like macro
 * @param body       replacement text with comments removed
 * @param line       line of the {@code #define} (1-indexed)
 */
public record MacroDefinition(String name, List<String> parameters, String body, int line) {

    public MacroDefinition {
        parameters = parameters == null ? null : List.copyOf(parameters);
        body = body == null ? "" : body.trim();
    }

    public boolean isFunctionLike() {
        return parameters != null;
    }

    public boolean isVariadic() {
        return parameters != null && !parameters.isEmpty() && parameters.get(parameters.size() - 1).equals("...");
    }
}

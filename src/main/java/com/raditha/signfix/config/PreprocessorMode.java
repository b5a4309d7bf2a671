package com.raditha.signfix.config;

/**
 * Which preprocessor produces the expanded text a file is parsed from.
 */
public enum PreprocessorMode {
    /**
     * Built-in expander over the file's own macro definitions.
     */
    BUILTIN,

    /**
     * External command such as {@code clang -E}.
     */
    EXTERNAL;

    /**
     * Convert a string value to a mode.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding mode
     * @throws IllegalArgumentException if the value is not a valid mode
     */
    public static PreprocessorMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Preprocessor mode cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "builtin" -> BUILTIN;
            case "external" -> EXTERNAL;
            default -> throw new IllegalArgumentException(
                    "Invalid preprocessor mode: " + value + ". Must be: builtin or external");
        };
    }
}

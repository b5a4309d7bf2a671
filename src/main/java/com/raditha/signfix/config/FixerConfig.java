package com.raditha.signfix.config;

import java.util.List;

/**
 * Configuration for the signedness fixer.
 *
 * @param castOnTypeNameMismatch cast when operands agree in signedness but have different
 *                               type names
 * @param preprocessor           how the source is expanded before parsing
 * @param preprocessorCommand    command of the external preprocessor
 * @param compileArgs            extra arguments for the external preprocessor
 * @param resultFile             where {@code result.json} is written, null to skip it
 * @param diffContextLines       context lines of the diff preview
 * @param timeoutSeconds         limit for the external preprocessor
 */
public record FixerConfig(
        boolean castOnTypeNameMismatch,
        PreprocessorMode preprocessor,
        String preprocessorCommand,
        List<String> compileArgs,
        String resultFile,
        int diffContextLines,
        int timeoutSeconds) {

    public static final String DEFAULT_COMMAND = "clang -E";

    /**
     * Validate configuration.
     */
    public FixerConfig {
        if (preprocessor == null) {
            throw new IllegalArgumentException("preprocessor cannot be null");
        }
        if (preprocessorCommand == null || preprocessorCommand.isBlank()) {
            preprocessorCommand = DEFAULT_COMMAND;
        }
        compileArgs = compileArgs == null ? List.of() : List.copyOf(compileArgs);
        if (diffContextLines < 0) {
            throw new IllegalArgumentException("diffContextLines must be >= 0");
        }
        if (timeoutSeconds < 1) {
            throw new IllegalArgumentException("timeoutSeconds must be >= 1");
        }
    }

    /**
     * Default preset: signedness conflicts only, built-in preprocessor.
     */
    public static FixerConfig defaults() {
        return new FixerConfig(false, PreprocessorMode.BUILTIN, DEFAULT_COMMAND, List.of(), "result.json", 3, 60);
    }

    /**
     * Strict preset: also unify type names of operands with the same signedness.
     */
    public static FixerConfig strict() {
        return new FixerConfig(true, PreprocessorMode.BUILTIN, DEFAULT_COMMAND, List.of(), "result.json", 3, 60);
    }

    /**
     * Clang preset: the file is expanded by {@code clang -E}, so headers are honoured.
     */
    public static FixerConfig clang() {
        return new FixerConfig(false, PreprocessorMode.EXTERNAL, DEFAULT_COMMAND, List.of(), "result.json", 3, 60);
    }

    public FixerConfig withPreprocessor(PreprocessorMode mode) {
        return new FixerConfig(castOnTypeNameMismatch, mode, preprocessorCommand, compileArgs, resultFile,
                diffContextLines, timeoutSeconds);
    }
}

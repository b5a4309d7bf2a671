package com.raditha.signfix.preprocess;

import com.raditha.signfix.frontend.ParseFailureException;

import java.nio.file.Path;

/**
 * Turns a C source file into preprocessed text carrying {@code # <line> "<file>"} markers.
 */
public interface Preprocessor {

    PreprocessedSource preprocess(Path sourceFile) throws ParseFailureException;
}

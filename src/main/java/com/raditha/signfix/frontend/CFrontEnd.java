package com.raditha.signfix.frontend;

import com.raditha.signfix.preprocess.PreprocessedSource;

/**
 * A C parser producing a {@link TranslationUnit} from preprocessed text.
 */
public interface CFrontEnd {

    TranslationUnit parse(PreprocessedSource source) throws ParseFailureException;
}

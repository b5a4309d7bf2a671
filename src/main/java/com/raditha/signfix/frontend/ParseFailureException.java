package com.raditha.signfix.frontend;

/**
 * The source file could not be preprocessed or parsed. Fatal for the file being processed.
 */
public class ParseFailureException extends Exception {

    public ParseFailureException(String message) {
        super(message);
    }

    public ParseFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.raditha.signfix.locate;

/**
 * The requested operator occurrence could not be matched to an AST node.
 */
public class LocateException extends Exception {

    public LocateException(String message) {
        super(message);
    }
}

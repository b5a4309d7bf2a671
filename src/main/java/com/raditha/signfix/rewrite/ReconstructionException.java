package com.raditha.signfix.rewrite;

/**
 * Thrown when a rendered expression cannot be put back into its source line.
 */
public class ReconstructionException extends Exception {

    public ReconstructionException(String message) {
        super(message);
    }
}

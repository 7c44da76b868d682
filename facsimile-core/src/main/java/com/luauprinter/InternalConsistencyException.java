package com.luauprinter;

/**
 * Thrown when the printer or the concrete syntax tree find data that cannot
 * have come from a well-formed parse: a CST node of the wrong kind, a
 * separator list that is too short, or a node kind the printer does not know.
 */
public class InternalConsistencyException extends RuntimeException {

    public InternalConsistencyException(String message) {
        super(message);
    }
}

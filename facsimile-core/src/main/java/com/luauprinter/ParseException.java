package com.luauprinter;

import com.luauprinter.ast.SourceLocation;

/**
 * A syntax error. The parser stops at the first one.
 */
public class ParseException extends RuntimeException {

    private final SourceLocation location;

    public ParseException(String message, SourceLocation location) {
        super(message);
        this.location = location;
    }

    public SourceLocation location() {
        return location;
    }
}

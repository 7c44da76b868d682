package com.luauprinter;

import com.luauprinter.ast.SourceLocation;

public record ParseError(SourceLocation location, String message) {

    @Override
    public String toString() {
        return location + ": " + message;
    }
}

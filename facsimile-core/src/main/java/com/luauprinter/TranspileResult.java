package com.luauprinter;

import com.luauprinter.ast.SourceLocation;

/**
 * Printed source, or the location and message of the first parse error. A
 * failed result has empty {@code code}.
 */
public record TranspileResult(
    String code,
    SourceLocation errorLocation,  // Can be null
    String parseError              // Can be null
) {

    public static TranspileResult success(String code) {
        return new TranspileResult(code, null, null);
    }

    public static TranspileResult failure(ParseError error) {
        return new TranspileResult("", error.location(), error.message());
    }

    public boolean isSuccess() {
        return parseError == null;
    }
}

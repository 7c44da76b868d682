package com.luauprinter.cst;

import com.luauprinter.InternalConsistencyException;

/**
 * The spelling of a string constant: its source text between the delimiters,
 * the delimiters used, and for long brackets the number of {@code =} signs.
 */
public record CstConstantString(
    String sourceString,
    QuoteStyle quoteStyle,
    int depth
) implements CstNode {

    public CstConstantString {
        checkSpelling(sourceString, quoteStyle, depth);
    }

    static void checkSpelling(String sourceString, QuoteStyle quoteStyle, int depth) {
        if (sourceString == null || quoteStyle == null) {
            throw new InternalConsistencyException("string constant without text or quote style");
        }
        if (depth < 0) {
            throw new InternalConsistencyException("negative long bracket depth " + depth);
        }
        if (depth != 0 && quoteStyle != QuoteStyle.RAW) {
            throw new InternalConsistencyException(
                "long bracket depth " + depth + " on a " + quoteStyle + " quoted string");
        }
    }

    @Override
    public CstKind cstKind() {
        return CstKind.CONSTANT_STRING;
    }
}

package com.luauprinter;

/**
 * @param storeCstData whether the parser records formatting data for exact reproduction
 */
public record ParseOptions(boolean storeCstData) {

    public static ParseOptions defaults() {
        return new ParseOptions(true);
    }

    public static ParseOptions withoutCst() {
        return new ParseOptions(false);
    }
}

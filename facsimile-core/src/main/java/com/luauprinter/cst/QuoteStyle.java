package com.luauprinter.cst;

public enum QuoteStyle {
    SINGLE('\''),
    DOUBLE('"'),
    /** Long brackets, {@code [==[ ... ]==]}. */
    RAW('\0'),
    INTERP('`');

    private final char quote;

    QuoteStyle(char quote) {
        this.quote = quote;
    }

    public char quote() {
        return quote;
    }
}

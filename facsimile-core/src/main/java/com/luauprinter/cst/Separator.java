package com.luauprinter.cst;

public enum Separator {
    COMMA(","),
    SEMICOLON(";");

    private final String text;

    Separator(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }
}

package com.luauprinter.ast;

public enum UnaryOperator {
    NOT("not"),
    MINUS("-"),
    LEN("#");

    private final String text;

    UnaryOperator(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }
}

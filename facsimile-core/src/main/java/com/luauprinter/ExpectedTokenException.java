package com.luauprinter;

public class ExpectedTokenException extends ParseException {

    private final Token token;

    public ExpectedTokenException(String message, Token token) {
        super(message, token.location());
        this.token = token;
    }

    public Token token() {
        return token;
    }
}

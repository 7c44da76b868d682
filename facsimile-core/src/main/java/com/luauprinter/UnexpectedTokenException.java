package com.luauprinter;

public class UnexpectedTokenException extends ParseException {

    private final Token token;

    public UnexpectedTokenException(Token token, String context) {
        super("Unexpected " + token.describe() + " " + context, token.location());
        this.token = token;
    }

    public Token token() {
        return token;
    }
}

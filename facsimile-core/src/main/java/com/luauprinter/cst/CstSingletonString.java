package com.luauprinter.cst;

public record CstSingletonString(
    String sourceString,
    QuoteStyle quoteStyle,
    int depth
) implements CstNode {

    public CstSingletonString {
        CstConstantString.checkSpelling(sourceString, quoteStyle, depth);
    }

    @Override
    public CstKind cstKind() {
        return CstKind.SINGLETON_STRING;
    }
}

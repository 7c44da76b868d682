package com.luauprinter.ast;

public record TableItem(
    Kind itemKind,
    Expression key,    // Null for LIST items
    Expression value
) {

    public enum Kind {
        /** {@code value} */
        LIST,
        /** {@code name = value}, the key is a {@link StringExpression} */
        RECORD,
        /** {@code [key] = value} */
        GENERAL
    }
}

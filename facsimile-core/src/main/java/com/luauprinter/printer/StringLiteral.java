package com.luauprinter.printer;

import com.luauprinter.cst.CstConstantString;
import com.luauprinter.cst.CstSingletonString;
import com.luauprinter.cst.QuoteStyle;

/**
 * How a string constant is spelled: verbatim from the source, or quoted and
 * escaped from its value.
 */
public record StringLiteral(String text, QuoteStyle quoteStyle, int depth, boolean verbatim) {

    public static StringLiteral canonical(String value) {
        return new StringLiteral(value, null, 0, false);
    }

    public static StringLiteral of(CstConstantString cst) {
        return new StringLiteral(cst.sourceString(), cst.quoteStyle(), cst.depth(), true);
    }

    public static StringLiteral of(CstSingletonString cst) {
        return new StringLiteral(cst.sourceString(), cst.quoteStyle(), cst.depth(), true);
    }

    public void writeTo(SourceWriter writer) {
        if (verbatim) {
            writer.sourceString(text, quoteStyle, depth);
        } else {
            writer.string(text);
        }
    }
}

package com.luauprinter.cst;

import com.luauprinter.InternalConsistencyException;

/**
 * The literal text of a number constant, e.g. {@code 0xFF} or {@code 1_000}.
 */
public record CstConstantNumber(
    String text
) implements CstNode {

    public CstConstantNumber {
        if (text == null || text.isEmpty()) {
            throw new InternalConsistencyException("number constant without text");
        }
    }

    @Override
    public CstKind cstKind() {
        return CstKind.CONSTANT_NUMBER;
    }
}

package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

/**
 * Position of a unary or binary operator token.
 */
public record CstOperator(
    Position opPosition
) implements CstNode {

    @Override
    public CstKind cstKind() {
        return CstKind.OPERATOR;
    }
}

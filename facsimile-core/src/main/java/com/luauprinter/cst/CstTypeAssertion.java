package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

public record CstTypeAssertion(
    Position opPosition
) implements CstNode {

    @Override
    public CstKind cstKind() {
        return CstKind.TYPE_ASSERTION;
    }
}

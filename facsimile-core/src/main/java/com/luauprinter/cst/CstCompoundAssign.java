package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

public record CstCompoundAssign(
    Position opPosition
) implements CstNode {

    @Override
    public CstKind cstKind() {
        return CstKind.COMPOUND_ASSIGN;
    }
}

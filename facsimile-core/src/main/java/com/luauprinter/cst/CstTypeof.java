package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

public record CstTypeof(
    Position openPosition,
    Position closePosition
) implements CstNode {

    @Override
    public CstKind cstKind() {
        return CstKind.TYPEOF;
    }
}

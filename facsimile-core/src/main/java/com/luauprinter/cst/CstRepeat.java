package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

public record CstRepeat(
    Position untilPosition
) implements CstNode {

    @Override
    public CstKind cstKind() {
        return CstKind.REPEAT;
    }
}

package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

public record CstDo(
    Position endPosition
) implements CstNode {

    @Override
    public CstKind cstKind() {
        return CstKind.DO;
    }
}

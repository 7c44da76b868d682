package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

public record CstTypeFunction(
    Position typeKeywordPosition,
    Position functionKeywordPosition
) implements CstNode {

    @Override
    public CstKind cstKind() {
        return CstKind.TYPE_FUNCTION;
    }
}

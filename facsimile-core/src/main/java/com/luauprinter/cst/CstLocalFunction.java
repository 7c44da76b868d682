package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

public record CstLocalFunction(
    Position functionKeywordPosition
) implements CstNode {

    @Override
    public CstKind cstKind() {
        return CstKind.LOCAL_FUNCTION;
    }
}

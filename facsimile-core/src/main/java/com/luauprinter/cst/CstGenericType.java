package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

public record CstGenericType(
    Position defaultEqualsPosition  // Can be null
) implements CstNode {

    @Override
    public CstKind cstKind() {
        return CstKind.GENERIC_TYPE;
    }
}

package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

public record CstGenericTypePackReference(
    Position ellipsisPosition
) implements CstNode {

    @Override
    public CstKind cstKind() {
        return CstKind.GENERIC_TYPE_PACK_REFERENCE;
    }
}

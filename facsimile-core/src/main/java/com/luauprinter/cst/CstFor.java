package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

public record CstFor(
    Position annotationColonPosition,  // Can be null
    Position equalsPosition,
    Position endCommaPosition,
    Position stepCommaPosition        // Can be null
) implements CstNode {

    @Override
    public CstKind cstKind() {
        return CstKind.FOR;
    }
}

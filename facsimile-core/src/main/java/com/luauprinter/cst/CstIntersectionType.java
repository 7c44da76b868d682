package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

import java.util.List;

public record CstIntersectionType(
    Position leadingPosition,  // Can be null
    List<Position> separatorPositions
) implements CstNode {

    public CstIntersectionType {
        separatorPositions = CstLists.copy(separatorPositions, "separatorPositions");
    }

    @Override
    public CstKind cstKind() {
        return CstKind.INTERSECTION_TYPE;
    }
}

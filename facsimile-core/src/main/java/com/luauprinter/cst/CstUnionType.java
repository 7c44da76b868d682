package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

import java.util.List;

/**
 * Separator positions of a union. {@code ?} members have no separator.
 */
public record CstUnionType(
    Position leadingPosition,  // Can be null
    List<Position> separatorPositions
) implements CstNode {

    public CstUnionType {
        separatorPositions = CstLists.copy(separatorPositions, "separatorPositions");
    }

    @Override
    public CstKind cstKind() {
        return CstKind.UNION_TYPE;
    }
}

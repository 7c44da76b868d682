package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

import java.util.List;

public record CstTypeAlias(
    Position typeKeywordPosition,
    Position genericsOpenPosition,   // Can be null
    List<Position> genericsCommaPositions,
    Position genericsClosePosition,  // Can be null
    Position equalsPosition
) implements CstNode {

    public CstTypeAlias {
        genericsCommaPositions = CstLists.copy(genericsCommaPositions, "genericsCommaPositions");
    }

    @Override
    public CstKind cstKind() {
        return CstKind.TYPE_ALIAS;
    }
}

package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

import java.util.List;

public record CstAssign(
    List<Position> varsCommaPositions,
    Position equalsPosition,
    List<Position> valuesCommaPositions
) implements CstNode {

    public CstAssign {
        varsCommaPositions = CstLists.copy(varsCommaPositions, "varsCommaPositions");
        valuesCommaPositions = CstLists.copy(valuesCommaPositions, "valuesCommaPositions");
    }

    @Override
    public CstKind cstKind() {
        return CstKind.ASSIGN;
    }
}

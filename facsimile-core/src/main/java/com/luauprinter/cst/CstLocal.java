package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

import java.util.List;

public record CstLocal(
    List<Position> varsAnnotationColonPositions,
    List<Position> varsCommaPositions,
    List<Position> valuesCommaPositions
) implements CstNode {

    public CstLocal {
        varsAnnotationColonPositions = CstLists.copy(varsAnnotationColonPositions, "varsAnnotationColonPositions");
        varsCommaPositions = CstLists.copy(varsCommaPositions, "varsCommaPositions");
        valuesCommaPositions = CstLists.copy(valuesCommaPositions, "valuesCommaPositions");
    }

    @Override
    public CstKind cstKind() {
        return CstKind.LOCAL;
    }
}

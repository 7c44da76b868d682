package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

import java.util.List;

public record CstTypeReference(
    Position prefixPointPosition,          // Can be null
    Position openParametersPosition,       // Can be null
    List<Position> parametersCommaPositions,
    Position closeParametersPosition       // Can be null
) implements CstNode {

    public CstTypeReference {
        parametersCommaPositions = CstLists.copy(parametersCommaPositions, "parametersCommaPositions");
    }

    @Override
    public CstKind cstKind() {
        return CstKind.TYPE_REFERENCE;
    }
}

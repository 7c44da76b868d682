package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

import java.util.List;

public record CstReturn(
    List<Position> commaPositions
) implements CstNode {

    public CstReturn {
        commaPositions = CstLists.copy(commaPositions, "commaPositions");
    }

    @Override
    public CstKind cstKind() {
        return CstKind.RETURN;
    }
}

package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

import java.util.List;

public record CstFunctionType(
    Position openGenericsPosition,           // Can be null
    List<Position> genericsCommaPositions,
    Position closeGenericsPosition,          // Can be null
    Position openArgsPosition,
    List<Position> argumentNameColonPositions,
    List<Position> argumentsCommaPositions,
    Position closeArgsPosition,
    Position returnArrowPosition
) implements CstNode {

    public CstFunctionType {
        genericsCommaPositions = CstLists.copy(genericsCommaPositions, "genericsCommaPositions");
        argumentNameColonPositions = CstLists.copy(argumentNameColonPositions, "argumentNameColonPositions");
        argumentsCommaPositions = CstLists.copy(argumentsCommaPositions, "argumentsCommaPositions");
    }

    @Override
    public CstKind cstKind() {
        return CstKind.FUNCTION_TYPE;
    }
}

package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

import java.util.List;

/**
 * Punctuation of a function body, from the generic list to the return type
 * colon. {@code argsAnnotationColonPositions} has one entry per argument, null
 * where the argument has no annotation.
 */
public record CstFunction(
    Position openGenericsPosition,             // Can be null
    List<Position> genericsCommaPositions,
    Position closeGenericsPosition,            // Can be null
    Position openParensPosition,
    List<Position> argsAnnotationColonPositions,
    List<Position> argsCommaPositions,
    Position varargAnnotationColonPosition,    // Can be null
    Position closeParensPosition,
    Position returnSpecifierPosition           // Can be null
) implements CstNode {

    public CstFunction {
        genericsCommaPositions = CstLists.copy(genericsCommaPositions, "genericsCommaPositions");
        argsAnnotationColonPositions = CstLists.copy(argsAnnotationColonPositions, "argsAnnotationColonPositions");
        argsCommaPositions = CstLists.copy(argsCommaPositions, "argsCommaPositions");
    }

    @Override
    public CstKind cstKind() {
        return CstKind.FUNCTION;
    }
}

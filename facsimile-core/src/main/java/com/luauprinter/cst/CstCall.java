package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

import java.util.List;

/**
 * Parenthesis and comma positions of a call. Both parentheses are null for the
 * {@code f"s"} and {@code f{...}} call forms.
 */
public record CstCall(
    Position openParensPosition,   // Can be null
    Position closeParensPosition,  // Can be null
    List<Position> commaPositions
) implements CstNode {

    public CstCall {
        commaPositions = CstLists.copy(commaPositions, "commaPositions");
    }

    @Override
    public CstKind cstKind() {
        return CstKind.CALL;
    }
}

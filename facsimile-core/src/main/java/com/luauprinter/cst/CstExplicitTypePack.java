package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

import java.util.List;

/**
 * Punctuation of an explicit type pack. The parentheses are null when the
 * pack was written without them, as in a single return type.
 */
public record CstExplicitTypePack(
    Position openParenthesesPosition,   // Can be null
    List<Position> commaPositions,
    Position closeParenthesesPosition   // Can be null
) implements CstNode {

    public CstExplicitTypePack {
        commaPositions = CstLists.copy(commaPositions, "commaPositions");
    }

    @Override
    public CstKind cstKind() {
        return CstKind.EXPLICIT_TYPE_PACK;
    }
}

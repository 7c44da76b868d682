package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

public record CstIndexExpression(
    Position openBracketPosition,
    Position closeBracketPosition
) implements CstNode {

    @Override
    public CstKind cstKind() {
        return CstKind.INDEX_EXPRESSION;
    }
}

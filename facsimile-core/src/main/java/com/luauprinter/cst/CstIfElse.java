package com.luauprinter.cst;

import com.luauprinter.ast.SourceLocation.Position;

/**
 * Keyword positions of an if-expression. When {@code elseIf} is true the
 * {@code else} position is that of an {@code elseif} keyword, and the nested
 * false branch is itself an if-expression.
 */
public record CstIfElse(
    Position thenPosition,
    Position elsePosition,
    boolean elseIf
) implements CstNode {

    @Override
    public CstKind cstKind() {
        return CstKind.IF_ELSE;
    }
}

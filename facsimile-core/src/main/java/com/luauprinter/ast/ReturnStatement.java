package com.luauprinter.ast;

import java.util.List;

public record ReturnStatement(
    SourceLocation location,
    List<Expression> list,
    boolean hasSemicolon
) implements Statement {
}

package com.luauprinter.ast;

import java.util.List;

public record AssignStatement(
    SourceLocation location,
    List<Expression> vars,
    List<Expression> values,
    boolean hasSemicolon
) implements Statement {
}

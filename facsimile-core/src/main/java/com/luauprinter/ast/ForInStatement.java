package com.luauprinter.ast;

import java.util.List;

public record ForInStatement(
    SourceLocation location,
    List<Local> vars,
    List<Expression> values,
    Block body,
    SourceLocation inLocation,
    SourceLocation doLocation,
    boolean hasSemicolon
) implements Statement {
}

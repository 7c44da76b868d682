package com.luauprinter.ast;

import java.util.List;

public record LocalStatement(
    SourceLocation location,
    List<Local> vars,
    List<Expression> values,
    SourceLocation equalsSignLocation,  // Can be null
    boolean hasSemicolon
) implements Statement {
}

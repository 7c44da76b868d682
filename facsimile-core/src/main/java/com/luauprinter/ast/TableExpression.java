package com.luauprinter.ast;

import java.util.List;

public record TableExpression(
    SourceLocation location,
    List<TableItem> items
) implements Expression {
}

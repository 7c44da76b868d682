package com.luauprinter.ast;

import java.util.List;

public record TableType(
    SourceLocation location,
    List<TableProperty> props,
    TableIndexer indexer  // Can be null
) implements TypeAnnotation {
}

package com.luauprinter.ast;

public record TableIndexer(
    SourceLocation location,
    TypeAnnotation indexType,
    TypeAnnotation resultType
) {
}

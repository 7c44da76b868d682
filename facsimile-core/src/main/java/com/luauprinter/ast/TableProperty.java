package com.luauprinter.ast;

public record TableProperty(
    String name,
    SourceLocation location,
    TypeAnnotation type
) {
}

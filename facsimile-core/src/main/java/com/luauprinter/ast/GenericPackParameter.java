package com.luauprinter.ast;

public record GenericPackParameter(
    SourceLocation location,
    String name,
    TypePack defaultValue  // Can be null
) implements Node {
}

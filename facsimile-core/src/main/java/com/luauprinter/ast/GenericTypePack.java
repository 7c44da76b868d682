package com.luauprinter.ast;

public record GenericTypePack(
    SourceLocation location,
    String genericName
) implements TypePack {
}

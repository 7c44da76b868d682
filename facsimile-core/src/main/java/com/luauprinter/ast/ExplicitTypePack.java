package com.luauprinter.ast;

public record ExplicitTypePack(
    SourceLocation location,
    TypeList typeList
) implements TypePack {
}

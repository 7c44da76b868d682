package com.luauprinter.ast;

public record VariadicTypePack(
    SourceLocation location,
    TypeAnnotation variadicType
) implements TypePack {
}

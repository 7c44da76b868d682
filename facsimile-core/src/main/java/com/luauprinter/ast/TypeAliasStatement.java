package com.luauprinter.ast;

import java.util.List;

public record TypeAliasStatement(
    SourceLocation location,
    String name,
    SourceLocation nameLocation,
    List<GenericTypeParameter> generics,
    List<GenericPackParameter> genericPacks,
    TypeAnnotation type,
    boolean exported,
    boolean hasSemicolon
) implements Statement {
}

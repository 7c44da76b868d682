package com.luauprinter.ast;

import java.util.List;

/**
 * A function type {@code <T>(a: T, ...number) -> R}. {@code argNames} has one
 * entry per argument type; entries are null for unnamed arguments.
 */
public record FunctionType(
    SourceLocation location,
    List<GenericTypeParameter> generics,
    List<GenericPackParameter> genericPacks,
    TypeList argTypes,
    List<ArgumentName> argNames,
    TypePack returnTypes
) implements TypeAnnotation {
}

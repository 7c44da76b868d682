package com.luauprinter.ast;

import java.util.List;

/**
 * An anonymous function. Function statements, local functions, and type
 * functions wrap one of these.
 */
public record FunctionExpression(
    SourceLocation location,
    List<GenericTypeParameter> generics,
    List<GenericPackParameter> genericPacks,
    Local self,                      // Can be null
    List<Local> args,
    TypePack returnAnnotation,       // Can be null
    boolean vararg,
    SourceLocation varargLocation,   // Can be null
    TypePack varargAnnotation,       // Can be null
    Block body,
    String debugName                 // Can be null
) implements Expression {
}

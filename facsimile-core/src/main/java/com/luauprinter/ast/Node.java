package com.luauprinter.ast;

/**
 * Base interface for all Luau AST nodes.
 *
 * <p>Nodes are immutable. Node identity (not {@code equals}) is what the
 * concrete syntax tree map is keyed on, so two structurally equal nodes at the
 * same location still carry independent formatting data.</p>
 */
public sealed interface Node permits
    Expression,
    Statement,
    TypeAnnotation,
    TypePack,
    GenericTypeParameter,
    GenericPackParameter {

    SourceLocation location();

    default String kind() {
        return getClass().getSimpleName();
    }
}

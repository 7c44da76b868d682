package com.luauprinter.ast;

/**
 * The {@code ?} suffix of an optional type; appears as a member of a
 * {@link UnionType}.
 */
public record OptionalType(SourceLocation location) implements TypeAnnotation {
}

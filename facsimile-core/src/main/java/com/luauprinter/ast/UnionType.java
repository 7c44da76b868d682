package com.luauprinter.ast;

import java.util.List;

public record UnionType(
    SourceLocation location,
    List<TypeAnnotation> types
) implements TypeAnnotation {
}

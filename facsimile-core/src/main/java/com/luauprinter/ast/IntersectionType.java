package com.luauprinter.ast;

import java.util.List;

public record IntersectionType(
    SourceLocation location,
    List<TypeAnnotation> types
) implements TypeAnnotation {
}

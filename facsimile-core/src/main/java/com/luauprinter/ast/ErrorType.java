package com.luauprinter.ast;

import java.util.List;

public record ErrorType(
    SourceLocation location,
    List<TypeAnnotation> types,
    int messageIndex
) implements TypeAnnotation {
}

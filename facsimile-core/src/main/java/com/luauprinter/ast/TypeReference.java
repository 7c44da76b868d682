package com.luauprinter.ast;

import java.util.List;

public record TypeReference(
    SourceLocation location,
    String prefix,                    // Can be null
    SourceLocation prefixLocation,    // Can be null
    String name,
    SourceLocation nameLocation,
    boolean hasParameterList,
    List<TypeParameter> parameters
) implements TypeAnnotation {
}

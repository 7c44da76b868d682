package com.luauprinter.ast;

import java.util.List;

public record TypeList(
    List<TypeAnnotation> types,
    TypePack tailType  // Can be null
) {
}

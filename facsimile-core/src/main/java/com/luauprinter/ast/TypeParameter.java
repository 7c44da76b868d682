package com.luauprinter.ast;

/**
 * One argument of a type reference's parameter list. Exactly one of the
 * components is set.
 */
public record TypeParameter(
    TypeAnnotation type,   // Can be null
    TypePack typePack      // Can be null
) {
}

package com.luauprinter.ast;

public sealed interface TypePack extends Node permits
    ExplicitTypePack,
    VariadicTypePack,
    GenericTypePack {
}

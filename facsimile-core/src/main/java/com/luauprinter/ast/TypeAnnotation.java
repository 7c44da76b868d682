package com.luauprinter.ast;

public sealed interface TypeAnnotation extends Node permits
    TypeReference,
    FunctionType,
    TableType,
    TypeofType,
    UnionType,
    IntersectionType,
    OptionalType,
    GroupType,
    SingletonBoolType,
    SingletonStringType,
    ErrorType {
}

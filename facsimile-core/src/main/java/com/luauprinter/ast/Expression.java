package com.luauprinter.ast;

public sealed interface Expression extends Node permits
    GroupExpression,
    NilExpression,
    BooleanExpression,
    NumberExpression,
    StringExpression,
    LocalExpression,
    GlobalExpression,
    VarargsExpression,
    CallExpression,
    IndexNameExpression,
    IndexExpression,
    FunctionExpression,
    TableExpression,
    UnaryExpression,
    BinaryExpression,
    TypeAssertionExpression,
    IfElseExpression,
    InterpStringExpression,
    ErrorExpression {
}

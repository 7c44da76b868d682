package com.luauprinter.ast;

public sealed interface Statement extends Node permits
    Block,
    IfStatement,
    WhileStatement,
    RepeatStatement,
    BreakStatement,
    ContinueStatement,
    ReturnStatement,
    ExpressionStatement,
    LocalStatement,
    ForStatement,
    ForInStatement,
    AssignStatement,
    CompoundAssignStatement,
    FunctionStatement,
    LocalFunctionStatement,
    TypeAliasStatement,
    TypeFunctionStatement,
    ErrorStatement {

    /**
     * Whether the statement was followed by a {@code ;} in the source.
     */
    boolean hasSemicolon();
}

package com.luauprinter.cst;

import java.util.Optional;

/**
 * Formatting data for one AST node: the positions of tokens and the spelling
 * choices that the abstract syntax tree does not keep.
 */
public sealed interface CstNode permits
    CstConstantNumber,
    CstConstantString,
    CstCall,
    CstIndexExpression,
    CstFunction,
    CstTable,
    CstOperator,
    CstTypeAssertion,
    CstIfElse,
    CstInterpString,
    CstDo,
    CstRepeat,
    CstReturn,
    CstLocal,
    CstFor,
    CstForIn,
    CstAssign,
    CstCompoundAssign,
    CstLocalFunction,
    CstTypeAlias,
    CstTypeFunction,
    CstGenericType,
    CstGenericTypePack,
    CstTypeReference,
    CstFunctionType,
    CstTableType,
    CstTypeof,
    CstUnionType,
    CstIntersectionType,
    CstSingletonString,
    CstExplicitTypePack,
    CstGenericTypePackReference {

    CstKind cstKind();

    /**
     * Returns this node as {@code type} if its tag says it is one.
     */
    default <T extends CstNode> Optional<T> as(Class<T> type) {
        if (cstKind().nodeClass() != type) {
            return Optional.empty();
        }
        return Optional.of(type.cast(this));
    }
}

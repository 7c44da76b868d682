package com.luauprinter.cst;

import com.luauprinter.ast.BinaryExpression;
import com.luauprinter.ast.Block;
import com.luauprinter.ast.AssignStatement;
import com.luauprinter.ast.CallExpression;
import com.luauprinter.ast.CompoundAssignStatement;
import com.luauprinter.ast.ExplicitTypePack;
import com.luauprinter.ast.ForInStatement;
import com.luauprinter.ast.ForStatement;
import com.luauprinter.ast.FunctionExpression;
import com.luauprinter.ast.FunctionType;
import com.luauprinter.ast.GenericPackParameter;
import com.luauprinter.ast.GenericTypePack;
import com.luauprinter.ast.GenericTypeParameter;
import com.luauprinter.ast.IfElseExpression;
import com.luauprinter.ast.IndexExpression;
import com.luauprinter.ast.InterpStringExpression;
import com.luauprinter.ast.IntersectionType;
import com.luauprinter.ast.LocalFunctionStatement;
import com.luauprinter.ast.LocalStatement;
import com.luauprinter.ast.Node;
import com.luauprinter.ast.NumberExpression;
import com.luauprinter.ast.RepeatStatement;
import com.luauprinter.ast.ReturnStatement;
import com.luauprinter.ast.SingletonStringType;
import com.luauprinter.ast.StringExpression;
import com.luauprinter.ast.TableExpression;
import com.luauprinter.ast.TableType;
import com.luauprinter.ast.TypeAliasStatement;
import com.luauprinter.ast.TypeAssertionExpression;
import com.luauprinter.ast.TypeFunctionStatement;
import com.luauprinter.ast.TypeReference;
import com.luauprinter.ast.TypeofType;
import com.luauprinter.ast.UnaryExpression;
import com.luauprinter.ast.UnionType;

import java.util.Set;

/**
 * Tag of every concrete syntax tree node, together with the record class that
 * carries it and the AST node classes it may decorate.
 */
public enum CstKind {
    CONSTANT_NUMBER(CstConstantNumber.class, NumberExpression.class),
    CONSTANT_STRING(CstConstantString.class, StringExpression.class),
    CALL(CstCall.class, CallExpression.class),
    INDEX_EXPRESSION(CstIndexExpression.class, IndexExpression.class),
    FUNCTION(CstFunction.class, FunctionExpression.class),
    TABLE(CstTable.class, TableExpression.class),
    OPERATOR(CstOperator.class, UnaryExpression.class, BinaryExpression.class),
    TYPE_ASSERTION(CstTypeAssertion.class, TypeAssertionExpression.class),
    IF_ELSE(CstIfElse.class, IfElseExpression.class),
    INTERP_STRING(CstInterpString.class, InterpStringExpression.class),
    DO(CstDo.class, Block.class),
    REPEAT(CstRepeat.class, RepeatStatement.class),
    RETURN(CstReturn.class, ReturnStatement.class),
    LOCAL(CstLocal.class, LocalStatement.class),
    FOR(CstFor.class, ForStatement.class),
    FOR_IN(CstForIn.class, ForInStatement.class),
    ASSIGN(CstAssign.class, AssignStatement.class),
    COMPOUND_ASSIGN(CstCompoundAssign.class, CompoundAssignStatement.class),
    LOCAL_FUNCTION(CstLocalFunction.class, LocalFunctionStatement.class),
    TYPE_ALIAS(CstTypeAlias.class, TypeAliasStatement.class),
    TYPE_FUNCTION(CstTypeFunction.class, TypeFunctionStatement.class),
    GENERIC_TYPE(CstGenericType.class, GenericTypeParameter.class),
    GENERIC_TYPE_PACK(CstGenericTypePack.class, GenericPackParameter.class),
    TYPE_REFERENCE(CstTypeReference.class, TypeReference.class),
    FUNCTION_TYPE(CstFunctionType.class, FunctionType.class),
    TABLE_TYPE(CstTableType.class, TableType.class),
    TYPEOF(CstTypeof.class, TypeofType.class),
    UNION_TYPE(CstUnionType.class, UnionType.class),
    INTERSECTION_TYPE(CstIntersectionType.class, IntersectionType.class),
    SINGLETON_STRING(CstSingletonString.class, SingletonStringType.class),
    EXPLICIT_TYPE_PACK(CstExplicitTypePack.class, ExplicitTypePack.class),
    GENERIC_TYPE_PACK_REFERENCE(CstGenericTypePackReference.class, GenericTypePack.class);

    private final Class<? extends CstNode> nodeClass;
    private final Set<Class<? extends Node>> decorates;

    @SafeVarargs
    CstKind(Class<? extends CstNode> nodeClass, Class<? extends Node>... decorates) {
        this.nodeClass = nodeClass;
        this.decorates = Set.of(decorates);
    }

    public Class<? extends CstNode> nodeClass() {
        return nodeClass;
    }

    public boolean canDecorate(Node node) {
        return decorates.contains(node.getClass());
    }
}

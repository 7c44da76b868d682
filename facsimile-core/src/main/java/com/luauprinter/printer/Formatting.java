package com.luauprinter.printer;

import com.luauprinter.ast.AssignStatement;
import com.luauprinter.ast.BinaryExpression;
import com.luauprinter.ast.Block;
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
import com.luauprinter.ast.IndexNameExpression;
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
import com.luauprinter.ast.TypeAnnotation;
import com.luauprinter.ast.TypeAssertionExpression;
import com.luauprinter.ast.TypeFunctionStatement;
import com.luauprinter.ast.TypeReference;
import com.luauprinter.ast.TypeofType;
import com.luauprinter.ast.UnaryExpression;
import com.luauprinter.ast.UnionType;
import com.luauprinter.cst.CstTableType;

import java.util.List;

/**
 * Source of every layout decision the {@link Printer} cannot derive from the
 * AST alone: where punctuation and keywords go, and how constants are spelled.
 *
 * <p>{@link ExactFormatting} answers from recorded source positions and
 * {@link CanonicalFormatting} answers with default spacing. The printer walks
 * the tree the same way for both.</p>
 *
 * <p>Layouts hold {@link Separators}, which are stateful; ask for a fresh
 * layout every time a node is printed.</p>
 */
public interface Formatting {

    // ========================================================================
    // Expressions
    // ========================================================================

    String number(NumberExpression node);

    StringLiteral string(StringExpression node);

    CallLayout call(CallExpression node);

    IndexNameLayout indexName(IndexNameExpression node);

    Brackets index(IndexExpression node);

    /**
     * Anchor of the last character of a group expression, group type or table
     * type: its closing parenthesis or brace.
     */
    Anchor closingBracket(Node node);

    FunctionLayout function(FunctionExpression node);

    /**
     * One layout per table item, in item order.
     */
    List<TableItemLayout> table(TableExpression node);

    Anchor unaryOperator(UnaryExpression node);

    OperatorLayout binaryOperator(BinaryExpression node);

    Anchor typeAssertion(TypeAssertionExpression node);

    IfElseLayout ifElse(IfElseExpression node);

    InterpLayout interpString(InterpStringExpression node);

    // ========================================================================
    // Statements
    // ========================================================================

    /**
     * Anchor of the {@code end} that closes a {@code do} block.
     */
    Anchor doEnd(Block block);

    Anchor until(RepeatStatement node);

    Separators returnCommas(ReturnStatement node);

    BindingLayout local(LocalStatement node);

    ForLayout forLoop(ForStatement node);

    BindingLayout forIn(ForInStatement node);

    AssignLayout assign(AssignStatement node);

    Anchor compoundOperator(CompoundAssignStatement node);

    Anchor localFunctionKeyword(LocalFunctionStatement node);

    TypeAliasLayout typeAlias(TypeAliasStatement node);

    TypeFunctionLayout typeFunction(TypeFunctionStatement node);

    Anchor genericDefault(GenericTypeParameter node);

    GenericPackLayout genericPack(GenericPackParameter node);

    // ========================================================================
    // Types
    // ========================================================================

    TypeReferenceLayout typeReference(TypeReference node);

    FunctionTypeLayout functionType(FunctionType node);

    TableTypeLayout tableType(TableType node);

    Brackets typeof(TypeofType node);

    UnionLayout union(UnionType node);

    IntersectionLayout intersection(IntersectionType node);

    StringLiteral singletonString(SingletonStringType node);

    /**
     * @param parenthesize whether a pack with exactly one type is parenthesized
     *                     when nothing was recorded for it
     */
    PackLayout explicitPack(ExplicitTypePack node, boolean parenthesize);

    Anchor genericPackEllipsis(GenericTypePack node);

    // ========================================================================
    // Layouts
    // ========================================================================

    record Brackets(Anchor open, Anchor close) {
    }

    record CallLayout(Anchor open, Separators commas, Anchor close) {
    }

    record IndexNameLayout(Anchor op, Anchor name) {
    }

    record GenericsLayout(Anchor open, Separators commas, Anchor close) {
    }

    /**
     * @param argColons one anchor per argument, for its annotation colon
     * @param returnType anchor of the return type after its colon
     */
    record FunctionLayout(
        GenericsLayout generics,
        Anchor openParens,
        Separators argCommas,
        List<Anchor> argColons,
        Anchor varargColon,
        Anchor closeParens,
        Anchor returnColon,
        Anchor returnType
    ) {
    }

    /**
     * @param separator text of the separator after the item, null if none
     */
    record TableItemLayout(
        Anchor indexerOpen,
        Anchor indexerClose,
        Anchor equalsSign,
        String separator,
        Anchor separatorAnchor
    ) {
    }

    /**
     * @param keyword whether the operator is written as a keyword, which keeps
     *                it apart from a preceding identifier
     */
    record OperatorLayout(Anchor anchor, boolean keyword) {
    }

    /**
     * @param elseIf whether the false branch is a nested if-expression written
     *               with {@code elseif}
     */
    record IfElseLayout(Anchor then, Anchor elseKeyword, boolean elseIf) {
    }

    /**
     * @param segments text written between the delimiters, already escaped
     * @param anchors  anchor of each segment's opening delimiter
     */
    record InterpLayout(List<String> segments, List<Anchor> anchors) {
    }

    record BindingLayout(List<Anchor> colons, Separators varCommas, Separators valueCommas) {
    }

    record ForLayout(Anchor colon, Anchor equalsSign, Anchor endComma, Anchor stepComma) {
    }

    record AssignLayout(Separators varCommas, Anchor equalsSign, Separators valueCommas) {
    }

    record TypeAliasLayout(Anchor typeKeyword, GenericsLayout generics, Anchor equalsSign) {
    }

    record TypeFunctionLayout(Anchor typeKeyword, Anchor functionKeyword) {
    }

    record GenericPackLayout(Anchor ellipsis, Anchor equalsSign) {
    }

    record TypeReferenceLayout(Anchor prefixPoint, Anchor open, Separators commas, Anchor close) {
    }

    /**
     * @param nameColons one anchor per argument type, for the colon after its name
     */
    record FunctionTypeLayout(
        GenericsLayout generics,
        Anchor openArgs,
        List<Anchor> nameColons,
        Separators argCommas,
        Anchor closeArgs,
        Anchor arrow
    ) {
    }

    /**
     * @param array whether to print the {@code {T}} shorthand
     * @param items properties and indexer in print order
     */
    record TableTypeLayout(boolean array, List<TableTypeItemLayout> items) {
    }

    /**
     * @param key     anchor of a string property's key
     * @param keyText spelling of a string property's key
     */
    record TableTypeItemLayout(
        CstTableType.Item.Kind itemKind,
        Anchor indexerOpen,
        Anchor key,
        StringLiteral keyText,
        Anchor indexerClose,
        Anchor colon,
        String separator,
        Anchor separatorAnchor
    ) {
    }

    /**
     * @param optionalOf when set, the union is printed as this type followed by {@code ?}
     * @param wrap       whether function and intersection members are parenthesized
     */
    record UnionLayout(Anchor leading, Separators separators, boolean wrap, TypeAnnotation optionalOf) {
    }

    record IntersectionLayout(Anchor leading, Separators separators, boolean wrap) {
    }

    record PackLayout(Anchor open, Separators commas, Anchor close) {
    }
}

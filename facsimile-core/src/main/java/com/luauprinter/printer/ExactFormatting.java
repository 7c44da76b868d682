package com.luauprinter.printer;

import com.luauprinter.InternalConsistencyException;
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
import com.luauprinter.ast.SourceLocation.Position;
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
import com.luauprinter.cst.CstAssign;
import com.luauprinter.cst.CstCall;
import com.luauprinter.cst.CstCompoundAssign;
import com.luauprinter.cst.CstConstantNumber;
import com.luauprinter.cst.CstConstantString;
import com.luauprinter.cst.CstDo;
import com.luauprinter.cst.CstExplicitTypePack;
import com.luauprinter.cst.CstFor;
import com.luauprinter.cst.CstForIn;
import com.luauprinter.cst.CstFunction;
import com.luauprinter.cst.CstFunctionType;
import com.luauprinter.cst.CstGenericType;
import com.luauprinter.cst.CstGenericTypePack;
import com.luauprinter.cst.CstGenericTypePackReference;
import com.luauprinter.cst.CstIfElse;
import com.luauprinter.cst.CstIndexExpression;
import com.luauprinter.cst.CstInterpString;
import com.luauprinter.cst.CstIntersectionType;
import com.luauprinter.cst.CstLocal;
import com.luauprinter.cst.CstLocalFunction;
import com.luauprinter.cst.CstNode;
import com.luauprinter.cst.CstNodeMap;
import com.luauprinter.cst.CstOperator;
import com.luauprinter.cst.CstRepeat;
import com.luauprinter.cst.CstReturn;
import com.luauprinter.cst.CstSingletonString;
import com.luauprinter.cst.CstTable;
import com.luauprinter.cst.CstTableType;
import com.luauprinter.cst.CstTypeAlias;
import com.luauprinter.cst.CstTypeAssertion;
import com.luauprinter.cst.CstTypeFunction;
import com.luauprinter.cst.CstTypeReference;
import com.luauprinter.cst.CstTypeof;
import com.luauprinter.cst.CstUnionType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Layout taken from the concrete syntax tree. Nodes without a CST node are
 * laid out by {@link CanonicalFormatting}; positions the AST itself records
 * (the {@code .} of an index, the closing parenthesis of a group) are used
 * directly.
 */
public class ExactFormatting implements Formatting {

    private final CstNodeMap cstNodeMap;
    private final CanonicalFormatting canonical;

    public ExactFormatting(CstNodeMap cstNodeMap) {
        this(cstNodeMap, new CanonicalFormatting());
    }

    public ExactFormatting(CstNodeMap cstNodeMap, CanonicalFormatting canonical) {
        this.cstNodeMap = cstNodeMap;
        this.canonical = canonical;
    }

    private <T extends CstNode> Optional<T> cst(Node node, Class<T> type) {
        return cstNodeMap.get(node, type);
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    @Override
    public String number(NumberExpression node) {
        return cst(node, CstConstantNumber.class)
            .map(CstConstantNumber::text)
            .orElseGet(() -> canonical.number(node));
    }

    @Override
    public StringLiteral string(StringExpression node) {
        return cst(node, CstConstantString.class)
            .map(StringLiteral::of)
            .orElseGet(() -> canonical.string(node));
    }

    @Override
    public CallLayout call(CallExpression node) {
        return cst(node, CstCall.class)
            .map(c -> new CallLayout(
                Anchor.atOrOmit(c.openParensPosition()),
                Separators.at(c.commaPositions()),
                Anchor.atOrOmit(c.closeParensPosition())))
            .orElseGet(() -> canonical.call(node));
    }

    @Override
    public IndexNameLayout indexName(IndexNameExpression node) {
        Anchor op = node.opPosition() != null ? Anchor.at(node.opPosition()) : Anchor.INLINE;
        return new IndexNameLayout(op, Anchor.at(node.indexLocation().start()));
    }

    @Override
    public Brackets index(IndexExpression node) {
        return cst(node, CstIndexExpression.class)
            .map(c -> new Brackets(Anchor.at(c.openBracketPosition()), Anchor.at(c.closeBracketPosition())))
            .orElseGet(() -> canonical.index(node));
    }

    @Override
    public Anchor closingBracket(Node node) {
        return Anchor.before(node.location(), 1);
    }

    @Override
    public FunctionLayout function(FunctionExpression node) {
        Optional<CstFunction> found = cst(node, CstFunction.class);
        if (found.isEmpty()) {
            return canonical.function(node);
        }
        CstFunction c = found.get();
        if (c.argsAnnotationColonPositions().size() != node.args().size()) {
            throw new InternalConsistencyException("function at " + node.location() + " has "
                + node.args().size() + " arguments but " + c.argsAnnotationColonPositions().size()
                + " recorded annotation colons");
        }
        return new FunctionLayout(
            new GenericsLayout(
                Anchor.atOrOmit(c.openGenericsPosition()),
                Separators.at(c.genericsCommaPositions()),
                Anchor.atOrOmit(c.closeGenericsPosition())),
            Anchor.at(c.openParensPosition()),
            Separators.at(c.argsCommaPositions()),
            atOrInline(c.argsAnnotationColonPositions()),
            atOrInline(c.varargAnnotationColonPosition()),
            Anchor.at(c.closeParensPosition()),
            atOrInline(c.returnSpecifierPosition()),
            Anchor.INLINE);
    }

    @Override
    public List<TableItemLayout> table(TableExpression node) {
        Optional<CstTable> found = cst(node, CstTable.class);
        if (found.isEmpty()) {
            return canonical.table(node);
        }
        List<CstTable.Item> cstItems = found.get().items();
        if (cstItems.size() != node.items().size()) {
            throw new InternalConsistencyException("table at " + node.location() + " has "
                + node.items().size() + " items but " + cstItems.size() + " recorded items");
        }
        List<TableItemLayout> items = new ArrayList<>(cstItems.size());
        for (CstTable.Item item : cstItems) {
            items.add(new TableItemLayout(
                atOrInline(item.indexerOpenPosition()),
                atOrInline(item.indexerClosePosition()),
                atOrInline(item.equalsPosition()),
                item.separator() != null ? item.separator().text() : null,
                atOrInline(item.separatorPosition())));
        }
        return items;
    }

    @Override
    public Anchor unaryOperator(UnaryExpression node) {
        return cst(node, CstOperator.class)
            .map(c -> Anchor.at(c.opPosition()))
            .orElseGet(() -> canonical.unaryOperator(node));
    }

    @Override
    public OperatorLayout binaryOperator(BinaryExpression node) {
        return cst(node, CstOperator.class)
            .map(c -> new OperatorLayout(Anchor.at(c.opPosition()), node.op().isWord()))
            .orElseGet(() -> canonical.binaryOperator(node));
    }

    @Override
    public Anchor typeAssertion(TypeAssertionExpression node) {
        return cst(node, CstTypeAssertion.class)
            .map(c -> Anchor.at(c.opPosition()))
            .orElseGet(() -> canonical.typeAssertion(node));
    }

    @Override
    public IfElseLayout ifElse(IfElseExpression node) {
        return cst(node, CstIfElse.class)
            .map(c -> new IfElseLayout(Anchor.at(c.thenPosition()), Anchor.at(c.elsePosition()), c.elseIf()))
            .orElseGet(() -> canonical.ifElse(node));
    }

    @Override
    public InterpLayout interpString(InterpStringExpression node) {
        Optional<CstInterpString> found = cst(node, CstInterpString.class);
        if (found.isEmpty()) {
            return canonical.interpString(node);
        }
        CstInterpString c = found.get();
        if (c.sourceStrings().size() != node.strings().size()) {
            throw new InternalConsistencyException("interpolated string at " + node.location() + " has "
                + node.strings().size() + " segments but " + c.sourceStrings().size() + " recorded segments");
        }
        List<Anchor> anchors = new ArrayList<>(c.stringPositions().size());
        for (Position position : c.stringPositions()) {
            anchors.add(Anchor.at(position));
        }
        return new InterpLayout(c.sourceStrings(), anchors);
    }

    // ========================================================================
    // Statements
    // ========================================================================

    @Override
    public Anchor doEnd(Block block) {
        return cst(block, CstDo.class)
            .map(c -> Anchor.at(c.endPosition()))
            .orElseGet(() -> canonical.doEnd(block));
    }

    @Override
    public Anchor until(RepeatStatement node) {
        return cst(node, CstRepeat.class)
            .map(c -> Anchor.at(c.untilPosition()))
            .orElseGet(() -> canonical.until(node));
    }

    @Override
    public Separators returnCommas(ReturnStatement node) {
        return cst(node, CstReturn.class)
            .map(c -> Separators.at(c.commaPositions()))
            .orElseGet(() -> canonical.returnCommas(node));
    }

    @Override
    public BindingLayout local(LocalStatement node) {
        return cst(node, CstLocal.class)
            .map(c -> binding(c.varsAnnotationColonPositions(), c.varsCommaPositions(), c.valuesCommaPositions(),
                node.vars().size()))
            .orElseGet(() -> canonical.local(node));
    }

    @Override
    public ForLayout forLoop(ForStatement node) {
        return cst(node, CstFor.class)
            .map(c -> new ForLayout(
                atOrInline(c.annotationColonPosition()),
                Anchor.at(c.equalsPosition()),
                Anchor.at(c.endCommaPosition()),
                atOrInline(c.stepCommaPosition())))
            .orElseGet(() -> canonical.forLoop(node));
    }

    @Override
    public BindingLayout forIn(ForInStatement node) {
        return cst(node, CstForIn.class)
            .map(c -> binding(c.varsAnnotationColonPositions(), c.varsCommaPositions(), c.valuesCommaPositions(),
                node.vars().size()))
            .orElseGet(() -> canonical.forIn(node));
    }

    @Override
    public AssignLayout assign(AssignStatement node) {
        return cst(node, CstAssign.class)
            .map(c -> new AssignLayout(
                Separators.at(c.varsCommaPositions()),
                Anchor.at(c.equalsPosition()),
                Separators.at(c.valuesCommaPositions())))
            .orElseGet(() -> canonical.assign(node));
    }

    @Override
    public Anchor compoundOperator(CompoundAssignStatement node) {
        return cst(node, CstCompoundAssign.class)
            .map(c -> Anchor.at(c.opPosition()))
            .orElseGet(() -> canonical.compoundOperator(node));
    }

    @Override
    public Anchor localFunctionKeyword(LocalFunctionStatement node) {
        return cst(node, CstLocalFunction.class)
            .map(c -> Anchor.at(c.functionKeywordPosition()))
            .orElseGet(() -> canonical.localFunctionKeyword(node));
    }

    @Override
    public TypeAliasLayout typeAlias(TypeAliasStatement node) {
        return cst(node, CstTypeAlias.class)
            .map(c -> new TypeAliasLayout(
                Anchor.at(c.typeKeywordPosition()),
                new GenericsLayout(
                    Anchor.atOrOmit(c.genericsOpenPosition()),
                    Separators.at(c.genericsCommaPositions()),
                    Anchor.atOrOmit(c.genericsClosePosition())),
                Anchor.at(c.equalsPosition())))
            .orElseGet(() -> canonical.typeAlias(node));
    }

    @Override
    public TypeFunctionLayout typeFunction(TypeFunctionStatement node) {
        return cst(node, CstTypeFunction.class)
            .map(c -> new TypeFunctionLayout(
                Anchor.at(c.typeKeywordPosition()), Anchor.at(c.functionKeywordPosition())))
            .orElseGet(() -> canonical.typeFunction(node));
    }

    @Override
    public Anchor genericDefault(GenericTypeParameter node) {
        return cst(node, CstGenericType.class)
            .map(c -> atOrInline(c.defaultEqualsPosition()))
            .orElseGet(() -> canonical.genericDefault(node));
    }

    @Override
    public GenericPackLayout genericPack(GenericPackParameter node) {
        return cst(node, CstGenericTypePack.class)
            .map(c -> new GenericPackLayout(Anchor.at(c.ellipsisPosition()), atOrInline(c.defaultEqualsPosition())))
            .orElseGet(() -> canonical.genericPack(node));
    }

    // ========================================================================
    // Types
    // ========================================================================

    @Override
    public TypeReferenceLayout typeReference(TypeReference node) {
        return cst(node, CstTypeReference.class)
            .map(c -> new TypeReferenceLayout(
                atOrInline(c.prefixPointPosition()),
                atOrInline(c.openParametersPosition()),
                Separators.at(c.parametersCommaPositions()),
                atOrInline(c.closeParametersPosition())))
            .orElseGet(() -> canonical.typeReference(node));
    }

    @Override
    public FunctionTypeLayout functionType(FunctionType node) {
        Optional<CstFunctionType> found = cst(node, CstFunctionType.class);
        if (found.isEmpty()) {
            return canonical.functionType(node);
        }
        CstFunctionType c = found.get();
        if (c.argumentNameColonPositions().size() != node.argTypes().types().size()) {
            throw new InternalConsistencyException("function type at " + node.location() + " has "
                + node.argTypes().types().size() + " arguments but "
                + c.argumentNameColonPositions().size() + " recorded name colons");
        }
        return new FunctionTypeLayout(
            new GenericsLayout(
                Anchor.atOrOmit(c.openGenericsPosition()),
                Separators.at(c.genericsCommaPositions()),
                Anchor.atOrOmit(c.closeGenericsPosition())),
            Anchor.at(c.openArgsPosition()),
            atOrInline(c.argumentNameColonPositions()),
            Separators.at(c.argumentsCommaPositions()),
            Anchor.at(c.closeArgsPosition()),
            Anchor.at(c.returnArrowPosition()));
    }

    @Override
    public TableTypeLayout tableType(TableType node) {
        Optional<CstTableType> found = cst(node, CstTableType.class);
        if (found.isEmpty()) {
            return canonical.tableType(node);
        }
        CstTableType c = found.get();
        if (c.array()) {
            if (!CanonicalFormatting.isArrayShorthand(node)) {
                throw new InternalConsistencyException("table type at " + node.location()
                    + " recorded as array shorthand but is not one");
            }
            return new TableTypeLayout(true, List.of());
        }
        int properties = 0;
        int indexers = 0;
        List<TableTypeItemLayout> items = new ArrayList<>(c.items().size());
        for (CstTableType.Item item : c.items()) {
            String separator = item.separator() != null ? item.separator().text() : null;
            Anchor separatorAnchor = atOrInline(item.separatorPosition());
            switch (item.itemKind()) {
                case INDEXER -> {
                    indexers++;
                    items.add(new TableTypeItemLayout(item.itemKind(),
                        Anchor.at(item.indexerOpenPosition()), Anchor.INLINE, null,
                        Anchor.at(item.indexerClosePosition()), Anchor.at(item.colonPosition()),
                        separator, separatorAnchor));
                }
                case PROPERTY -> {
                    properties++;
                    items.add(new TableTypeItemLayout(item.itemKind(),
                        Anchor.OMIT, Anchor.INLINE, null, Anchor.OMIT, Anchor.at(item.colonPosition()),
                        separator, separatorAnchor));
                }
                case STRING_PROPERTY -> {
                    properties++;
                    items.add(new TableTypeItemLayout(item.itemKind(),
                        Anchor.at(item.indexerOpenPosition()), Anchor.at(item.stringPosition()),
                        StringLiteral.of(item.stringInfo()),
                        Anchor.at(item.indexerClosePosition()), Anchor.at(item.colonPosition()),
                        separator, separatorAnchor));
                }
            }
        }
        int expectedIndexers = node.indexer() != null ? 1 : 0;
        if (properties != node.props().size() || indexers != expectedIndexers) {
            throw new InternalConsistencyException("table type at " + node.location() + " has "
                + node.props().size() + " properties and " + expectedIndexers + " indexers but "
                + properties + " and " + indexers + " recorded");
        }
        return new TableTypeLayout(false, items);
    }

    @Override
    public Brackets typeof(TypeofType node) {
        return cst(node, CstTypeof.class)
            .map(c -> new Brackets(Anchor.at(c.openPosition()), Anchor.at(c.closePosition())))
            .orElseGet(() -> canonical.typeof(node));
    }

    @Override
    public UnionLayout union(UnionType node) {
        return cst(node, CstUnionType.class)
            .map(c -> new UnionLayout(
                Anchor.atOrOmit(c.leadingPosition()), Separators.at(c.separatorPositions()), false, null))
            .orElseGet(() -> canonical.union(node));
    }

    @Override
    public IntersectionLayout intersection(IntersectionType node) {
        return cst(node, CstIntersectionType.class)
            .map(c -> new IntersectionLayout(
                Anchor.atOrOmit(c.leadingPosition()), Separators.at(c.separatorPositions()), false))
            .orElseGet(() -> canonical.intersection(node));
    }

    @Override
    public StringLiteral singletonString(SingletonStringType node) {
        return cst(node, CstSingletonString.class)
            .map(StringLiteral::of)
            .orElseGet(() -> canonical.singletonString(node));
    }

    @Override
    public PackLayout explicitPack(ExplicitTypePack node, boolean parenthesize) {
        return cst(node, CstExplicitTypePack.class)
            .map(c -> new PackLayout(
                Anchor.atOrOmit(c.openParenthesesPosition()),
                Separators.at(c.commaPositions()),
                Anchor.atOrOmit(c.closeParenthesesPosition())))
            .orElseGet(() -> canonical.explicitPack(node, parenthesize));
    }

    @Override
    public Anchor genericPackEllipsis(GenericTypePack node) {
        return cst(node, CstGenericTypePackReference.class)
            .map(c -> Anchor.at(c.ellipsisPosition()))
            .orElseGet(() -> canonical.genericPackEllipsis(node));
    }

    private BindingLayout binding(List<Position> colons, List<Position> varCommas, List<Position> valueCommas,
                                  int varCount) {
        if (colons.size() != varCount) {
            throw new InternalConsistencyException(
                varCount + " variables but " + colons.size() + " recorded annotation colons");
        }
        return new BindingLayout(atOrInline(colons), Separators.at(varCommas), Separators.at(valueCommas));
    }

    private static Anchor atOrInline(Position position) {
        return position == null ? Anchor.INLINE : Anchor.at(position);
    }

    private static List<Anchor> atOrInline(List<Position> positions) {
        List<Anchor> anchors = new ArrayList<>(positions.size());
        for (Position position : positions) {
            anchors.add(atOrInline(position));
        }
        return anchors;
    }
}

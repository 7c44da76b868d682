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
import com.luauprinter.ast.OptionalType;
import com.luauprinter.ast.RepeatStatement;
import com.luauprinter.ast.ReturnStatement;
import com.luauprinter.ast.SingletonStringType;
import com.luauprinter.ast.SourceLocation.Position;
import com.luauprinter.ast.StringExpression;
import com.luauprinter.ast.TableExpression;
import com.luauprinter.ast.TableProperty;
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Default layout, used when no source positions are known. Tokens go directly
 * after the previous one, with a space where two tokens would otherwise run
 * together or where the source had room for one.
 */
public class CanonicalFormatting implements Formatting {

    private static final Set<String> KEYWORDS = Set.of(
        "and", "break", "do", "else", "elseif", "end", "false", "for", "function", "if", "in",
        "local", "nil", "not", "or", "repeat", "return", "then", "true", "until", "while");

    @Override
    public String number(NumberExpression node) {
        return NumberFormatter.format(node.value());
    }

    @Override
    public StringLiteral string(StringExpression node) {
        return StringLiteral.canonical(node.value());
    }

    @Override
    public CallLayout call(CallExpression node) {
        return new CallLayout(Anchor.INLINE, Separators.inline(), Anchor.INLINE);
    }

    @Override
    public IndexNameLayout indexName(IndexNameExpression node) {
        return new IndexNameLayout(Anchor.INLINE, Anchor.INLINE);
    }

    @Override
    public Brackets index(IndexExpression node) {
        return new Brackets(Anchor.INLINE, Anchor.INLINE);
    }

    @Override
    public Anchor closingBracket(Node node) {
        return Anchor.INLINE;
    }

    @Override
    public FunctionLayout function(FunctionExpression node) {
        return new FunctionLayout(
            generics(),
            Anchor.INLINE,
            Separators.inline(),
            Collections.nCopies(node.args().size(), Anchor.INLINE),
            Anchor.INLINE,
            Anchor.INLINE,
            Anchor.INLINE,
            Anchor.SPACE);
    }

    @Override
    public List<TableItemLayout> table(TableExpression node) {
        int count = node.items().size();
        List<TableItemLayout> items = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Position valueStart = node.items().get(i).value().location().start();
            items.add(new TableItemLayout(
                Anchor.INLINE,
                Anchor.INLINE,
                Anchor.spaced(valueStart, 1),
                i + 1 < count ? "," : null,
                Anchor.INLINE));
        }
        return items;
    }

    @Override
    public Anchor unaryOperator(UnaryExpression node) {
        return Anchor.INLINE;
    }

    @Override
    public OperatorLayout binaryOperator(BinaryExpression node) {
        Position rightStart = node.right().location().start();
        return switch (node.op()) {
            case ADD, SUB, MUL, DIV, FLOOR_DIV, MOD, POW, COMPARE_LT, COMPARE_GT ->
                new OperatorLayout(Anchor.spaced(rightStart, 2), false);
            case CONCAT, COMPARE_NE, COMPARE_EQ, COMPARE_LE, COMPARE_GE, OR ->
                new OperatorLayout(Anchor.spaced(rightStart, 3), true);
            case AND -> new OperatorLayout(Anchor.spaced(rightStart, 4), true);
        };
    }

    @Override
    public Anchor typeAssertion(TypeAssertionExpression node) {
        return Anchor.spaced(node.annotation().location().start(), 2);
    }

    @Override
    public IfElseLayout ifElse(IfElseExpression node) {
        return new IfElseLayout(Anchor.INLINE, Anchor.INLINE, false);
    }

    @Override
    public InterpLayout interpString(InterpStringExpression node) {
        List<String> segments = new ArrayList<>(node.strings().size());
        for (String segment : node.strings()) {
            segments.add(StringEscaper.escapeInterpolated(segment));
        }
        return new InterpLayout(segments, Collections.nCopies(segments.size(), Anchor.INLINE));
    }

    @Override
    public Anchor doEnd(Block block) {
        return Anchor.before(block.location(), 3);
    }

    @Override
    public Anchor until(RepeatStatement node) {
        Position conditionStart = node.condition().location().start();
        if (conditionStart.column() > 5) {
            return Anchor.at(conditionStart.shiftColumn(-6));
        }
        return Anchor.INLINE;
    }

    @Override
    public Separators returnCommas(ReturnStatement node) {
        return Separators.inline();
    }

    @Override
    public BindingLayout local(LocalStatement node) {
        return new BindingLayout(
            Collections.nCopies(node.vars().size(), Anchor.INLINE), Separators.inline(), Separators.inline());
    }

    @Override
    public ForLayout forLoop(ForStatement node) {
        return new ForLayout(Anchor.INLINE, Anchor.INLINE, Anchor.INLINE, Anchor.INLINE);
    }

    @Override
    public BindingLayout forIn(ForInStatement node) {
        return new BindingLayout(
            Collections.nCopies(node.vars().size(), Anchor.INLINE), Separators.inline(), Separators.inline());
    }

    @Override
    public AssignLayout assign(AssignStatement node) {
        return new AssignLayout(Separators.inline(), Anchor.INLINE, Separators.inline());
    }

    @Override
    public Anchor compoundOperator(CompoundAssignStatement node) {
        return Anchor.INLINE;
    }

    @Override
    public Anchor localFunctionKeyword(LocalFunctionStatement node) {
        return Anchor.SPACE;
    }

    @Override
    public TypeAliasLayout typeAlias(TypeAliasStatement node) {
        return new TypeAliasLayout(Anchor.INLINE, generics(), Anchor.spaced(node.type().location().start(), 2));
    }

    @Override
    public TypeFunctionLayout typeFunction(TypeFunctionStatement node) {
        return new TypeFunctionLayout(Anchor.INLINE, Anchor.INLINE);
    }

    @Override
    public Anchor genericDefault(GenericTypeParameter node) {
        if (node.defaultValue() == null) {
            return Anchor.INLINE;
        }
        return Anchor.spaced(node.defaultValue().location().start(), 2);
    }

    @Override
    public GenericPackLayout genericPack(GenericPackParameter node) {
        Anchor equalsSign = node.defaultValue() == null
            ? Anchor.INLINE
            : Anchor.spaced(node.defaultValue().location().start(), 2);
        return new GenericPackLayout(Anchor.INLINE, equalsSign);
    }

    @Override
    public TypeReferenceLayout typeReference(TypeReference node) {
        return new TypeReferenceLayout(Anchor.INLINE, Anchor.INLINE, Separators.inline(), Anchor.INLINE);
    }

    @Override
    public FunctionTypeLayout functionType(FunctionType node) {
        return new FunctionTypeLayout(
            generics(),
            Anchor.INLINE,
            Collections.nCopies(node.argTypes().types().size(), Anchor.INLINE),
            Separators.inline(),
            Anchor.INLINE,
            Anchor.INLINE);
    }

    @Override
    public TableTypeLayout tableType(TableType node) {
        if (isArrayShorthand(node)) {
            return new TableTypeLayout(true, List.of());
        }
        int count = node.props().size() + (node.indexer() != null ? 1 : 0);
        List<TableTypeItemLayout> items = new ArrayList<>(count);
        for (TableProperty prop : node.props()) {
            String separator = items.size() + 1 < count ? "," : null;
            if (isName(prop.name())) {
                items.add(new TableTypeItemLayout(CstTableType.Item.Kind.PROPERTY,
                    Anchor.OMIT, Anchor.INLINE, null, Anchor.OMIT, Anchor.INLINE, separator, Anchor.INLINE));
            } else {
                items.add(new TableTypeItemLayout(CstTableType.Item.Kind.STRING_PROPERTY,
                    Anchor.spaced(prop.location().start(), 1), Anchor.INLINE,
                    StringLiteral.canonical(prop.name()), Anchor.INLINE,
                    Anchor.INLINE, separator, Anchor.INLINE));
            }
        }
        if (node.indexer() != null) {
            // "[" keeps the space that separated it from the previous item
            Position indexStart = node.indexer().indexType().location().start();
            items.add(new TableTypeItemLayout(CstTableType.Item.Kind.INDEXER,
                Anchor.spaced(indexStart, 1), Anchor.INLINE, null, Anchor.INLINE, Anchor.INLINE, null, Anchor.INLINE));
        }
        return new TableTypeLayout(false, items);
    }

    @Override
    public Brackets typeof(TypeofType node) {
        return new Brackets(Anchor.INLINE, Anchor.INLINE);
    }

    @Override
    public UnionLayout union(UnionType node) {
        List<TypeAnnotation> types = node.types();
        if (types.size() == 2) {
            TypeAnnotation left = types.get(0);
            TypeAnnotation right = types.get(1);
            if (isNil(left)) {
                TypeAnnotation swap = left;
                left = right;
                right = swap;
            }
            // (T | U) and (T | nil) are still possible at this point
            if (isNil(right)) {
                return new UnionLayout(Anchor.OMIT, Separators.inline(), true, left);
            }
        }
        return new UnionLayout(Anchor.OMIT, memberSeparators(types), true, null);
    }

    @Override
    public IntersectionLayout intersection(IntersectionType node) {
        return new IntersectionLayout(Anchor.OMIT, memberSeparators(node.types()), true);
    }

    @Override
    public StringLiteral singletonString(SingletonStringType node) {
        return StringLiteral.canonical(node.value());
    }

    @Override
    public PackLayout explicitPack(ExplicitTypePack node, boolean parenthesize) {
        int count = node.typeList().types().size() + (node.typeList().tailType() != null ? 1 : 0);
        if (count == 1 && !parenthesize) {
            return new PackLayout(Anchor.OMIT, Separators.inline(), Anchor.OMIT);
        }
        return new PackLayout(Anchor.INLINE, Separators.inline(), Anchor.INLINE);
    }

    @Override
    public Anchor genericPackEllipsis(GenericTypePack node) {
        return Anchor.INLINE;
    }

    private static GenericsLayout generics() {
        return new GenericsLayout(Anchor.INLINE, Separators.inline(), Anchor.INLINE);
    }

    private static List<Anchor> spacedBefore(List<TypeAnnotation> members) {
        List<Anchor> anchors = new ArrayList<>();
        for (int i = 1; i < members.size(); i++) {
            TypeAnnotation member = members.get(i);
            if (!(member instanceof OptionalType)) {
                anchors.add(Anchor.spaced(member.location().start(), 2));
            }
        }
        return anchors;
    }

    private static Separators memberSeparators(List<TypeAnnotation> members) {
        return Separators.anchored(spacedBefore(members));
    }

    static boolean isArrayShorthand(TableType node) {
        return node.props().isEmpty()
            && node.indexer() != null
            && node.indexer().indexType() instanceof TypeReference index
            && index.prefix() == null
            && index.name().equals("number");
    }

    private static boolean isNil(TypeAnnotation type) {
        return type instanceof TypeReference reference && reference.prefix() == null && reference.name().equals("nil");
    }

    /**
     * Whether {@code name} can be written as a bare property name.
     */
    static boolean isName(String name) {
        if (name.isEmpty() || !StringSourceWriter.isIdentifierStartChar(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            if (!StringSourceWriter.isIdentifierChar(name.charAt(i))) {
                return false;
            }
        }
        return !KEYWORDS.contains(name);
    }
}

package com.luauprinter.printer;

import com.luauprinter.InternalConsistencyException;
import com.luauprinter.ast.*;
import com.luauprinter.cst.CstTableType;
import com.luauprinter.printer.Formatting.AssignLayout;
import com.luauprinter.printer.Formatting.BindingLayout;
import com.luauprinter.printer.Formatting.Brackets;
import com.luauprinter.printer.Formatting.CallLayout;
import com.luauprinter.printer.Formatting.ForLayout;
import com.luauprinter.printer.Formatting.FunctionLayout;
import com.luauprinter.printer.Formatting.FunctionTypeLayout;
import com.luauprinter.printer.Formatting.GenericPackLayout;
import com.luauprinter.printer.Formatting.GenericsLayout;
import com.luauprinter.printer.Formatting.IfElseLayout;
import com.luauprinter.printer.Formatting.IndexNameLayout;
import com.luauprinter.printer.Formatting.InterpLayout;
import com.luauprinter.printer.Formatting.IntersectionLayout;
import com.luauprinter.printer.Formatting.OperatorLayout;
import com.luauprinter.printer.Formatting.PackLayout;
import com.luauprinter.printer.Formatting.TableItemLayout;
import com.luauprinter.printer.Formatting.TableTypeItemLayout;
import com.luauprinter.printer.Formatting.TableTypeLayout;
import com.luauprinter.printer.Formatting.TypeAliasLayout;
import com.luauprinter.printer.Formatting.TypeFunctionLayout;
import com.luauprinter.printer.Formatting.TypeReferenceLayout;
import com.luauprinter.printer.Formatting.UnionLayout;

import java.util.List;

/**
 * Writes an AST back out as Luau source. Every node starts at its recorded
 * begin position; everything else is placed by the {@link Formatting}.
 */
public class Printer {

    private final SourceWriter writer;
    private final Formatting formatting;
    private final boolean writeTypes;

    public Printer(SourceWriter writer, Formatting formatting, boolean writeTypes) {
        this.writer = writer;
        this.formatting = formatting;
        this.writeTypes = writeTypes;
    }

    /**
     * Prints any expression, statement, type or type pack.
     */
    public void visitNode(Node node) {
        if (node instanceof Statement statement) {
            visit(statement);
        } else if (node instanceof Expression expression) {
            visit(expression);
        } else if (node instanceof TypeAnnotation type) {
            visitType(type);
        } else if (node instanceof TypePack pack) {
            visitTypePack(pack, false, true);
        } else {
            throw new InternalConsistencyException("cannot print " + node.kind() + " on its own");
        }
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    public void visit(Expression expr) {
        writer.advance(expr.location().start());

        if (expr instanceof GroupExpression a) {
            writer.symbol("(");
            visit(a.expr());
            emit(formatting.closingBracket(a), ")");
        } else if (expr instanceof NilExpression) {
            writer.keyword("nil");
        } else if (expr instanceof BooleanExpression a) {
            writer.keyword(a.value() ? "true" : "false");
        } else if (expr instanceof NumberExpression a) {
            writer.literal(formatting.number(a));
        } else if (expr instanceof StringExpression a) {
            formatting.string(a).writeTo(writer);
        } else if (expr instanceof LocalExpression a) {
            writer.identifier(a.local().name());
        } else if (expr instanceof GlobalExpression a) {
            writer.identifier(a.name());
        } else if (expr instanceof VarargsExpression) {
            writer.symbol("...");
        } else if (expr instanceof CallExpression a) {
            visitCall(a);
        } else if (expr instanceof IndexNameExpression a) {
            visit(a.expr());
            IndexNameLayout layout = formatting.indexName(a);
            emit(layout.op(), String.valueOf(a.op()));
            layout.name().place(writer);
            writer.write(a.index());
        } else if (expr instanceof IndexExpression a) {
            visit(a.expr());
            Brackets brackets = formatting.index(a);
            emit(brackets.open(), "[");
            visit(a.index());
            emit(brackets.close(), "]");
        } else if (expr instanceof FunctionExpression a) {
            writer.keyword("function");
            visitFunctionBody(a);
        } else if (expr instanceof TableExpression a) {
            visitTable(a);
        } else if (expr instanceof UnaryExpression a) {
            formatting.unaryOperator(a).place(writer);
            if (a.op() == UnaryOperator.NOT) {
                writer.keyword("not");
            } else {
                // "- -x" must not turn into a comment
                if (a.op() == UnaryOperator.MINUS && writer.lastChar() == '-') {
                    writer.space();
                }
                writer.symbol(a.op().text());
            }
            visit(a.expr());
        } else if (expr instanceof BinaryExpression a) {
            visit(a.left());
            OperatorLayout layout = formatting.binaryOperator(a);
            layout.anchor().place(writer);
            if (layout.keyword()) {
                writer.keyword(a.op().text());
            } else {
                writer.symbol(a.op().text());
            }
            visit(a.right());
        } else if (expr instanceof TypeAssertionExpression a) {
            visit(a.expr());
            if (writeTypes) {
                emit(formatting.typeAssertion(a), "::");
                visitType(a.annotation());
            }
        } else if (expr instanceof IfElseExpression a) {
            visitIfElse(a, "if");
        } else if (expr instanceof InterpStringExpression a) {
            visitInterpString(a);
        } else if (expr instanceof ErrorExpression a) {
            writer.symbol("(error-expr");
            for (int i = 0; i < a.expressions().size(); i++) {
                writer.symbol(i == 0 ? ": " : ", ");
                visit(a.expressions().get(i));
            }
            writer.symbol(")");
        } else {
            throw new InternalConsistencyException("unknown expression kind " + expr.kind());
        }
    }

    private void visitCall(CallExpression call) {
        visit(call.func());
        CallLayout layout = formatting.call(call);
        emit(layout.open(), "(");
        for (Expression arg : call.args()) {
            layout.commas().insert(writer, ",");
            visit(arg);
        }
        emit(layout.close(), ")");
    }

    private void visitTable(TableExpression table) {
        writer.symbol("{");
        List<TableItemLayout> layouts = formatting.table(table);
        for (int i = 0; i < table.items().size(); i++) {
            TableItem item = table.items().get(i);
            TableItemLayout layout = layouts.get(i);
            switch (item.itemKind()) {
                case LIST -> {
                }
                case RECORD -> {
                    writer.advance(item.key().location().start());
                    writer.identifier(((StringExpression) item.key()).value());
                    layout.equalsSign().place(writer);
                    writer.symbol("=");
                }
                case GENERAL -> {
                    emit(layout.indexerOpen(), "[");
                    visit(item.key());
                    emit(layout.indexerClose(), "]");
                    layout.equalsSign().place(writer);
                    writer.symbol("=");
                }
            }
            writer.advance(item.value().location().start());
            visit(item.value());
            if (layout.separator() != null) {
                emit(layout.separatorAnchor(), layout.separator());
            }
        }
        Anchor.before(table.location(), 1).place(writer);
        writer.symbol("}");
        writer.advance(table.location().end());
    }

    private void visitIfElse(IfElseExpression expr, String keyword) {
        IfElseLayout layout = formatting.ifElse(expr);
        writer.keyword(keyword);
        visit(expr.condition());
        layout.then().place(writer);
        writer.keyword("then");
        visit(expr.trueExpr());
        layout.elseKeyword().place(writer);
        if (layout.elseIf() && expr.falseExpr() instanceof IfElseExpression nested) {
            writer.advance(nested.location().start());
            visitIfElse(nested, "elseif");
        } else {
            writer.keyword("else");
            visit(expr.falseExpr());
        }
    }

    private void visitInterpString(InterpStringExpression expr) {
        InterpLayout layout = formatting.interpString(expr);
        List<String> segments = layout.segments();
        for (int i = 0; i < segments.size(); i++) {
            layout.anchors().get(i).place(writer);
            writer.symbol(i == 0 ? "`" : "}");
            writer.write(segments.get(i));
            if (i < expr.expressions().size()) {
                writer.symbol("{");
                visit(expr.expressions().get(i));
            }
        }
        writer.symbol("`");
    }

    private void visitFunctionBody(FunctionExpression func) {
        FunctionLayout layout = formatting.function(func);
        visitGenerics(func.generics(), func.genericPacks(), layout.generics(), false);

        emit(layout.openParens(), "(");
        for (int i = 0; i < func.args().size(); i++) {
            layout.argCommas().insert(writer, ",");
            visitLocal(func.args().get(i), layout.argColons().get(i));
        }
        if (func.vararg()) {
            layout.argCommas().insert(writer, ",");
            writer.advance(func.varargLocation().start());
            writer.symbol("...");
            if (writeTypes && func.varargAnnotation() != null) {
                emit(layout.varargColon(), ":");
                visitTypePack(func.varargAnnotation(), true, false);
            }
        }
        emit(layout.closeParens(), ")");

        if (writeTypes && func.returnAnnotation() != null) {
            emit(layout.returnColon(), ":");
            layout.returnType().place(writer);
            visitTypePack(func.returnAnnotation(), false, false);
        }

        visitBlock(func.body());
        writeEnd(func.location());
    }

    private void visitGenerics(List<GenericTypeParameter> generics, List<GenericPackParameter> packs,
                               GenericsLayout layout, boolean withDefaults) {
        if (generics.isEmpty() && packs.isEmpty()) {
            return;
        }
        emit(layout.open(), "<");
        for (GenericTypeParameter generic : generics) {
            layout.commas().insert(writer, ",");
            writer.advance(generic.location().start());
            writer.identifier(generic.name());
            if (withDefaults && generic.defaultValue() != null) {
                emit(formatting.genericDefault(generic), "=");
                visitType(generic.defaultValue());
            }
        }
        for (GenericPackParameter pack : packs) {
            layout.commas().insert(writer, ",");
            writer.advance(pack.location().start());
            writer.identifier(pack.name());
            GenericPackLayout packLayout = formatting.genericPack(pack);
            emit(packLayout.ellipsis(), "...");
            if (withDefaults && pack.defaultValue() != null) {
                emit(packLayout.equalsSign(), "=");
                visitTypePack(pack.defaultValue(), false, true);
            }
        }
        emit(layout.close(), ">");
    }

    private void visitLocal(Local local, Anchor colon) {
        writer.advance(local.location().start());
        writer.identifier(local.name());
        if (writeTypes && local.annotation() != null) {
            emit(colon, ":");
            visitType(local.annotation());
        }
    }

    // ========================================================================
    // Statements
    // ========================================================================

    /**
     * Prints the statements of a block and moves to its end, without any
     * surrounding keywords.
     */
    public void visitBlock(Block block) {
        for (Statement statement : block.body()) {
            visit(statement);
        }
        writer.advance(block.location().end());
    }

    private void writeEnd(SourceLocation location) {
        Anchor.before(location, 3).place(writer);
        writer.keyword("end");
    }

    public void visit(Statement stat) {
        writer.advance(stat.location().start());

        if (stat instanceof Block a) {
            writer.keyword("do");
            for (Statement statement : a.body()) {
                visit(statement);
            }
            formatting.doEnd(a).place(writer);
            writer.keyword("end");
        } else if (stat instanceof IfStatement a) {
            writer.keyword("if");
            visitElseIf(a);
        } else if (stat instanceof WhileStatement a) {
            writer.keyword("while");
            visit(a.condition());
            writer.advance(a.doLocation().start());
            writer.keyword("do");
            visitBlock(a.body());
            writeEnd(a.location());
        } else if (stat instanceof RepeatStatement a) {
            writer.keyword("repeat");
            visitBlock(a.body());
            formatting.until(a).place(writer);
            writer.keyword("until");
            visit(a.condition());
        } else if (stat instanceof BreakStatement) {
            writer.keyword("break");
        } else if (stat instanceof ContinueStatement) {
            writer.keyword("continue");
        } else if (stat instanceof ReturnStatement a) {
            writer.keyword("return");
            Separators commas = formatting.returnCommas(a);
            for (Expression value : a.list()) {
                commas.insert(writer, ",");
                visit(value);
            }
        } else if (stat instanceof ExpressionStatement a) {
            visit(a.expr());
        } else if (stat instanceof LocalStatement a) {
            visitLocalStatement(a);
        } else if (stat instanceof ForStatement a) {
            visitFor(a);
        } else if (stat instanceof ForInStatement a) {
            visitForIn(a);
        } else if (stat instanceof AssignStatement a) {
            AssignLayout layout = formatting.assign(a);
            for (Expression var : a.vars()) {
                layout.varCommas().insert(writer, ",");
                visit(var);
            }
            emit(layout.equalsSign(), "=");
            for (Expression value : a.values()) {
                layout.valueCommas().insert(writer, ",");
                visit(value);
            }
        } else if (stat instanceof CompoundAssignStatement a) {
            visit(a.var());
            emit(formatting.compoundOperator(a), compoundOperator(a.op()));
            visit(a.value());
        } else if (stat instanceof FunctionStatement a) {
            writer.keyword("function");
            visit(a.name());
            visitFunctionBody(a.func());
        } else if (stat instanceof LocalFunctionStatement a) {
            writer.keyword("local");
            formatting.localFunctionKeyword(a).place(writer);
            writer.keyword("function");
            writer.advance(a.name().location().start());
            writer.identifier(a.name().name());
            visitFunctionBody(a.func());
        } else if (stat instanceof TypeAliasStatement a) {
            if (writeTypes) {
                visitTypeAlias(a);
            }
        } else if (stat instanceof TypeFunctionStatement a) {
            if (writeTypes) {
                TypeFunctionLayout layout = formatting.typeFunction(a);
                if (a.exported()) {
                    writer.keyword("export");
                }
                layout.typeKeyword().place(writer);
                writer.keyword("type");
                layout.functionKeyword().place(writer);
                writer.keyword("function");
                writer.advance(a.nameLocation().start());
                writer.identifier(a.name());
                visitFunctionBody(a.body());
            }
        } else if (stat instanceof ErrorStatement a) {
            writer.symbol("(error-stat");
            for (int i = 0; i < a.expressions().size(); i++) {
                writer.symbol(i == 0 ? ": " : ", ");
                visit(a.expressions().get(i));
            }
            for (int i = 0; i < a.statements().size(); i++) {
                writer.symbol(i == 0 && a.expressions().isEmpty() ? ": " : ", ");
                visit(a.statements().get(i));
            }
            writer.symbol(")");
        } else {
            throw new InternalConsistencyException("unknown statement kind " + stat.kind());
        }

        if (stat.hasSemicolon()) {
            writer.symbol(";");
        }
    }

    private void visitElseIf(IfStatement stat) {
        visit(stat.condition());
        if (stat.thenLocation() != null) {
            writer.advance(stat.thenLocation().start());
        }
        writer.keyword("then");
        visitBlock(stat.thenBody());

        if (stat.elseBody() == null) {
            writeEnd(stat.location());
        } else if (stat.elseBody() instanceof IfStatement elseIf) {
            if (stat.elseLocation() != null) {
                writer.advance(stat.elseLocation().start());
            }
            writer.keyword("elseif");
            visitElseIf(elseIf);
        } else if (stat.elseBody() instanceof Block elseBlock) {
            if (stat.elseLocation() != null) {
                writer.advance(stat.elseLocation().start());
            }
            writer.keyword("else");
            visitBlock(elseBlock);
            writeEnd(stat.location());
        } else {
            throw new InternalConsistencyException("else branch of an if statement must be a block, found "
                + stat.elseBody().kind());
        }
    }

    private void visitLocalStatement(LocalStatement stat) {
        BindingLayout layout = formatting.local(stat);
        writer.keyword("local");
        for (int i = 0; i < stat.vars().size(); i++) {
            layout.varCommas().insert(writer, ",");
            visitLocal(stat.vars().get(i), layout.colons().get(i));
        }
        if (stat.equalsSignLocation() != null) {
            writer.advance(stat.equalsSignLocation().start());
            writer.symbol("=");
        }
        for (Expression value : stat.values()) {
            layout.valueCommas().insert(writer, ",");
            visit(value);
        }
    }

    private void visitFor(ForStatement stat) {
        ForLayout layout = formatting.forLoop(stat);
        writer.keyword("for");
        visitLocal(stat.var(), layout.colon());
        emit(layout.equalsSign(), "=");
        visit(stat.from());
        emit(layout.endComma(), ",");
        visit(stat.to());
        if (stat.step() != null) {
            emit(layout.stepComma(), ",");
            visit(stat.step());
        }
        writer.advance(stat.doLocation().start());
        writer.keyword("do");
        visitBlock(stat.body());
        writeEnd(stat.location());
    }

    private void visitForIn(ForInStatement stat) {
        BindingLayout layout = formatting.forIn(stat);
        writer.keyword("for");
        for (int i = 0; i < stat.vars().size(); i++) {
            layout.varCommas().insert(writer, ",");
            visitLocal(stat.vars().get(i), layout.colons().get(i));
        }
        writer.advance(stat.inLocation().start());
        writer.keyword("in");
        for (Expression value : stat.values()) {
            layout.valueCommas().insert(writer, ",");
            visit(value);
        }
        writer.advance(stat.doLocation().start());
        writer.keyword("do");
        visitBlock(stat.body());
        writeEnd(stat.location());
    }

    private void visitTypeAlias(TypeAliasStatement stat) {
        TypeAliasLayout layout = formatting.typeAlias(stat);
        if (stat.exported()) {
            writer.keyword("export");
        }
        layout.typeKeyword().place(writer);
        writer.keyword("type");
        writer.advance(stat.nameLocation().start());
        writer.identifier(stat.name());
        visitGenerics(stat.generics(), stat.genericPacks(), layout.generics(), true);
        emit(layout.equalsSign(), "=");
        visitType(stat.type());
    }

    private static String compoundOperator(BinaryOperator op) {
        return switch (op) {
            case ADD, SUB, MUL, DIV, FLOOR_DIV, MOD, POW, CONCAT -> op.text() + "=";
            default -> throw new InternalConsistencyException("unexpected compound assignment operator " + op);
        };
    }

    // ========================================================================
    // Types
    // ========================================================================

    public void visitType(TypeAnnotation type) {
        writer.advance(type.location().start());

        if (type instanceof TypeReference a) {
            visitTypeReference(a);
        } else if (type instanceof FunctionType a) {
            visitFunctionType(a);
        } else if (type instanceof TableType a) {
            visitTableType(a);
        } else if (type instanceof TypeofType a) {
            Brackets brackets = formatting.typeof(a);
            writer.keyword("typeof");
            emit(brackets.open(), "(");
            visit(a.expr());
            emit(brackets.close(), ")");
        } else if (type instanceof UnionType a) {
            visitUnion(a);
        } else if (type instanceof IntersectionType a) {
            IntersectionLayout layout = formatting.intersection(a);
            emit(layout.leading(), "&");
            for (int i = 0; i < a.types().size(); i++) {
                TypeAnnotation member = a.types().get(i);
                if (i > 0) {
                    layout.separators().force(writer, "&");
                }
                boolean wrap = layout.wrap() && (member instanceof UnionType || member instanceof FunctionType);
                visitWrapped(member, wrap);
            }
        } else if (type instanceof OptionalType) {
            writer.symbol("?");
        } else if (type instanceof GroupType a) {
            writer.symbol("(");
            visitType(a.type());
            emit(formatting.closingBracket(a), ")");
        } else if (type instanceof SingletonBoolType a) {
            writer.keyword(a.value() ? "true" : "false");
        } else if (type instanceof SingletonStringType a) {
            formatting.singletonString(a).writeTo(writer);
        } else if (type instanceof ErrorType) {
            writer.symbol("%error-type%");
        } else {
            throw new InternalConsistencyException("unknown type kind " + type.kind());
        }
    }

    private void visitTypeReference(TypeReference type) {
        TypeReferenceLayout layout = formatting.typeReference(type);
        if (type.prefix() != null) {
            writer.identifier(type.prefix());
            emit(layout.prefixPoint(), ".");
        }
        writer.advance(type.nameLocation().start());
        writer.identifier(type.name());
        if (type.hasParameterList() || !type.parameters().isEmpty()) {
            emit(layout.open(), "<");
            for (TypeParameter parameter : type.parameters()) {
                layout.commas().insert(writer, ",");
                if (parameter.type() != null) {
                    visitType(parameter.type());
                } else {
                    visitTypePack(parameter.typePack(), false, true);
                }
            }
            emit(layout.close(), ">");
        }
    }

    private void visitFunctionType(FunctionType type) {
        FunctionTypeLayout layout = formatting.functionType(type);
        visitGenerics(type.generics(), type.genericPacks(), layout.generics(), false);
        emit(layout.openArgs(), "(");
        List<TypeAnnotation> args = type.argTypes().types();
        for (int i = 0; i < args.size(); i++) {
            layout.argCommas().insert(writer, ",");
            ArgumentName name = i < type.argNames().size() ? type.argNames().get(i) : null;
            if (name != null) {
                writer.advance(name.location().start());
                writer.identifier(name.name());
                emit(layout.nameColons().get(i), ":");
            }
            visitType(args.get(i));
        }
        if (type.argTypes().tailType() != null) {
            layout.argCommas().insert(writer, ",");
            visitTypePack(type.argTypes().tailType(), false, true);
        }
        emit(layout.closeArgs(), ")");
        emit(layout.arrow(), "->");
        visitTypePack(type.returnTypes(), false, true);
    }

    private void visitTableType(TableType type) {
        TableTypeLayout layout = formatting.tableType(type);
        writer.symbol("{");
        if (layout.array()) {
            visitType(type.indexer().resultType());
        } else {
            int nextProp = 0;
            for (TableTypeItemLayout item : layout.items()) {
                if (item.itemKind() == CstTableType.Item.Kind.INDEXER) {
                    TableIndexer indexer = type.indexer();
                    emit(item.indexerOpen(), "[");
                    visitType(indexer.indexType());
                    emit(item.indexerClose(), "]");
                    emit(item.colon(), ":");
                    visitType(indexer.resultType());
                } else {
                    TableProperty prop = type.props().get(nextProp++);
                    if (item.itemKind() == CstTableType.Item.Kind.STRING_PROPERTY) {
                        emit(item.indexerOpen(), "[");
                        item.key().place(writer);
                        item.keyText().writeTo(writer);
                        emit(item.indexerClose(), "]");
                    } else {
                        writer.advance(prop.location().start());
                        writer.identifier(prop.name());
                    }
                    emit(item.colon(), ":");
                    visitType(prop.type());
                }
                if (item.separator() != null) {
                    emit(item.separatorAnchor(), item.separator());
                }
            }
        }
        emit(formatting.closingBracket(type), "}");
    }

    private void visitUnion(UnionType type) {
        UnionLayout layout = formatting.union(type);
        if (layout.optionalOf() != null) {
            TypeAnnotation inner = layout.optionalOf();
            visitWrapped(inner, inner instanceof IntersectionType || inner instanceof FunctionType);
            writer.symbol("?");
            return;
        }
        emit(layout.leading(), "|");
        for (int i = 0; i < type.types().size(); i++) {
            TypeAnnotation member = type.types().get(i);
            if (member instanceof OptionalType) {
                writer.advance(member.location().start());
                writer.symbol("?");
                continue;
            }
            if (i > 0) {
                layout.separators().force(writer, "|");
            }
            boolean wrap = layout.wrap() && (member instanceof IntersectionType || member instanceof FunctionType);
            visitWrapped(member, wrap);
        }
    }

    private void visitWrapped(TypeAnnotation type, boolean wrap) {
        if (wrap) {
            writer.symbol("(");
        }
        visitType(type);
        if (wrap) {
            writer.symbol(")");
        }
    }

    /**
     * @param forVararg    whether the pack annotates {@code ...}, which already
     *                     supplies the ellipsis of a variadic pack
     * @param parenthesize whether a single unrecorded type is parenthesized
     */
    public void visitTypePack(TypePack pack, boolean forVararg, boolean parenthesize) {
        writer.advance(pack.location().start());

        if (pack instanceof VariadicTypePack a) {
            if (!forVararg) {
                writer.symbol("...");
            }
            visitType(a.variadicType());
        } else if (pack instanceof GenericTypePack a) {
            writer.identifier(a.genericName());
            emit(formatting.genericPackEllipsis(a), "...");
        } else if (pack instanceof ExplicitTypePack a) {
            PackLayout layout = formatting.explicitPack(a, parenthesize);
            emit(layout.open(), "(");
            for (TypeAnnotation member : a.typeList().types()) {
                layout.commas().insert(writer, ",");
                visitType(member);
            }
            if (a.typeList().tailType() != null) {
                layout.commas().insert(writer, ",");
                visitTypePack(a.typeList().tailType(), false, true);
            }
            emit(layout.close(), ")");
        } else {
            throw new InternalConsistencyException("unknown type pack kind " + pack.kind());
        }
    }

    private void emit(Anchor anchor, String symbol) {
        if (anchor.omitted()) {
            return;
        }
        anchor.place(writer);
        writer.symbol(symbol);
    }
}

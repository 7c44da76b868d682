package com.luauprinter;

import com.luauprinter.ast.*;
import com.luauprinter.ast.SourceLocation.Position;
import com.luauprinter.cst.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Recursive descent parser for Luau. Produces the AST and, when enabled,
 * records the punctuation of every node in a {@link CstNodeMap}.
 */
public class Parser {

    private static final int UNARY_PRIORITY = 8;
    private static final int MAX_RECURSION_DEPTH = 1000;
    private static final Pattern DECIMAL = Pattern.compile("(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern HEX = Pattern.compile("[0-9a-fA-F]+");
    private static final Pattern BINARY = Pattern.compile("[01]+");

    private final List<Token> tokens;
    private final CstNodeMap cst;
    private int current = 0;
    private int recursionDepth = 0;

    // Scope tracking: visible locals in declaration order and the function depth that declared each
    private final List<Local> locals = new ArrayList<>();
    private final Map<Local, Integer> localDepths = new IdentityHashMap<>();
    private int functionDepth = 0;
    private final Deque<Boolean> varargFunctions = new ArrayDeque<>();

    public Parser(String source, CstNodeMap cst) {
        Lexer lexer = new Lexer(source);
        this.tokens = lexer.tokenize();
        this.cst = cst;
    }

    public static ParseResult parse(String source) {
        return parse(source, ParseOptions.defaults());
    }

    /**
     * Parses a whole chunk. Never throws on bad input: syntax errors are
     * returned in the result.
     */
    public static ParseResult parse(String source, ParseOptions options) {
        CstNodeMap cstNodeMap = options.storeCstData() ? new CstNodeMap() : CstNodeMap.disabled();
        try {
            Parser parser = new Parser(source, cstNodeMap);
            Block root = parser.parseChunk();
            return new ParseResult(root, List.of(), cstNodeMap);
        } catch (ParseException e) {
            return new ParseResult(null, List.of(new ParseError(e.location(), e.getMessage())), cstNodeMap);
        }
    }

    public Block parseChunk() {
        varargFunctions.push(true);
        List<Statement> body = parseStatementList();
        Token eof = peek();
        if (eof.type() != TokenType.EOF) {
            throw new ExpectedTokenException("Expected <eof>, got " + eof.describe(), eof);
        }
        varargFunctions.pop();
        return new Block(new SourceLocation(Position.ORIGIN, eof.start()), body, false);
    }

    // ========================================================================
    // Token helpers
    // ========================================================================

    private Token peek() {
        Token token = tokens.get(current);
        if (token.type() == TokenType.ERROR) {
            throw new ParseException(token.literal(), token.location());
        }
        return token;
    }

    private Token peekAhead(int offset) {
        int index = Math.min(current + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token advance() {
        if (!isAtEnd()) {
            current++;
        }
        return previous();
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkAhead(int offset, TokenType type) {
        return peekAhead(offset).type() == type;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ExpectedTokenException(message + ", got " + peek().describe(), peek());
    }

    /**
     * Consumes the token closing a construct; the message names the opening
     * token when it is on another line.
     */
    private Token consumeMatch(TokenType type, String text, Token opening) {
        if (check(type)) {
            return advance();
        }
        String where = opening.start().line() == peek().start().line()
            ? "column " + (opening.start().column() + 1)
            : "line " + (opening.start().line() + 1);
        throw new ExpectedTokenException("Expected '" + text + "' (to close '" + opening.lexeme() + "' at "
            + where + "), got " + peek().describe(), peek());
    }

    private Token consumeName(String context) {
        return consume(TokenType.NAME, "Expected identifier when parsing " + context);
    }

    private SourceLocation span(Position start) {
        return new SourceLocation(start, previous().end());
    }

    private boolean semicolon() {
        return match(TokenType.SEMICOLON);
    }

    private void enterRecursion() {
        if (++recursionDepth > MAX_RECURSION_DEPTH) {
            throw new ParseException("Exceeded allowed recursion depth; simplify your expression to make the "
                + "code compile", peek().location());
        }
    }

    private void exitRecursion() {
        recursionDepth--;
    }

    private <T extends Node> T decorate(T node, CstNode cstNode) {
        cst.put(node, cstNode);
        return node;
    }

    // ========================================================================
    // Scopes
    // ========================================================================

    private void declare(Local local) {
        locals.add(local);
        localDepths.put(local, functionDepth);
    }

    private int saveScope() {
        return locals.size();
    }

    private void restoreScope(int size) {
        while (locals.size() > size) {
            localDepths.remove(locals.remove(locals.size() - 1));
        }
    }

    private Expression resolve(Token name) {
        for (int i = locals.size() - 1; i >= 0; i--) {
            Local local = locals.get(i);
            if (local.name().equals(name.lexeme())) {
                boolean upvalue = localDepths.get(local) < functionDepth;
                return new LocalExpression(name.location(), local, upvalue);
            }
        }
        return new GlobalExpression(name.location(), name.lexeme());
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private boolean isBlockEnd() {
        return switch (peek().type()) {
            case EOF, END, ELSE, ELSEIF, UNTIL -> true;
            default -> false;
        };
    }

    private List<Statement> parseStatementList() {
        List<Statement> body = new ArrayList<>();
        while (!isBlockEnd()) {
            Statement statement = parseStatement();
            body.add(statement);
            if (statement instanceof ReturnStatement || statement instanceof BreakStatement
                || statement instanceof ContinueStatement) {
                break;
            }
        }
        return body;
    }

    /**
     * A block running from the end of the token before it to the start of the
     * token after it.
     */
    private Block parseBody() {
        int scope = saveScope();
        Position start = previous().end();
        List<Statement> body = parseStatementList();
        restoreScope(scope);
        return new Block(new SourceLocation(start, peek().start()), body, false);
    }

    private Statement parseStatement() {
        enterRecursion();
        try {
            return switch (peek().type()) {
                case IF -> parseIf();
                case WHILE -> parseWhile();
                case DO -> parseDo();
                case FOR -> parseFor();
                case REPEAT -> parseRepeat();
                case FUNCTION -> parseFunctionStatement();
                case LOCAL -> parseLocal();
                case RETURN -> parseReturn();
                case BREAK -> {
                    Token token = advance();
                    yield new BreakStatement(token.location(), semicolon());
                }
                default -> parseExpressionOrAssignment();
            };
        } finally {
            exitRecursion();
        }
    }

    private IfStatement parseIf() {
        Token ifToken = advance();
        IfStatement result = parseIfRest(ifToken);
        return new IfStatement(result.location(), result.condition(), result.thenBody(), result.elseBody(),
            result.thenLocation(), result.elseLocation(), semicolon());
    }

    /**
     * Parses from the condition after {@code if} or {@code elseif} to the
     * shared {@code end}.
     */
    private IfStatement parseIfRest(Token opening) {
        Expression condition = parseExpression();
        Token then = consume(TokenType.THEN, "Expected 'then' when parsing if statement");
        Block thenBody = parseBody();

        Statement elseBody = null;
        SourceLocation elseLocation = null;
        if (check(TokenType.ELSEIF)) {
            Token elseIf = advance();
            elseLocation = elseIf.location();
            elseBody = parseIfRest(elseIf);
        } else if (check(TokenType.ELSE)) {
            Token elseToken = advance();
            elseLocation = elseToken.location();
            elseBody = parseBody();
            consumeMatch(TokenType.END, "end", opening);
        } else {
            consumeMatch(TokenType.END, "end", opening);
        }
        return new IfStatement(span(opening.start()), condition, thenBody, elseBody, then.location(), elseLocation,
            false);
    }

    private WhileStatement parseWhile() {
        Token whileToken = advance();
        Expression condition = parseExpression();
        Token doToken = consume(TokenType.DO, "Expected 'do' when parsing while loop");
        Block body = parseBody();
        consumeMatch(TokenType.END, "end", whileToken);
        SourceLocation location = span(whileToken.start());
        return new WhileStatement(location, condition, body, doToken.location(), semicolon());
    }

    private Block parseDo() {
        Token doToken = advance();
        int scope = saveScope();
        List<Statement> body = parseStatementList();
        restoreScope(scope);
        Token end = consumeMatch(TokenType.END, "end", doToken);
        Block block = new Block(span(doToken.start()), body, semicolon());
        return decorate(block, new CstDo(end.start()));
    }

    private RepeatStatement parseRepeat() {
        Token repeatToken = advance();
        int scope = saveScope();
        Position bodyStart = repeatToken.end();
        List<Statement> statements = parseStatementList();
        Block body = new Block(new SourceLocation(bodyStart, peek().start()), statements, false);
        Token until = consumeMatch(TokenType.UNTIL, "until", repeatToken);
        // the condition sees the body's locals
        Expression condition = parseExpression();
        restoreScope(scope);
        SourceLocation location = span(repeatToken.start());
        return decorate(new RepeatStatement(location, body, condition, semicolon()), new CstRepeat(until.start()));
    }

    private Statement parseFor() {
        Token forToken = advance();
        Token name = consumeName("for loop");

        Position colon = null;
        TypeAnnotation annotation = null;
        if (check(TokenType.COLON)) {
            colon = advance().start();
            annotation = parseType();
        }
        Local first = new Local(name.lexeme(), name.location(), annotation);

        if (check(TokenType.ASSIGN)) {
            Position equalsSign = advance().start();
            Expression from = parseExpression();
            Position endComma = consume(TokenType.COMMA, "Expected ',' when parsing for loop").start();
            Expression to = parseExpression();
            Position stepComma = null;
            Expression step = null;
            if (check(TokenType.COMMA)) {
                stepComma = advance().start();
                step = parseExpression();
            }
            Token doToken = consume(TokenType.DO, "Expected 'do' when parsing for loop");
            int scope = saveScope();
            declare(first);
            Block body = parseBody();
            restoreScope(scope);
            consumeMatch(TokenType.END, "end", forToken);
            SourceLocation location = span(forToken.start());
            ForStatement statement = new ForStatement(location, first, from, to, step, body, doToken.location(),
                semicolon());
            return decorate(statement, new CstFor(colon, equalsSign, endComma, stepComma));
        }

        List<Local> vars = new ArrayList<>(List.of(first));
        List<Position> colons = new ArrayList<>();
        colons.add(colon);
        List<Position> varCommas = new ArrayList<>();
        while (check(TokenType.COMMA)) {
            varCommas.add(advance().start());
            vars.add(parseBinding("for loop", colons));
        }
        Token in = consume(TokenType.IN, "Expected '=' or 'in' when parsing for loop");
        List<Position> valueCommas = new ArrayList<>();
        List<Expression> values = parseExpressionList(valueCommas);
        Token doToken = consume(TokenType.DO, "Expected 'do' when parsing for loop");
        int scope = saveScope();
        vars.forEach(this::declare);
        Block body = parseBody();
        restoreScope(scope);
        consumeMatch(TokenType.END, "end", forToken);
        SourceLocation location = span(forToken.start());
        ForInStatement statement = new ForInStatement(location, vars, values, body, in.location(),
            doToken.location(), semicolon());
        return decorate(statement, new CstForIn(colons, varCommas, valueCommas));
    }

    /**
     * A name with an optional annotation; the colon position, or null, is
     * appended to {@code colons}.
     */
    private Local parseBinding(String context, List<Position> colons) {
        Token name = consumeName(context);
        TypeAnnotation annotation = null;
        Position colon = null;
        if (check(TokenType.COLON)) {
            colon = advance().start();
            annotation = parseType();
        }
        colons.add(colon);
        return new Local(name.lexeme(), name.location(), annotation);
    }

    private FunctionStatement parseFunctionStatement() {
        Token functionToken = advance();
        Token name = consumeName("function name");
        Expression target = resolve(name);
        String debugName = name.lexeme();
        boolean method = false;

        while (check(TokenType.DOT) || check(TokenType.COLON)) {
            Token op = advance();
            Token field = consumeName("field name");
            target = new IndexNameExpression(span(target.location().start()), target, field.lexeme(),
                field.location(), op.start(), op.lexeme().charAt(0));
            debugName = field.lexeme();
            if (op.type() == TokenType.COLON) {
                method = true;
                break;
            }
        }

        FunctionExpression func = parseFunctionBody(functionToken, method, debugName);
        SourceLocation location = span(functionToken.start());
        return new FunctionStatement(location, target, func, semicolon());
    }

    private Statement parseLocal() {
        Token localToken = advance();

        if (check(TokenType.FUNCTION)) {
            Token functionToken = advance();
            Token name = consumeName("variable name");
            Local local = new Local(name.lexeme(), name.location(), null);
            declare(local);
            FunctionExpression func = parseFunctionBody(functionToken, false, name.lexeme());
            SourceLocation location = span(localToken.start());
            LocalFunctionStatement statement = new LocalFunctionStatement(location, local, func, semicolon());
            return decorate(statement, new CstLocalFunction(functionToken.start()));
        }

        List<Position> colons = new ArrayList<>();
        List<Position> varCommas = new ArrayList<>();
        List<Local> vars = new ArrayList<>();
        vars.add(parseBinding("variable name", colons));
        while (check(TokenType.COMMA)) {
            varCommas.add(advance().start());
            vars.add(parseBinding("variable name", colons));
        }

        SourceLocation equalsSign = null;
        List<Expression> values = List.of();
        List<Position> valueCommas = new ArrayList<>();
        if (check(TokenType.ASSIGN)) {
            equalsSign = advance().location();
            values = parseExpressionList(valueCommas);
        }
        vars.forEach(this::declare);

        SourceLocation location = span(localToken.start());
        LocalStatement statement = new LocalStatement(location, vars, values, equalsSign, semicolon());
        return decorate(statement, new CstLocal(colons, varCommas, valueCommas));
    }

    private ReturnStatement parseReturn() {
        Token returnToken = advance();
        List<Position> commas = new ArrayList<>();
        List<Expression> list = List.of();
        if (!isBlockEnd() && !check(TokenType.SEMICOLON)) {
            list = parseExpressionList(commas);
        }
        SourceLocation location = span(returnToken.start());
        return decorate(new ReturnStatement(location, list, semicolon()), new CstReturn(commas));
    }

    private Statement parseExpressionOrAssignment() {
        Position start = peek().start();
        Expression expr = parseSuffixedExpression();

        if (check(TokenType.COMMA) || check(TokenType.ASSIGN)) {
            return parseAssignment(start, expr);
        }

        BinaryOperator compound = compoundOperator(peek().type());
        if (compound != null) {
            checkAssignable(expr);
            Position op = advance().start();
            Expression value = parseExpression();
            SourceLocation location = span(start);
            CompoundAssignStatement statement = new CompoundAssignStatement(location, compound, expr, value,
                semicolon());
            return decorate(statement, new CstCompoundAssign(op));
        }

        if (expr instanceof CallExpression) {
            return new ExpressionStatement(expr.location(), expr, semicolon());
        }

        // Contextual keywords parse as a bare name first
        String ident = identifierName(expr);
        if ("type".equals(ident) && (check(TokenType.NAME) || check(TokenType.FUNCTION))) {
            return parseTypeAlias(start, null, false);
        }
        if ("export".equals(ident) && check(TokenType.NAME) && "type".equals(peek().lexeme())) {
            Token typeToken = advance();
            return parseTypeAlias(start, typeToken, true);
        }
        if ("continue".equals(ident)) {
            return new ContinueStatement(expr.location(), semicolon());
        }

        throw new ParseException("Incomplete statement: expected assignment or a function call", expr.location());
    }

    private static String identifierName(Expression expr) {
        if (expr instanceof GlobalExpression global) {
            return global.name();
        }
        if (expr instanceof LocalExpression local) {
            return local.local().name();
        }
        return null;
    }

    private AssignStatement parseAssignment(Position start, Expression first) {
        List<Expression> vars = new ArrayList<>();
        List<Position> varCommas = new ArrayList<>();
        checkAssignable(first);
        vars.add(first);
        while (check(TokenType.COMMA)) {
            varCommas.add(advance().start());
            Expression var = parseSuffixedExpression();
            checkAssignable(var);
            vars.add(var);
        }
        Position equalsSign = consume(TokenType.ASSIGN, "Expected '=' when parsing assignment").start();
        List<Position> valueCommas = new ArrayList<>();
        List<Expression> values = parseExpressionList(valueCommas);
        SourceLocation location = span(start);
        AssignStatement statement = new AssignStatement(location, vars, values, semicolon());
        return decorate(statement, new CstAssign(varCommas, equalsSign, valueCommas));
    }

    private static void checkAssignable(Expression expr) {
        if (!(expr instanceof LocalExpression || expr instanceof GlobalExpression
            || expr instanceof IndexNameExpression || expr instanceof IndexExpression)) {
            throw new ParseException("Assigned expression must be a variable or a field", expr.location());
        }
    }

    private static BinaryOperator compoundOperator(TokenType type) {
        return switch (type) {
            case PLUS_ASSIGN -> BinaryOperator.ADD;
            case MINUS_ASSIGN -> BinaryOperator.SUB;
            case STAR_ASSIGN -> BinaryOperator.MUL;
            case SLASH_ASSIGN -> BinaryOperator.DIV;
            case DOUBLE_SLASH_ASSIGN -> BinaryOperator.FLOOR_DIV;
            case PERCENT_ASSIGN -> BinaryOperator.MOD;
            case CARET_ASSIGN -> BinaryOperator.POW;
            case CONCAT_ASSIGN -> BinaryOperator.CONCAT;
            default -> null;
        };
    }

    /**
     * Parses the rest of a type alias or type function after the contextual
     * {@code type} keyword.
     *
     * @param typeToken the {@code type} token when it followed {@code export};
     *                  otherwise the keyword is the name token just parsed
     */
    private Statement parseTypeAlias(Position start, Token typeToken, boolean exported) {
        Position typeKeyword = typeToken != null ? typeToken.start() : previous().start();

        if (check(TokenType.FUNCTION)) {
            Token functionToken = advance();
            Token name = consumeName("type function name");
            FunctionExpression body = parseFunctionBody(functionToken, false, name.lexeme());
            SourceLocation location = span(start);
            TypeFunctionStatement statement = new TypeFunctionStatement(location, name.lexeme(), name.location(),
                body, exported, semicolon());
            return decorate(statement, new CstTypeFunction(typeKeyword, functionToken.start()));
        }

        Token name = consumeName("type name");
        GenericList generics = GenericList.EMPTY;
        if (check(TokenType.LT)) {
            generics = parseGenericList(true);
        }
        Position equalsSign = consume(TokenType.ASSIGN, "Expected '=' when parsing type alias").start();
        TypeAnnotation type = parseType();
        SourceLocation location = span(start);
        TypeAliasStatement statement = new TypeAliasStatement(location, name.lexeme(), name.location(),
            generics.types(), generics.packs(), type, exported, semicolon());
        return decorate(statement, new CstTypeAlias(typeKeyword, generics.open(), generics.commas(),
            generics.close(), equalsSign));
    }

    // ========================================================================
    // Functions
    // ========================================================================

    private record GenericList(
        List<GenericTypeParameter> types,
        List<GenericPackParameter> packs,
        Position open,
        List<Position> commas,
        Position close
    ) {
        static final GenericList EMPTY = new GenericList(List.of(), List.of(), null, List.of(), null);
    }

    private GenericList parseGenericList(boolean withDefaults) {
        Position open = advance().start();
        List<GenericTypeParameter> types = new ArrayList<>();
        List<GenericPackParameter> packs = new ArrayList<>();
        List<Position> commas = new ArrayList<>();

        while (true) {
            Token name = consumeName("generic type name");
            if (check(TokenType.DOT3)) {
                Position ellipsis = advance().start();
                Position equalsSign = null;
                TypePack defaultValue = null;
                if (withDefaults && check(TokenType.ASSIGN)) {
                    equalsSign = advance().start();
                    defaultValue = parseTypePackDefault();
                }
                GenericPackParameter pack = new GenericPackParameter(span(name.start()), name.lexeme(), defaultValue);
                packs.add(decorate(pack, new CstGenericTypePack(ellipsis, equalsSign)));
            } else {
                if (!packs.isEmpty()) {
                    throw new ParseException("Generic types come before generic type packs", name.location());
                }
                Position equalsSign = null;
                TypeAnnotation defaultValue = null;
                if (withDefaults && check(TokenType.ASSIGN)) {
                    equalsSign = advance().start();
                    defaultValue = parseType();
                }
                GenericTypeParameter type = new GenericTypeParameter(span(name.start()), name.lexeme(), defaultValue);
                types.add(decorate(type, new CstGenericType(equalsSign)));
            }
            if (!check(TokenType.COMMA)) {
                break;
            }
            commas.add(advance().start());
        }
        Position close = consume(TokenType.GT, "Expected '>' when parsing generic type list").start();
        return new GenericList(types, packs, open, commas, close);
    }

    private TypePack parseTypePackDefault() {
        if (check(TokenType.DOT3) || (check(TokenType.NAME) && checkAhead(1, TokenType.DOT3))) {
            return parseVariadicOrGenericPack();
        }
        if (check(TokenType.LPAREN)) {
            TypeOrPack parsed = parseParenthesizedType(true);
            if (parsed.pack() != null) {
                return parsed.pack();
            }
        }
        throw new ExpectedTokenException("Expected type pack after '=', got " + peek().describe(), peek());
    }

    /**
     * Parses a function body from the generic list to {@code end}.
     *
     * @param method whether the function takes an implicit {@code self}; the
     *               method name must be the token just consumed
     */
    private FunctionExpression parseFunctionBody(Token functionToken, boolean method, String debugName) {
        int scope = saveScope();
        functionDepth++;

        Local self = null;
        if (method) {
            self = new Local("self", previous().location(), null);
            declare(self);
        }

        GenericList generics = GenericList.EMPTY;
        if (check(TokenType.LT)) {
            generics = parseGenericList(false);
        }

        Position openParens = consume(TokenType.LPAREN, "Expected '(' when parsing function").start();
        List<Local> args = new ArrayList<>();
        List<Position> argColons = new ArrayList<>();
        List<Position> argCommas = new ArrayList<>();
        boolean vararg = false;
        SourceLocation varargLocation = null;
        Position varargColon = null;
        TypePack varargAnnotation = null;

        if (!check(TokenType.RPAREN)) {
            while (true) {
                if (check(TokenType.DOT3)) {
                    vararg = true;
                    varargLocation = advance().location();
                    if (check(TokenType.COLON)) {
                        varargColon = advance().start();
                        varargAnnotation = parseVarargAnnotation();
                    }
                    break;
                }
                args.add(parseBinding("function argument", argColons));
                if (!check(TokenType.COMMA)) {
                    break;
                }
                argCommas.add(advance().start());
            }
        }
        Position closeParens = consume(TokenType.RPAREN, "Expected ')' when parsing function").start();

        Position returnSpecifier = null;
        TypePack returnAnnotation = null;
        if (check(TokenType.COLON)) {
            returnSpecifier = advance().start();
            returnAnnotation = parseReturnPack();
        }

        args.forEach(this::declare);
        varargFunctions.push(vararg);
        Block body = parseBody();
        varargFunctions.pop();
        consumeMatch(TokenType.END, "end", functionToken);

        functionDepth--;
        restoreScope(scope);

        FunctionExpression func = new FunctionExpression(span(functionToken.start()), generics.types(),
            generics.packs(), self, args, returnAnnotation, vararg, varargLocation, varargAnnotation, body,
            debugName);
        return decorate(func, new CstFunction(generics.open(), generics.commas(), generics.close(), openParens,
            argColons, argCommas, varargColon, closeParens, returnSpecifier));
    }

    /**
     * The annotation of {@code ...}: a generic pack name, or a type that every
     * extra argument has.
     */
    private TypePack parseVarargAnnotation() {
        if (check(TokenType.NAME) && checkAhead(1, TokenType.DOT3)) {
            return parseVariadicOrGenericPack();
        }
        TypeAnnotation type = parseType();
        return new VariadicTypePack(type.location(), type);
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private Expression parseExpression() {
        return parseExpression(0);
    }

    private List<Expression> parseExpressionList(List<Position> commas) {
        List<Expression> list = new ArrayList<>();
        list.add(parseExpression());
        while (check(TokenType.COMMA)) {
            commas.add(advance().start());
            list.add(parseExpression());
        }
        return list;
    }

    /**
     * Parses operators binding tighter than {@code limit}.
     */
    private Expression parseExpression(int limit) {
        enterRecursion();
        Position start = peek().start();

        Expression left;
        UnaryOperator unary = unaryOperator(peek().type());
        if (unary != null) {
            Token op = advance();
            Expression operand = parseExpression(UNARY_PRIORITY);
            left = decorate(new UnaryExpression(span(start), unary, operand), new CstOperator(op.start()));
        } else {
            left = parseAssertionExpression();
        }

        BinaryOperator binary = binaryOperator(peek().type());
        while (binary != null && binary.leftPriority() > limit) {
            Token op = advance();
            Expression right = parseExpression(binary.rightPriority());
            SourceLocation location = SourceLocation.span(left.location(), right.location());
            left = decorate(new BinaryExpression(location, binary, left, right), new CstOperator(op.start()));
            binary = binaryOperator(peek().type());
        }

        exitRecursion();
        return left;
    }

    private static UnaryOperator unaryOperator(TokenType type) {
        return switch (type) {
            case NOT -> UnaryOperator.NOT;
            case MINUS -> UnaryOperator.MINUS;
            case HASH -> UnaryOperator.LEN;
            default -> null;
        };
    }

    private static BinaryOperator binaryOperator(TokenType type) {
        return switch (type) {
            case PLUS -> BinaryOperator.ADD;
            case MINUS -> BinaryOperator.SUB;
            case STAR -> BinaryOperator.MUL;
            case SLASH -> BinaryOperator.DIV;
            case DOUBLE_SLASH -> BinaryOperator.FLOOR_DIV;
            case PERCENT -> BinaryOperator.MOD;
            case CARET -> BinaryOperator.POW;
            case DOT2 -> BinaryOperator.CONCAT;
            case NE -> BinaryOperator.COMPARE_NE;
            case EQ -> BinaryOperator.COMPARE_EQ;
            case LT -> BinaryOperator.COMPARE_LT;
            case LE -> BinaryOperator.COMPARE_LE;
            case GT -> BinaryOperator.COMPARE_GT;
            case GE -> BinaryOperator.COMPARE_GE;
            case AND -> BinaryOperator.AND;
            case OR -> BinaryOperator.OR;
            default -> null;
        };
    }

    private Expression parseAssertionExpression() {
        Position start = peek().start();
        Expression expr = parseSimpleExpression();
        if (check(TokenType.DOUBLE_COLON)) {
            Position op = advance().start();
            TypeAnnotation annotation = parseType();
            return decorate(new TypeAssertionExpression(span(start), expr, annotation), new CstTypeAssertion(op));
        }
        return expr;
    }

    private Expression parseSimpleExpression() {
        Token token = peek();
        switch (token.type()) {
            case NIL:
                advance();
                return new NilExpression(token.location());
            case TRUE:
            case FALSE:
                advance();
                return new BooleanExpression(token.location(), token.type() == TokenType.TRUE);
            case NUMBER:
                advance();
                return decorate(new NumberExpression(token.location(), parseNumber(token)),
                    new CstConstantNumber(token.lexeme()));
            case STRING:
            case RAW_STRING:
            case INTERP_SIMPLE:
                advance();
                return parseStringLiteral(token);
            case INTERP_BEGIN:
                return parseInterpString();
            case DOT3:
                advance();
                if (!Boolean.TRUE.equals(varargFunctions.peek())) {
                    throw new ParseException("Cannot use '...' outside of a vararg function", token.location());
                }
                return new VarargsExpression(token.location());
            case LBRACE:
                return parseTable();
            case FUNCTION:
                advance();
                return parseFunctionBody(token, false, null);
            case IF:
                advance();
                return parseIfElseExpression(token);
            default:
                return parseSuffixedExpression();
        }
    }

    private StringExpression parseStringLiteral(Token token) {
        StringExpression expr = new StringExpression(token.location(), token.literal());
        return decorate(expr, new CstConstantString(token.lexeme(), token.quoteStyle(), token.depth()));
    }

    private InterpStringExpression parseInterpString() {
        Position start = peek().start();
        List<String> strings = new ArrayList<>();
        List<String> sourceStrings = new ArrayList<>();
        List<Position> positions = new ArrayList<>();
        List<Expression> expressions = new ArrayList<>();

        while (true) {
            Token segment = advance();
            strings.add(segment.literal());
            sourceStrings.add(segment.lexeme());
            positions.add(segment.start());
            if (segment.type() == TokenType.INTERP_END) {
                break;
            }
            if (check(TokenType.INTERP_MID) || check(TokenType.INTERP_END)) {
                throw new ExpectedTokenException(
                    "Malformed interpolated string, expected expression inside '{}'", peek());
            }
            expressions.add(parseExpression());
            if (!check(TokenType.INTERP_MID) && !check(TokenType.INTERP_END)) {
                throw new ExpectedTokenException("Malformed interpolated string; did you forget to add a '}'?",
                    peek());
            }
        }
        InterpStringExpression expr = new InterpStringExpression(span(start), strings, expressions);
        return decorate(expr, new CstInterpString(sourceStrings, positions));
    }

    private TableExpression parseTable() {
        Token open = advance();
        List<TableItem> items = new ArrayList<>();
        List<CstTable.Item> cstItems = new ArrayList<>();

        while (!check(TokenType.RBRACE)) {
            TableItem item;
            Position indexerOpen = null;
            Position indexerClose = null;
            Position equalsSign = null;
            if (check(TokenType.LBRACKET)) {
                indexerOpen = advance().start();
                Expression key = parseExpression();
                indexerClose = consume(TokenType.RBRACKET, "Expected ']' when parsing table key").start();
                equalsSign = consume(TokenType.ASSIGN, "Expected '=' when parsing table field").start();
                item = new TableItem(TableItem.Kind.GENERAL, key, parseExpression());
            } else if (check(TokenType.NAME) && checkAhead(1, TokenType.ASSIGN)) {
                Token name = advance();
                equalsSign = advance().start();
                Expression key = new StringExpression(name.location(), name.lexeme());
                item = new TableItem(TableItem.Kind.RECORD, key, parseExpression());
            } else {
                item = new TableItem(TableItem.Kind.LIST, null, parseExpression());
            }
            items.add(item);

            Separator separator = null;
            Position separatorPosition = null;
            if (check(TokenType.COMMA) || check(TokenType.SEMICOLON)) {
                Token token = advance();
                separator = token.type() == TokenType.COMMA ? Separator.COMMA : Separator.SEMICOLON;
                separatorPosition = token.start();
            }
            cstItems.add(new CstTable.Item(item.itemKind(), indexerOpen, indexerClose, equalsSign, separator,
                separatorPosition));
            if (separator == null) {
                break;
            }
        }
        consumeMatch(TokenType.RBRACE, "}", open);
        return decorate(new TableExpression(span(open.start()), items), new CstTable(cstItems));
    }

    private IfElseExpression parseIfElseExpression(Token opening) {
        Expression condition = parseExpression();
        Position then = consume(TokenType.THEN, "Expected 'then' when parsing if-then-else expression").start();
        Expression trueExpr = parseExpression();

        Position elsePosition;
        Expression falseExpr;
        boolean elseIf = check(TokenType.ELSEIF);
        if (elseIf) {
            Token elseIfToken = advance();
            elsePosition = elseIfToken.start();
            falseExpr = parseIfElseExpression(elseIfToken);
        } else {
            elsePosition = consume(TokenType.ELSE, "Expected 'else' when parsing if-then-else expression").start();
            falseExpr = parseExpression();
        }
        IfElseExpression expr = new IfElseExpression(span(opening.start()), condition, trueExpr, falseExpr);
        return decorate(expr, new CstIfElse(then, elsePosition, elseIf));
    }

    private Expression parsePrimaryExpression() {
        Token token = peek();
        if (check(TokenType.NAME)) {
            advance();
            return resolve(token);
        }
        if (check(TokenType.LPAREN)) {
            advance();
            Expression inner = parseExpression();
            consumeMatch(TokenType.RPAREN, ")", token);
            return new GroupExpression(span(token.start()), inner);
        }
        throw new ExpectedTokenException("Expected identifier when parsing expression, got " + token.describe(),
            token);
    }

    private Expression parseSuffixedExpression() {
        Position start = peek().start();
        Expression expr = parsePrimaryExpression();

        while (true) {
            Token token = peek();
            switch (token.type()) {
                case DOT -> {
                    advance();
                    Token name = consumeName("field name");
                    expr = new IndexNameExpression(span(start), expr, name.lexeme(), name.location(), token.start(),
                        '.');
                }
                case LBRACKET -> {
                    Position open = advance().start();
                    Expression index = parseExpression();
                    Position close = consumeMatch(TokenType.RBRACKET, "]", token).start();
                    expr = decorate(new IndexExpression(span(start), expr, index), new CstIndexExpression(open, close));
                }
                case COLON -> {
                    advance();
                    Token name = consumeName("method name");
                    Expression method = new IndexNameExpression(span(start), expr, name.lexeme(), name.location(),
                        token.start(), ':');
                    if (!check(TokenType.LPAREN) && !check(TokenType.LBRACE) && !check(TokenType.STRING)
                        && !check(TokenType.RAW_STRING)) {
                        throw new ExpectedTokenException(
                            "Expected '(', '{' or <string> when parsing function call, got " + peek().describe(),
                            peek());
                    }
                    expr = parseCallArguments(start, method, true);
                }
                case LPAREN -> {
                    if (token.start().line() != previous().end().line()) {
                        throw new ParseException("Ambiguous syntax: this looks like an argument list for a "
                            + "function call, but could also be a start of new statement; use ';' to separate "
                            + "statements", token.location());
                    }
                    expr = parseCallArguments(start, expr, false);
                }
                case LBRACE, STRING, RAW_STRING -> expr = parseCallArguments(start, expr, false);
                default -> {
                    return expr;
                }
            }
        }
    }

    private CallExpression parseCallArguments(Position start, Expression func, boolean self) {
        Token token = peek();
        if (token.type() == TokenType.LPAREN) {
            advance();
            List<Position> commas = new ArrayList<>();
            List<Expression> args = check(TokenType.RPAREN) ? List.of() : parseExpressionList(commas);
            Token close = consumeMatch(TokenType.RPAREN, ")", token);
            SourceLocation argLocation = new SourceLocation(token.start(), close.end());
            CallExpression call = new CallExpression(span(start), func, args, self, argLocation);
            return decorate(call, new CstCall(token.start(), close.start(), commas));
        }
        Expression arg;
        if (token.type() == TokenType.LBRACE) {
            arg = parseTable();
        } else {
            advance();
            arg = parseStringLiteral(token);
        }
        CallExpression call = new CallExpression(span(start), func, List.of(arg), self, arg.location());
        return decorate(call, new CstCall(null, null, List.of()));
    }

    private double parseNumber(Token token) {
        String text = token.lexeme().replace("_", "");
        if (text.length() > 1 && text.charAt(0) == '0' && (text.charAt(1) == 'x' || text.charAt(1) == 'X')) {
            return parseInteger(token, text.substring(2), HEX, 16, 16);
        }
        if (text.length() > 1 && text.charAt(0) == '0' && (text.charAt(1) == 'b' || text.charAt(1) == 'B')) {
            return parseInteger(token, text.substring(2), BINARY, 2, 64);
        }
        if (!DECIMAL.matcher(text).matches()) {
            throw new ParseException("Malformed number", token.location());
        }
        return Double.parseDouble(text);
    }

    private static double parseInteger(Token token, String digits, Pattern pattern, int radix, int maxDigits) {
        if (!pattern.matcher(digits).matches()) {
            throw new ParseException("Malformed number", token.location());
        }
        String significant = digits.replaceFirst("^0+(?=.)", "");
        if (significant.length() > maxDigits) {
            throw new ParseException("Integer number value is out of range", token.location());
        }
        long value = Long.parseUnsignedLong(significant, radix);
        if (value >= 0) {
            return value;
        }
        // unsigned 64-bit value, halved to stay in range and doubled back
        return (double) ((value >>> 1) | (value & 1)) * 2.0;
    }

    // ========================================================================
    // Types
    // ========================================================================

    /**
     * Either a type or a type pack; parentheses can start both.
     */
    private record TypeOrPack(TypeAnnotation type, ExplicitTypePack pack, CstExplicitTypePack packCst) {
    }

    private TypeAnnotation parseType() {
        enterRecursion();
        Position start = peek().start();
        Token leading = null;
        if (check(TokenType.PIPE) || check(TokenType.AMPERSAND)) {
            leading = advance();
        }
        TypeAnnotation first = parseSimpleType();
        TypeAnnotation result = parseTypeSuffix(start, leading, first);
        exitRecursion();
        return result;
    }

    private TypeAnnotation parseTypeSuffix(Position start, Token leading, TypeAnnotation first) {
        List<TypeAnnotation> parts = new ArrayList<>();
        parts.add(first);
        List<Position> separators = new ArrayList<>();
        boolean union = leading != null && leading.type() == TokenType.PIPE;
        boolean intersection = leading != null && leading.type() == TokenType.AMPERSAND;

        while (true) {
            if (check(TokenType.PIPE)) {
                separators.add(advance().start());
                parts.add(parseSimpleType());
                union = true;
            } else if (check(TokenType.QUESTION)) {
                parts.add(new OptionalType(advance().location()));
                union = true;
            } else if (check(TokenType.AMPERSAND)) {
                separators.add(advance().start());
                parts.add(parseSimpleType());
                intersection = true;
            } else {
                break;
            }
            if (union && intersection) {
                throw new ParseException("Mixing union and intersection types is not allowed; consider wrapping in "
                    + "parentheses", span(start));
            }
        }

        if (parts.size() == 1 && leading == null) {
            return first;
        }
        Position leadingPosition = leading != null ? leading.start() : null;
        if (union) {
            return decorate(new UnionType(span(start), parts), new CstUnionType(leadingPosition, separators));
        }
        return decorate(new IntersectionType(span(start), parts), new CstIntersectionType(leadingPosition, separators));
    }

    private TypeAnnotation parseSimpleType() {
        Token token = peek();
        switch (token.type()) {
            case NIL:
                advance();
                return decorate(new TypeReference(token.location(), null, null, "nil", token.location(), false,
                    List.of()), new CstTypeReference(null, null, List.of(), null));
            case TRUE:
            case FALSE:
                advance();
                return new SingletonBoolType(token.location(), token.type() == TokenType.TRUE);
            case STRING:
            case RAW_STRING:
                advance();
                return decorate(new SingletonStringType(token.location(), token.literal()),
                    new CstSingletonString(token.lexeme(), token.quoteStyle(), token.depth()));
            case INTERP_SIMPLE:
            case INTERP_BEGIN:
                throw new UnexpectedTokenException(token, "in type; interpolated string literals cannot be used as types");
            case NAME:
                if (token.lexeme().equals("typeof") && checkAhead(1, TokenType.LPAREN)) {
                    return parseTypeof();
                }
                return parseTypeReference();
            case LBRACE:
                return parseTableType();
            case LPAREN:
            case LT: {
                TypeOrPack parsed = parseParenthesizedType(false);
                return parsed.type();
            }
            default:
                throw new ExpectedTokenException("Expected type, got " + token.describe(), token);
        }
    }

    private TypeofType parseTypeof() {
        Token typeofToken = advance();
        Token open = advance();
        Expression expr = parseExpression();
        Position close = consumeMatch(TokenType.RPAREN, ")", open).start();
        return decorate(new TypeofType(span(typeofToken.start()), expr), new CstTypeof(open.start(), close));
    }

    private TypeReference parseTypeReference() {
        Token first = advance();
        String prefix = null;
        SourceLocation prefixLocation = null;
        Position prefixPoint = null;
        Token name = first;
        if (check(TokenType.DOT) && checkAhead(1, TokenType.NAME)) {
            prefix = first.lexeme();
            prefixLocation = first.location();
            prefixPoint = advance().start();
            name = advance();
        }

        boolean hasParameterList = false;
        List<TypeParameter> parameters = new ArrayList<>();
        Position open = null;
        List<Position> commas = new ArrayList<>();
        Position close = null;
        if (check(TokenType.LT)) {
            hasParameterList = true;
            Token openToken = advance();
            open = openToken.start();
            while (!check(TokenType.GT)) {
                parameters.add(parseTypeParameter());
                if (!check(TokenType.COMMA)) {
                    break;
                }
                commas.add(advance().start());
            }
            close = consumeMatch(TokenType.GT, ">", openToken).start();
        }

        TypeReference type = new TypeReference(span(first.start()), prefix, prefixLocation, name.lexeme(),
            name.location(), hasParameterList, parameters);
        return decorate(type, new CstTypeReference(prefixPoint, open, commas, close));
    }

    private TypeParameter parseTypeParameter() {
        if (check(TokenType.DOT3) || (check(TokenType.NAME) && checkAhead(1, TokenType.DOT3))) {
            return new TypeParameter(null, parseVariadicOrGenericPack());
        }
        if (check(TokenType.LPAREN)) {
            Position start = peek().start();
            TypeOrPack parsed = parseParenthesizedType(true);
            if (parsed.pack() != null && !continuesType()) {
                return new TypeParameter(null, decorate(parsed.pack(), parsed.packCst()));
            }
            TypeAnnotation type = parsed.type() != null ? parsed.type() : groupOf(parsed.pack());
            return new TypeParameter(parseTypeSuffix(start, null, type), null);
        }
        return new TypeParameter(parseType(), null);
    }

    private boolean continuesType() {
        return check(TokenType.PIPE) || check(TokenType.AMPERSAND) || check(TokenType.QUESTION);
    }

    /**
     * Reinterprets a parenthesized single type, first parsed as a pack, as a
     * group.
     */
    private GroupType groupOf(ExplicitTypePack pack) {
        List<TypeAnnotation> types = pack.typeList().types();
        if (types.size() != 1 || pack.typeList().tailType() != null) {
            throw new ExpectedTokenException("Expected '->' when parsing function type, got " + peek().describe(),
                peek());
        }
        return new GroupType(pack.location(), types.get(0));
    }

    private TypePack parseVariadicOrGenericPack() {
        if (check(TokenType.DOT3)) {
            Token ellipsis = advance();
            TypeAnnotation type = parseType();
            return new VariadicTypePack(span(ellipsis.start()), type);
        }
        Token name = advance();
        Position ellipsis = advance().start();
        return decorate(new GenericTypePack(span(name.start()), name.lexeme()),
            new CstGenericTypePackReference(ellipsis));
    }

    /**
     * Parses what starts with {@code (} or {@code <}: a function type, a group
     * or, when {@code allowPack} is set, a parenthesized type pack. A returned
     * pack is not yet recorded in the CST map.
     */
    private TypeOrPack parseParenthesizedType(boolean allowPack) {
        Position start = peek().start();
        GenericList generics = GenericList.EMPTY;
        if (check(TokenType.LT)) {
            generics = parseGenericList(false);
        }

        Token open = consume(TokenType.LPAREN, "Expected '(' when parsing function parameters");
        List<TypeAnnotation> types = new ArrayList<>();
        List<ArgumentName> names = new ArrayList<>();
        List<Position> nameColons = new ArrayList<>();
        List<Position> commas = new ArrayList<>();
        TypePack tail = null;
        boolean anyName = false;

        if (!check(TokenType.RPAREN)) {
            while (true) {
                if (check(TokenType.DOT3) || (check(TokenType.NAME) && checkAhead(1, TokenType.DOT3))) {
                    tail = parseVariadicOrGenericPack();
                    break;
                }
                if (check(TokenType.NAME) && checkAhead(1, TokenType.COLON)) {
                    Token name = advance();
                    names.add(new ArgumentName(name.lexeme(), name.location()));
                    nameColons.add(advance().start());
                    anyName = true;
                } else {
                    names.add(null);
                    nameColons.add(null);
                }
                types.add(parseType());
                if (!check(TokenType.COMMA)) {
                    break;
                }
                commas.add(advance().start());
            }
        }
        Position close = consumeMatch(TokenType.RPAREN, ")", open).start();

        if (check(TokenType.ARROW)) {
            Position arrow = advance().start();
            TypePack returnTypes = parseReturnPack();
            FunctionType type = new FunctionType(span(start), generics.types(), generics.packs(),
                new TypeList(types, tail), anyName ? names : List.of(), returnTypes);
            return new TypeOrPack(decorate(type, new CstFunctionType(generics.open(), generics.commas(),
                generics.close(), open.start(), nameColons, commas, close, arrow)), null, null);
        }

        if (generics.open() != null || anyName || !(allowPack || (types.size() == 1 && tail == null))) {
            throw new ExpectedTokenException("Expected '->' when parsing function type, got " + peek().describe(),
                peek());
        }
        if (allowPack) {
            ExplicitTypePack pack = new ExplicitTypePack(span(start), new TypeList(types, tail));
            return new TypeOrPack(null, pack, new CstExplicitTypePack(open.start(), commas, close));
        }
        return new TypeOrPack(new GroupType(span(start), types.get(0)), null, null);
    }

    /**
     * Parses the return types after a function's {@code :} or a function
     * type's {@code ->}.
     */
    private TypePack parseReturnPack() {
        if (check(TokenType.DOT3) || (check(TokenType.NAME) && checkAhead(1, TokenType.DOT3))) {
            return parseVariadicOrGenericPack();
        }
        Position start = peek().start();
        if (check(TokenType.LPAREN) || check(TokenType.LT)) {
            TypeOrPack parsed = parseParenthesizedType(true);
            if (parsed.pack() != null && !continuesType()) {
                return decorate(parsed.pack(), parsed.packCst());
            }
            TypeAnnotation type = parsed.type() != null ? parsed.type() : groupOf(parsed.pack());
            TypeAnnotation full = parseTypeSuffix(start, null, type);
            return decorate(new ExplicitTypePack(full.location(), new TypeList(List.of(full), null)),
                new CstExplicitTypePack(null, List.of(), null));
        }
        TypeAnnotation type = parseType();
        return decorate(new ExplicitTypePack(type.location(), new TypeList(List.of(type), null)),
            new CstExplicitTypePack(null, List.of(), null));
    }

    private TableType parseTableType() {
        Token open = advance();

        if (!check(TokenType.RBRACE) && !check(TokenType.LBRACKET)
            && !(check(TokenType.NAME) && checkAhead(1, TokenType.COLON))) {
            TypeAnnotation element = parseType();
            consumeMatch(TokenType.RBRACE, "}", open);
            TypeReference number = new TypeReference(element.location(), null, null, "number", element.location(),
                false, List.of());
            TableIndexer indexer = new TableIndexer(element.location(), number, element);
            return decorate(new TableType(span(open.start()), List.of(), indexer), new CstTableType(List.of(), true));
        }

        List<TableProperty> props = new ArrayList<>();
        TableIndexer indexer = null;
        List<CstTableType.Item> items = new ArrayList<>();

        while (!check(TokenType.RBRACE)) {
            CstTableType.Item.Kind kind;
            Position indexerOpen = null;
            Position indexerClose = null;
            Position colon;
            CstConstantString stringInfo = null;
            Position stringPosition = null;

            if (check(TokenType.LBRACKET) && (checkAhead(1, TokenType.STRING) || checkAhead(1, TokenType.RAW_STRING))
                && checkAhead(2, TokenType.RBRACKET)) {
                kind = CstTableType.Item.Kind.STRING_PROPERTY;
                indexerOpen = advance().start();
                Token key = advance();
                stringInfo = new CstConstantString(key.lexeme(), key.quoteStyle(), key.depth());
                stringPosition = key.start();
                indexerClose = advance().start();
                colon = consume(TokenType.COLON, "Expected ':' when parsing table property").start();
                props.add(new TableProperty(key.literal(), key.location(), parseType()));
            } else if (check(TokenType.LBRACKET)) {
                kind = CstTableType.Item.Kind.INDEXER;
                Token bracket = advance();
                indexerOpen = bracket.start();
                if (indexer != null) {
                    throw new ParseException("Cannot have more than one table indexer", bracket.location());
                }
                TypeAnnotation indexType = parseType();
                indexerClose = consumeMatch(TokenType.RBRACKET, "]", bracket).start();
                colon = consume(TokenType.COLON, "Expected ':' when parsing table indexer").start();
                TypeAnnotation resultType = parseType();
                indexer = new TableIndexer(span(bracket.start()), indexType, resultType);
            } else {
                kind = CstTableType.Item.Kind.PROPERTY;
                Token name = consumeName("table field");
                colon = consume(TokenType.COLON, "Expected ':' when parsing table field").start();
                props.add(new TableProperty(name.lexeme(), name.location(), parseType()));
            }

            Separator separator = null;
            Position separatorPosition = null;
            if (check(TokenType.COMMA) || check(TokenType.SEMICOLON)) {
                Token token = advance();
                separator = token.type() == TokenType.COMMA ? Separator.COMMA : Separator.SEMICOLON;
                separatorPosition = token.start();
            }
            items.add(new CstTableType.Item(kind, indexerOpen, indexerClose, colon, separator, separatorPosition,
                stringInfo, stringPosition));
            if (separator == null) {
                break;
            }
        }
        consumeMatch(TokenType.RBRACE, "}", open);
        return decorate(new TableType(span(open.start()), props, indexer), new CstTableType(items, false));
    }
}

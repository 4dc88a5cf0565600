package org.pycatalyst.compiler.frontend.parser;

import org.pycatalyst.compiler.diagnostics.DiagnosticsEngine;
import org.pycatalyst.compiler.frontend.lexer.Token;
import org.pycatalyst.compiler.frontend.lexer.TokenType;
import org.pycatalyst.compiler.frontend.parser.ast.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The recursive-descent parser for the script language. It consumes the token list produced by
 * the {@link org.pycatalyst.compiler.frontend.lexer.Lexer} and produces an Abstract Syntax Tree
 * whose nodes carry their source spans.
 * <p>
 * Syntax errors are reported to the {@link DiagnosticsEngine}; the parser then skips the rest of
 * the offending statement (including an indented block that follows it) and continues, so one
 * run reports as many errors as possible.
 */
public class Parser {

    private static final Map<String, BinaryOperator> AUGMENTED_OPERATORS = Map.ofEntries(
            Map.entry("+=", BinaryOperator.ADD), Map.entry("-=", BinaryOperator.SUB),
            Map.entry("*=", BinaryOperator.MULT), Map.entry("/=", BinaryOperator.DIV),
            Map.entry("//=", BinaryOperator.FLOOR_DIV), Map.entry("%=", BinaryOperator.MOD),
            Map.entry("**=", BinaryOperator.POW), Map.entry("<<=", BinaryOperator.LSHIFT),
            Map.entry(">>=", BinaryOperator.RSHIFT), Map.entry("|=", BinaryOperator.BIT_OR),
            Map.entry("&=", BinaryOperator.BIT_AND), Map.entry("^=", BinaryOperator.BIT_XOR),
            Map.entry("@=", BinaryOperator.MAT_MULT));

    private static final Map<String, CompareOperator> COMPARE_OPERATORS = Map.of(
            "==", CompareOperator.EQ, "!=", CompareOperator.NOT_EQ,
            "<", CompareOperator.LT, "<=", CompareOperator.LT_E,
            ">", CompareOperator.GT, ">=", CompareOperator.GT_E);

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses the entire token stream.
     * @param lineCount The number of lines of the source, recorded on the module node.
     * @return The module node holding the top-level statements.
     */
    public ModuleNode parse(int lineCount) {
        List<StatementNode> statements = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(TokenType.NEWLINE)) {
                continue;
            }
            statements.addAll(declaration());
        }
        return new ModuleNode(statements, lineCount);
    }

    /**
     * Parses one statement; a simple statement line with {@code ;} may yield several.
     * @return The parsed statements, empty after a syntax error.
     */
    private List<StatementNode> declaration() {
        int startIndex = current;
        try {
            if (check(TokenType.INDENT)) {
                throw error(peek(), "Unexpected indent.");
            }
            if (check(TokenType.DEDENT)) {
                // A stray dedent can only follow an error that already got reported.
                advance();
                return List.of();
            }
            StatementNode compound = compoundStatement();
            if (compound != null) {
                return List.of(compound);
            }
            return simpleStatements();
        } catch (ParseError e) {
            synchronize(startIndex);
            return List.of();
        }
    }

    private StatementNode compoundStatement() {
        Token token = peek();
        if (token.type() == TokenType.OPERATOR && token.text().equals("@")) {
            return decorated();
        }
        if (token.type() != TokenType.KEYWORD) {
            return null;
        }
        switch (token.text()) {
            case "if":
                return ifStatement(advance(), false);
            case "while":
                return whileStatement(advance());
            case "for":
                return forStatement(advance());
            case "try":
                return tryStatement(advance());
            case "with":
                return withStatement(advance());
            case "def":
                return functionDef(advance(), List.of());
            case "class":
                return classDef(advance(), List.of());
            case "async":
                throw error(token, "Asynchronous statements are not supported.");
            default:
                return null;
        }
    }

    private StatementNode decorated() {
        List<ExpressionNode> decorators = new ArrayList<>();
        while (matchOp("@")) {
            decorators.add(namedExpression());
            consume(TokenType.NEWLINE, "Expected newline after decorator.");
        }
        if (checkKeyword("def")) {
            return functionDef(advance(), decorators);
        }
        if (checkKeyword("class")) {
            return classDef(advance(), decorators);
        }
        throw error(peek(), "Expected 'def' or 'class' after decorator.");
    }

    private IfNode ifStatement(Token keyword, boolean elif) {
        ExpressionNode test = namedExpression();
        consumeOp(":", "Expected ':' after if condition.");
        List<StatementNode> body = block();
        List<StatementNode> orElse = List.of();
        int elseLine = 0;
        if (checkKeyword("elif")) {
            orElse = List.of(ifStatement(advance(), true));
        } else if (checkKeyword("else")) {
            elseLine = advance().line();
            consumeOp(":", "Expected ':' after 'else'.");
            orElse = block();
        }
        return new IfNode(test, body, orElse, elif, elseLine, spanFrom(keyword));
    }

    private WhileNode whileStatement(Token keyword) {
        ExpressionNode test = namedExpression();
        consumeOp(":", "Expected ':' after while condition.");
        List<StatementNode> body = block();
        List<StatementNode> orElse = elseBlock();
        return new WhileNode(test, body, orElse, spanFrom(keyword));
    }

    private ForNode forStatement(Token keyword) {
        ExpressionNode target = targetList();
        consumeKeyword("in", "Expected 'in' in for statement.");
        ExpressionNode iter = starExpressions();
        consumeOp(":", "Expected ':' after for clause.");
        List<StatementNode> body = block();
        List<StatementNode> orElse = elseBlock();
        return new ForNode(target, iter, body, orElse, spanFrom(keyword));
    }

    private List<StatementNode> elseBlock() {
        if (matchKeyword("else")) {
            consumeOp(":", "Expected ':' after 'else'.");
            return block();
        }
        return List.of();
    }

    private TryNode tryStatement(Token keyword) {
        consumeOp(":", "Expected ':' after 'try'.");
        List<StatementNode> body = block();
        List<ExceptHandlerNode> handlers = new ArrayList<>();
        while (checkKeyword("except")) {
            Token except = advance();
            ExpressionNode type = null;
            String name = null;
            if (!checkOp(":")) {
                type = expression();
                if (matchKeyword("as")) {
                    name = consume(TokenType.IDENTIFIER, "Expected name after 'as'.").text();
                }
            }
            consumeOp(":", "Expected ':' after except clause.");
            List<StatementNode> handlerBody = block();
            handlers.add(new ExceptHandlerNode(type, name, handlerBody, spanFrom(except)));
        }
        List<StatementNode> orElse = handlers.isEmpty() ? List.of() : elseBlock();
        List<StatementNode> finalBody = List.of();
        if (matchKeyword("finally")) {
            consumeOp(":", "Expected ':' after 'finally'.");
            finalBody = block();
        }
        if (handlers.isEmpty() && finalBody.isEmpty()) {
            throw error(peek(), "Expected 'except' or 'finally' block.");
        }
        return new TryNode(body, handlers, orElse, finalBody, spanFrom(keyword));
    }

    private WithNode withStatement(Token keyword) {
        List<WithItemNode> items = new ArrayList<>();
        do {
            ExpressionNode context = expression();
            ExpressionNode target = matchKeyword("as") ? target() : null;
            items.add(new WithItemNode(context, target));
        } while (matchOp(","));
        consumeOp(":", "Expected ':' after with items.");
        List<StatementNode> body = block();
        return new WithNode(items, body, spanFrom(keyword));
    }

    private FunctionDefNode functionDef(Token keyword, List<ExpressionNode> decorators) {
        String name = consume(TokenType.IDENTIFIER, "Expected function name.").text();
        consumeOp("(", "Expected '(' after function name.");
        ParametersNode parameters = parameters(")", true);
        consumeOp(")", "Expected ')' after parameters.");
        ExpressionNode returns = matchOp("->") ? expression() : null;
        consumeOp(":", "Expected ':' after function signature.");
        List<StatementNode> body = block();
        return new FunctionDefNode(name, parameters, returns, decorators, body, spanFrom(keyword));
    }

    private ClassDefNode classDef(Token keyword, List<ExpressionNode> decorators) {
        String name = consume(TokenType.IDENTIFIER, "Expected class name.").text();
        List<ExpressionNode> bases = new ArrayList<>();
        List<KeywordNode> keywords = new ArrayList<>();
        if (matchOp("(")) {
            arguments(bases, keywords);
            consumeOp(")", "Expected ')' after base classes.");
        }
        consumeOp(":", "Expected ':' after class header.");
        List<StatementNode> body = block();
        return new ClassDefNode(name, bases, keywords, decorators, body, spanFrom(keyword));
    }

    /**
     * Parses a parameter list up to (not including) the terminator.
     */
    private ParametersNode parameters(String terminator, boolean annotations) {
        List<ParameterNode> positionalOnly = new ArrayList<>();
        List<ParameterNode> args = new ArrayList<>();
        List<ParameterNode> keywordOnly = new ArrayList<>();
        ParameterNode vararg = null;
        ParameterNode kwarg = null;
        boolean afterStar = false;
        boolean seenDefault = false;
        while (!checkOp(terminator)) {
            if (kwarg != null) {
                throw error(peek(), "Parameter after '**' parameter.");
            }
            if (matchOp("/")) {
                if (afterStar || !positionalOnly.isEmpty()) {
                    throw error(previous(), "Misplaced '/' in parameter list.");
                }
                positionalOnly.addAll(args);
                args.clear();
            } else if (matchOp("*")) {
                if (afterStar) {
                    throw error(previous(), "Duplicate '*' in parameter list.");
                }
                afterStar = true;
                if (check(TokenType.IDENTIFIER)) {
                    vararg = parameter(annotations, false);
                }
            } else if (matchOp("**")) {
                kwarg = parameter(annotations, false);
            } else {
                ParameterNode parameter = parameter(annotations, true);
                if (afterStar) {
                    keywordOnly.add(parameter);
                } else {
                    if (!parameter.hasDefault() && seenDefault) {
                        throw error(previous(), "Non-default parameter '" + parameter.name() + "' follows default parameter.");
                    }
                    seenDefault |= parameter.hasDefault();
                    args.add(parameter);
                }
            }
            if (!matchOp(",")) {
                break;
            }
        }
        return new ParametersNode(positionalOnly, args, vararg, keywordOnly, kwarg);
    }

    private ParameterNode parameter(boolean annotations, boolean defaults) {
        Token name = consume(TokenType.IDENTIFIER, "Expected parameter name.");
        ExpressionNode annotation = annotations && matchOp(":") ? expression() : null;
        ExpressionNode defaultValue = defaults && matchOp("=") ? expression() : null;
        return new ParameterNode(name.text(), annotation, defaultValue, spanFrom(name));
    }

    /**
     * Parses a suite: either an indented block or simple statements on the header line.
     */
    private List<StatementNode> block() {
        if (!match(TokenType.NEWLINE)) {
            return simpleStatements();
        }
        consume(TokenType.INDENT, "Expected an indented block.");
        List<StatementNode> statements = new ArrayList<>();
        while (!check(TokenType.DEDENT) && !isAtEnd()) {
            if (match(TokenType.NEWLINE)) {
                continue;
            }
            statements.addAll(declaration());
        }
        match(TokenType.DEDENT);
        if (statements.isEmpty()) {
            throw error(previous(), "Expected an indented block.");
        }
        return statements;
    }

    private List<StatementNode> simpleStatements() {
        List<StatementNode> statements = new ArrayList<>();
        statements.add(simpleStatement());
        while (matchOp(";")) {
            if (check(TokenType.NEWLINE)) {
                break;
            }
            statements.add(simpleStatement());
        }
        if (!isAtEnd()) {
            consume(TokenType.NEWLINE, "Expected end of statement but got '" + peek().text() + "'.");
        }
        return statements;
    }

    private StatementNode simpleStatement() {
        Token token = peek();
        if (token.type() == TokenType.KEYWORD) {
            switch (token.text()) {
                case "pass":
                    advance();
                    return new PassNode(spanFrom(token));
                case "break":
                    advance();
                    return new BreakNode(spanFrom(token));
                case "continue":
                    advance();
                    return new ContinueNode(spanFrom(token));
                case "return": {
                    advance();
                    ExpressionNode value = atStatementEnd() ? null : starExpressions();
                    return new ReturnNode(value, spanFrom(token));
                }
                case "raise": {
                    advance();
                    ExpressionNode exception = null;
                    ExpressionNode cause = null;
                    if (!atStatementEnd()) {
                        exception = expression();
                        if (matchKeyword("from")) {
                            cause = expression();
                        }
                    }
                    return new RaiseNode(exception, cause, spanFrom(token));
                }
                case "global":
                case "nonlocal": {
                    advance();
                    List<String> names = new ArrayList<>();
                    do {
                        names.add(consume(TokenType.IDENTIFIER, "Expected name.").text());
                    } while (matchOp(","));
                    return new GlobalNode(names, token.text().equals("nonlocal"), spanFrom(token));
                }
                case "del": {
                    advance();
                    List<ExpressionNode> targets = new ArrayList<>();
                    do {
                        targets.add(target());
                    } while (matchOp(",") && !atStatementEnd());
                    return new DeleteNode(targets, spanFrom(token));
                }
                case "assert": {
                    advance();
                    ExpressionNode test = expression();
                    ExpressionNode message = matchOp(",") ? expression() : null;
                    return new AssertNode(test, message, spanFrom(token));
                }
                case "import":
                    advance();
                    return importStatement(token);
                case "from":
                    advance();
                    return fromImportStatement(token);
                default:
                    break;
            }
        }
        return expressionStatement();
    }

    private ImportNode importStatement(Token keyword) {
        List<String> names = new ArrayList<>();
        do {
            String name = dottedName();
            if (matchKeyword("as")) {
                name += " as " + consume(TokenType.IDENTIFIER, "Expected alias after 'as'.").text();
            }
            names.add(name);
        } while (matchOp(","));
        return new ImportNode(null, names, spanFrom(keyword));
    }

    private ImportNode fromImportStatement(Token keyword) {
        StringBuilder module = new StringBuilder();
        while (checkOp(".") || checkOp("...")) {
            module.append(advance().text());
        }
        if (check(TokenType.IDENTIFIER)) {
            module.append(dottedName());
        }
        if (module.length() == 0) {
            throw error(peek(), "Expected module name.");
        }
        consumeKeyword("import", "Expected 'import'.");
        List<String> names = new ArrayList<>();
        if (matchOp("*")) {
            names.add("*");
        } else {
            boolean parenthesized = matchOp("(");
            do {
                if (parenthesized && checkOp(")")) break;
                String name = consume(TokenType.IDENTIFIER, "Expected name to import.").text();
                if (matchKeyword("as")) {
                    name += " as " + consume(TokenType.IDENTIFIER, "Expected alias after 'as'.").text();
                }
                names.add(name);
            } while (matchOp(","));
            if (parenthesized) {
                consumeOp(")", "Expected ')' after imported names.");
            }
        }
        return new ImportNode(module.toString(), names, spanFrom(keyword));
    }

    private String dottedName() {
        StringBuilder name = new StringBuilder(consume(TokenType.IDENTIFIER, "Expected module name.").text());
        while (matchOp(".")) {
            name.append('.').append(consume(TokenType.IDENTIFIER, "Expected name after '.'.").text());
        }
        return name.toString();
    }

    private StatementNode expressionStatement() {
        Token first = peek();
        ExpressionNode expression = checkKeyword("yield") ? yieldExpression() : starExpressions();

        if (checkOp("=")) {
            List<ExpressionNode> targets = new ArrayList<>();
            ExpressionNode value = expression;
            while (matchOp("=")) {
                requireAssignable(value, first);
                targets.add(value);
                value = checkKeyword("yield") ? yieldExpression() : starExpressions();
            }
            return new AssignNode(targets, value, spanFrom(first));
        }

        if (peek().type() == TokenType.OPERATOR && AUGMENTED_OPERATORS.containsKey(peek().text())) {
            BinaryOperator op = AUGMENTED_OPERATORS.get(advance().text());
            if (!(expression instanceof NameNode || expression instanceof AttributeNode || expression instanceof SubscriptNode)) {
                throw error(first, "Illegal target for augmented assignment.");
            }
            ExpressionNode value = checkKeyword("yield") ? yieldExpression() : starExpressions();
            return new AugAssignNode(expression, op, value, spanFrom(first));
        }

        if (matchOp(":")) {
            if (!(expression instanceof NameNode || expression instanceof AttributeNode || expression instanceof SubscriptNode)) {
                throw error(first, "Illegal target for annotation.");
            }
            ExpressionNode annotation = expression();
            ExpressionNode value = matchOp("=") ? starExpressions() : null;
            return new AnnAssignNode(expression, annotation, value, spanFrom(first));
        }

        return new ExprStatementNode(expression, spanFrom(first));
    }

    private void requireAssignable(ExpressionNode target, Token at) {
        if (target instanceof NameNode || target instanceof AttributeNode || target instanceof SubscriptNode) {
            return;
        }
        if (target instanceof StarredNode starred) {
            requireAssignable(starred.value(), at);
            return;
        }
        if (target instanceof TupleNode tuple) {
            tuple.elements().forEach(e -> requireAssignable(e, at));
            return;
        }
        if (target instanceof ListNode list) {
            list.elements().forEach(e -> requireAssignable(e, at));
            return;
        }
        throw error(at, "Cannot assign to expression.");
    }

    // ---------------------------------------------------------------- expressions

    private ExpressionNode targetList() {
        ExpressionNode first = target();
        if (!checkOp(",")) {
            return first;
        }
        List<ExpressionNode> elements = new ArrayList<>();
        elements.add(first);
        while (matchOp(",")) {
            if (checkKeyword("in") || checkOp("=")) break;
            elements.add(target());
        }
        return new TupleNode(elements, first.span().to(lastSpan()));
    }

    private ExpressionNode target() {
        if (checkOp("*")) {
            Token star = advance();
            ExpressionNode value = bitwiseOr();
            return new StarredNode(value, spanFrom(star));
        }
        ExpressionNode target = bitwiseOr();
        requireAssignable(target, tokens.get(Math.max(0, current - 1)));
        return target;
    }

    private ExpressionNode starExpressions() {
        ExpressionNode first = starExpression();
        if (!checkOp(",")) {
            return first;
        }
        List<ExpressionNode> elements = new ArrayList<>();
        elements.add(first);
        while (matchOp(",")) {
            if (atExpressionListEnd()) break;
            elements.add(starExpression());
        }
        return new TupleNode(elements, first.span().to(lastSpan()));
    }

    private ExpressionNode starExpression() {
        if (checkOp("*")) {
            Token star = advance();
            ExpressionNode value = bitwiseOr();
            return new StarredNode(value, spanFrom(star));
        }
        return namedExpression();
    }

    private ExpressionNode namedExpression() {
        if (check(TokenType.IDENTIFIER) && checkNextOp(":=")) {
            Token name = advance();
            advance();
            ExpressionNode value = expression();
            return new NamedExprNode(new NameNode(name.text(), spanFrom(name)), value, spanFrom(name));
        }
        return expression();
    }

    private ExpressionNode expression() {
        if (checkKeyword("lambda")) {
            Token keyword = advance();
            ParametersNode parameters = parameters(":", false);
            consumeOp(":", "Expected ':' after lambda parameters.");
            ExpressionNode body = expression();
            return new LambdaNode(parameters, body, spanFrom(keyword));
        }
        ExpressionNode body = disjunction();
        if (matchKeyword("if")) {
            ExpressionNode test = disjunction();
            consumeKeyword("else", "Expected 'else' in conditional expression.");
            ExpressionNode orElse = expression();
            return new IfExpNode(test, body, orElse, body.span().to(orElse.span()));
        }
        return body;
    }

    private ExpressionNode yieldExpression() {
        Token keyword = advance();
        if (matchKeyword("from")) {
            ExpressionNode value = expression();
            return new YieldNode(value, true, spanFrom(keyword));
        }
        ExpressionNode value = atExpressionListEnd() ? null : starExpressions();
        return new YieldNode(value, false, spanFrom(keyword));
    }

    private ExpressionNode disjunction() {
        ExpressionNode first = conjunction();
        if (!checkKeyword("or")) {
            return first;
        }
        List<ExpressionNode> values = new ArrayList<>();
        values.add(first);
        while (matchKeyword("or")) {
            values.add(conjunction());
        }
        return new BoolOpNode(BoolOperator.OR, values, first.span().to(lastSpan()));
    }

    private ExpressionNode conjunction() {
        ExpressionNode first = inversion();
        if (!checkKeyword("and")) {
            return first;
        }
        List<ExpressionNode> values = new ArrayList<>();
        values.add(first);
        while (matchKeyword("and")) {
            values.add(inversion());
        }
        return new BoolOpNode(BoolOperator.AND, values, first.span().to(lastSpan()));
    }

    private ExpressionNode inversion() {
        if (checkKeyword("not")) {
            Token not = advance();
            ExpressionNode operand = inversion();
            return new UnaryOpNode(UnaryOperator.NOT, operand, spanFrom(not));
        }
        return comparison();
    }

    private ExpressionNode comparison() {
        ExpressionNode left = bitwiseOr();
        List<CompareOperator> ops = new ArrayList<>();
        List<ExpressionNode> comparators = new ArrayList<>();
        while (true) {
            CompareOperator op;
            if (peek().type() == TokenType.OPERATOR && COMPARE_OPERATORS.containsKey(peek().text())) {
                op = COMPARE_OPERATORS.get(advance().text());
            } else if (matchKeyword("in")) {
                op = CompareOperator.IN;
            } else if (checkKeyword("not") && checkNextKeyword("in")) {
                advance();
                advance();
                op = CompareOperator.NOT_IN;
            } else if (matchKeyword("is")) {
                op = matchKeyword("not") ? CompareOperator.IS_NOT : CompareOperator.IS;
            } else {
                break;
            }
            ops.add(op);
            comparators.add(bitwiseOr());
        }
        if (ops.isEmpty()) {
            return left;
        }
        return new CompareNode(left, ops, comparators, left.span().to(lastSpan()));
    }

    private ExpressionNode bitwiseOr() {
        ExpressionNode left = bitwiseXor();
        while (checkOp("|")) {
            advance();
            ExpressionNode right = bitwiseXor();
            left = new BinOpNode(left, BinaryOperator.BIT_OR, right, left.span().to(right.span()));
        }
        return left;
    }

    private ExpressionNode bitwiseXor() {
        ExpressionNode left = bitwiseAnd();
        while (checkOp("^")) {
            advance();
            ExpressionNode right = bitwiseAnd();
            left = new BinOpNode(left, BinaryOperator.BIT_XOR, right, left.span().to(right.span()));
        }
        return left;
    }

    private ExpressionNode bitwiseAnd() {
        ExpressionNode left = shift();
        while (checkOp("&")) {
            advance();
            ExpressionNode right = shift();
            left = new BinOpNode(left, BinaryOperator.BIT_AND, right, left.span().to(right.span()));
        }
        return left;
    }

    private ExpressionNode shift() {
        ExpressionNode left = sum();
        while (checkOp("<<") || checkOp(">>")) {
            BinaryOperator op = BinaryOperator.fromSymbol(advance().text());
            ExpressionNode right = sum();
            left = new BinOpNode(left, op, right, left.span().to(right.span()));
        }
        return left;
    }

    private ExpressionNode sum() {
        ExpressionNode left = term();
        while (checkOp("+") || checkOp("-")) {
            BinaryOperator op = BinaryOperator.fromSymbol(advance().text());
            ExpressionNode right = term();
            left = new BinOpNode(left, op, right, left.span().to(right.span()));
        }
        return left;
    }

    private ExpressionNode term() {
        ExpressionNode left = factor();
        while (checkOp("*") || checkOp("/") || checkOp("//") || checkOp("%") || checkOp("@")) {
            BinaryOperator op = BinaryOperator.fromSymbol(advance().text());
            ExpressionNode right = factor();
            left = new BinOpNode(left, op, right, left.span().to(right.span()));
        }
        return left;
    }

    private ExpressionNode factor() {
        if (checkOp("+") || checkOp("-") || checkOp("~")) {
            Token sign = advance();
            UnaryOperator op = switch (sign.text()) {
                case "+" -> UnaryOperator.UADD;
                case "-" -> UnaryOperator.USUB;
                default -> UnaryOperator.INVERT;
            };
            ExpressionNode operand = factor();
            return new UnaryOpNode(op, operand, spanFrom(sign));
        }
        return power();
    }

    private ExpressionNode power() {
        ExpressionNode base = primary();
        if (matchOp("**")) {
            ExpressionNode exponent = factor();
            return new BinOpNode(base, BinaryOperator.POW, exponent, base.span().to(exponent.span()));
        }
        return base;
    }

    private ExpressionNode primary() {
        if (checkKeyword("await")) {
            throw error(peek(), "Asynchronous expressions are not supported.");
        }
        ExpressionNode expression = atom();
        while (true) {
            if (matchOp(".")) {
                Token name = consume(TokenType.IDENTIFIER, "Expected attribute name after '.'.");
                expression = new AttributeNode(expression, name.text(), expression.span().to(spanOf(name)));
            } else if (matchOp("(")) {
                List<ExpressionNode> args = new ArrayList<>();
                List<KeywordNode> keywords = new ArrayList<>();
                arguments(args, keywords);
                Token close = consumeOp(")", "Expected ')' after arguments.");
                expression = new CallNode(expression, args, keywords, expression.span().to(spanOf(close)));
            } else if (matchOp("[")) {
                ExpressionNode index = slices();
                Token close = consumeOp("]", "Expected ']' after index.");
                expression = new SubscriptNode(expression, index, expression.span().to(spanOf(close)));
            } else {
                return expression;
            }
        }
    }

    private void arguments(List<ExpressionNode> args, List<KeywordNode> keywords) {
        while (!checkOp(")")) {
            Token start = peek();
            if (matchOp("*")) {
                ExpressionNode value = expression();
                args.add(new StarredNode(value, spanFrom(start)));
            } else if (matchOp("**")) {
                ExpressionNode value = expression();
                keywords.add(new KeywordNode(null, value, spanFrom(start)));
            } else if (check(TokenType.IDENTIFIER) && checkNextOp("=")) {
                advance();
                advance();
                ExpressionNode value = expression();
                keywords.add(new KeywordNode(start.text(), value, spanFrom(start)));
            } else {
                ExpressionNode value = namedExpression();
                if (checkKeyword("for")) {
                    value = comprehension(ComprehensionKind.GENERATOR, value, null, start);
                } else if (!keywords.isEmpty()) {
                    throw error(start, "Positional argument follows keyword argument.");
                }
                args.add(value);
            }
            if (!matchOp(",")) {
                break;
            }
        }
    }

    private ExpressionNode slices() {
        ExpressionNode first = slice();
        if (!checkOp(",")) {
            return first;
        }
        List<ExpressionNode> elements = new ArrayList<>();
        elements.add(first);
        while (matchOp(",")) {
            if (checkOp("]")) break;
            elements.add(slice());
        }
        return new TupleNode(elements, first.span().to(lastSpan()));
    }

    private ExpressionNode slice() {
        Token start = peek();
        ExpressionNode lower = null;
        if (!checkOp(":")) {
            lower = starExpression();
            if (!checkOp(":")) {
                return lower;
            }
        }
        consumeOp(":", "Expected ':' in slice.");
        ExpressionNode upper = checkOp(":") || checkOp("]") || checkOp(",") ? null : expression();
        ExpressionNode step = null;
        if (matchOp(":")) {
            step = checkOp("]") || checkOp(",") ? null : expression();
        }
        return new SliceNode(lower, upper, step, spanFrom(start));
    }

    private ExpressionNode atom() {
        Token token = peek();
        switch (token.type()) {
            case IDENTIFIER:
                advance();
                return new NameNode(token.text(), spanOf(token));
            case NUMBER:
                advance();
                return token.value() instanceof Long || token.value() instanceof BigInteger
                        ? new ConstantNode(token.value(), ConstantKind.INT, spanOf(token))
                        : new ConstantNode(token.value(), ConstantKind.FLOAT, spanOf(token));
            case STRING:
                return strings();
            case KEYWORD:
                switch (token.text()) {
                    case "True":
                        advance();
                        return new ConstantNode(Boolean.TRUE, ConstantKind.BOOL, spanOf(token));
                    case "False":
                        advance();
                        return new ConstantNode(Boolean.FALSE, ConstantKind.BOOL, spanOf(token));
                    case "None":
                        advance();
                        return new ConstantNode(null, ConstantKind.NONE, spanOf(token));
                    default:
                        throw error(token, "Unexpected keyword '" + token.text() + "' in expression.");
                }
            case OPERATOR:
                switch (token.text()) {
                    case "(":
                        advance();
                        return parenthesized(token);
                    case "[":
                        advance();
                        return listDisplay(token);
                    case "{":
                        advance();
                        return braceDisplay(token);
                    case "...":
                        advance();
                        return new ConstantNode(null, ConstantKind.ELLIPSIS, spanOf(token));
                    default:
                        throw error(token, "Unexpected '" + token.text() + "' in expression.");
                }
            default:
                throw error(token, "Expected an expression.");
        }
    }

    private ExpressionNode strings() {
        Token first = peek();
        StringBuilder value = new StringBuilder();
        StringBuilder raw = new StringBuilder();
        boolean formatted = false;
        boolean bytes = false;
        while (check(TokenType.STRING)) {
            Token part = advance();
            String prefix = prefixOf(part.text());
            formatted |= prefix.contains("f");
            bytes |= prefix.contains("b");
            value.append((String) part.value());
            if (raw.length() > 0) raw.append(' ');
            raw.append(part.text());
        }
        SourceSpan span = spanFrom(first);
        if (formatted) {
            return new FormattedStringNode(raw.toString(), span);
        }
        return new ConstantNode(value.toString(), bytes ? ConstantKind.BYTES : ConstantKind.STR, span);
    }

    private static String prefixOf(String literal) {
        int quote = 0;
        while (quote < literal.length() && literal.charAt(quote) != '"' && literal.charAt(quote) != '\'') {
            quote++;
        }
        return literal.substring(0, quote).toLowerCase();
    }

    private ExpressionNode parenthesized(Token open) {
        if (matchOp(")")) {
            return new TupleNode(List.of(), spanFrom(open));
        }
        if (checkKeyword("yield")) {
            ExpressionNode yield = yieldExpression();
            consumeOp(")", "Expected ')' after yield expression.");
            return yield;
        }
        ExpressionNode first = starExpression();
        if (checkKeyword("for")) {
            ExpressionNode generator = comprehension(ComprehensionKind.GENERATOR, first, null, open);
            consumeOp(")", "Expected ')' after generator expression.");
            return generator;
        }
        if (matchOp(")")) {
            return first;
        }
        List<ExpressionNode> elements = new ArrayList<>();
        elements.add(first);
        while (matchOp(",")) {
            if (checkOp(")")) break;
            elements.add(starExpression());
        }
        consumeOp(")", "Expected ')' after tuple.");
        return new TupleNode(elements, spanFrom(open));
    }

    private ExpressionNode listDisplay(Token open) {
        List<ExpressionNode> elements = new ArrayList<>();
        if (!checkOp("]")) {
            ExpressionNode first = starExpression();
            if (checkKeyword("for")) {
                ExpressionNode comprehension = comprehension(ComprehensionKind.LIST, first, null, open);
                consumeOp("]", "Expected ']' after list comprehension.");
                return comprehension;
            }
            elements.add(first);
            while (matchOp(",")) {
                if (checkOp("]")) break;
                elements.add(starExpression());
            }
        }
        consumeOp("]", "Expected ']' after list elements.");
        return new ListNode(elements, spanFrom(open));
    }

    private ExpressionNode braceDisplay(Token open) {
        if (matchOp("}")) {
            return new DictNode(List.of(), List.of(), spanFrom(open));
        }
        if (checkOp("**")) {
            return dictDisplay(open);
        }
        ExpressionNode first = starExpression();
        if (checkOp(":")) {
            return dictDisplayFrom(open, first);
        }
        if (checkKeyword("for")) {
            ExpressionNode comprehension = comprehension(ComprehensionKind.SET, first, null, open);
            consumeOp("}", "Expected '}' after set comprehension.");
            return comprehension;
        }
        List<ExpressionNode> elements = new ArrayList<>();
        elements.add(first);
        while (matchOp(",")) {
            if (checkOp("}")) break;
            elements.add(starExpression());
        }
        consumeOp("}", "Expected '}' after set elements.");
        return new SetNode(elements, spanFrom(open));
    }

    private ExpressionNode dictDisplay(Token open) {
        consumeOp("**", "Expected dict entry.");
        ExpressionNode mapping = bitwiseOr();
        List<ExpressionNode> keys = new ArrayList<>();
        List<ExpressionNode> values = new ArrayList<>();
        keys.add(null);
        values.add(mapping);
        return dictEntries(open, keys, values);
    }

    private ExpressionNode dictDisplayFrom(Token open, ExpressionNode firstKey) {
        consumeOp(":", "Expected ':' in dict entry.");
        ExpressionNode firstValue = expression();
        if (checkKeyword("for")) {
            ExpressionNode comprehension = comprehension(ComprehensionKind.DICT, firstKey, firstValue, open);
            consumeOp("}", "Expected '}' after dict comprehension.");
            return comprehension;
        }
        List<ExpressionNode> keys = new ArrayList<>();
        List<ExpressionNode> values = new ArrayList<>();
        keys.add(firstKey);
        values.add(firstValue);
        return dictEntries(open, keys, values);
    }

    private ExpressionNode dictEntries(Token open, List<ExpressionNode> keys, List<ExpressionNode> values) {
        while (matchOp(",")) {
            if (checkOp("}")) break;
            if (matchOp("**")) {
                keys.add(null);
                values.add(bitwiseOr());
            } else {
                keys.add(expression());
                consumeOp(":", "Expected ':' in dict entry.");
                values.add(expression());
            }
        }
        consumeOp("}", "Expected '}' after dict entries.");
        return new DictNode(keys, values, spanFrom(open));
    }

    private ExpressionNode comprehension(ComprehensionKind kind, ExpressionNode element, ExpressionNode value, Token start) {
        List<ComprehensionClause> clauses = new ArrayList<>();
        while (matchKeyword("for")) {
            ExpressionNode target = targetList();
            consumeKeyword("in", "Expected 'in' in comprehension.");
            ExpressionNode iter = disjunction();
            List<ExpressionNode> conditions = new ArrayList<>();
            while (matchKeyword("if")) {
                conditions.add(disjunction());
            }
            clauses.add(new ComprehensionClause(target, iter, conditions));
        }
        SourceSpan span = kind == ComprehensionKind.GENERATOR && start.type() != TokenType.OPERATOR
                ? element.span().to(lastSpan())
                : spanFrom(start);
        return new ComprehensionNode(kind, element, value, clauses, span);
    }

    // ---------------------------------------------------------------- helpers

    private boolean atStatementEnd() {
        return check(TokenType.NEWLINE) || checkOp(";") || isAtEnd();
    }

    private boolean atExpressionListEnd() {
        return atStatementEnd() || checkOp("=") || checkOp(")") || checkOp(":")
                || (peek().type() == TokenType.OPERATOR && AUGMENTED_OPERATORS.containsKey(peek().text()));
    }

    private SourceSpan spanOf(Token token) {
        return new SourceSpan(token.line(), token.column(), token.endLine(), token.endColumn());
    }

    /**
     * @return The span from the given token to the last consumed non-layout token.
     */
    private SourceSpan spanFrom(Token start) {
        SourceSpan end = lastSpan();
        return new SourceSpan(start.line(), start.column(), end.endLine(), end.endColumn());
    }

    private SourceSpan lastSpan() {
        for (int i = current - 1; i >= 0; i--) {
            Token t = tokens.get(i);
            if (t.type() != TokenType.NEWLINE && t.type() != TokenType.INDENT && t.type() != TokenType.DEDENT) {
                return spanOf(t);
            }
        }
        return spanOf(peek());
    }

    private void synchronize(int startIndex) {
        if (current == startIndex && !isAtEnd()) {
            advance();
        }
        while (!isAtEnd() && !check(TokenType.NEWLINE)) {
            advance();
        }
        match(TokenType.NEWLINE);
        if (check(TokenType.INDENT)) {
            int depth = 0;
            do {
                if (check(TokenType.INDENT)) depth++;
                if (check(TokenType.DEDENT)) depth--;
                advance();
            } while (depth > 0 && !isAtEnd());
        }
    }

    private ParseError error(Token token, String message) {
        diagnostics.reportError(message, token.fileName(), token.line());
        return new ParseError(message);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchOp(String text) {
        if (checkOp(text)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchKeyword(String text) {
        if (checkKeyword(text)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return type == TokenType.END_OF_FILE;
        return peek().type() == type;
    }

    private boolean checkOp(String text) {
        return peek().is(TokenType.OPERATOR, text);
    }

    private boolean checkKeyword(String text) {
        return peek().is(TokenType.KEYWORD, text);
    }

    private boolean checkNextOp(String text) {
        return current + 1 < tokens.size() && tokens.get(current + 1).is(TokenType.OPERATOR, text);
    }

    private boolean checkNextKeyword(String text) {
        return current + 1 < tokens.size() && tokens.get(current + 1).is(TokenType.KEYWORD, text);
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(Math.max(0, current - 1));
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type) && type != TokenType.END_OF_FILE) return advance();
        throw error(peek(), errorMessage);
    }

    private Token consumeOp(String text, String errorMessage) {
        if (checkOp(text)) return advance();
        throw error(peek(), errorMessage);
    }

    private Token consumeKeyword(String text, String errorMessage) {
        if (checkKeyword(text)) return advance();
        throw error(peek(), errorMessage);
    }

    /**
     * Unwinds the parser to the statement level after an error has been reported.
     */
    private static final class ParseError extends RuntimeException {
        ParseError(String message) {
            super(message, null, false, false);
        }
    }
}

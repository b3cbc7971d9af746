package lang;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import lang.ast.Assign;
import lang.ast.Attribute;
import lang.ast.AugmentedAssign;
import lang.ast.Call;
import lang.ast.Comparison;
import lang.ast.ConditionalExpression;
import lang.ast.Constant;
import lang.ast.ExprContext;
import lang.ast.ExpressionStatement;
import lang.ast.For;
import lang.ast.FunctionDef;
import lang.ast.If;
import lang.ast.Module;
import lang.ast.Name;
import lang.ast.NoOp;
import lang.ast.Node;
import lang.ast.Operator;
import lang.ast.Return;
import lang.ast.Sequence;
import lang.ast.Subscript;
import lang.ast.While;

/**
 * Recursive descent parser producing the syntax tree for a source. The accepted language is the statement and
 * expression core of Python: functions, <code>if</code>/<code>while</code>/<code>for</code>, assignments, calls and
 * the usual operators. Classes, imports, exception handling, lambdas and comprehensions are rejected with a
 * {@link ParseException}.
 */
public class Parser {

    /**
     * Words that cannot be used as variable names
     */
    private static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList("False", "None", "True", "and", "as",
            "assert", "async", "await", "break", "class", "continue", "def", "del", "elif", "else", "except",
            "finally", "for", "from", "global", "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass",
            "raise", "return", "try", "while", "with", "yield"));

    private static final Set<String> AUGMENTED_OPERATORS = new HashSet<>(Arrays.asList("+=", "-=", "*=", "/=", "//=",
            "%=", "**=", "&=", "|=", "^=", ">>=", "<<=", "@="));

    private static final Set<String> COMPARISON_OPERATORS = new HashSet<>(Arrays.asList("<", ">", "==", ">=", "<=",
            "!="));

    /**
     * Binary operators from lowest to highest precedence
     */
    private static final String[][] BINARY_OPERATORS = { { "|" }, { "^" }, { "&" }, { "<<", ">>" }, { "+", "-" },
            { "*", "/", "//", "%", "@" } };

    private final String source;
    /**
     * Tokens without comments and non-logical line ends
     */
    private final List<Token> tokens;
    private int pos;

    /**
     * Create a parser for the given source and its tokens
     *
     * @param source source text the tokens were read from
     * @param tokens all tokens produced by the {@link Lexer}
     */
    public Parser(String source, List<Token> tokens) {
        this.source = source;
        this.tokens = new ArrayList<>();
        for (Token t : tokens) {
            if (t.getKind() != TokenKind.COMMENT && t.getKind() != TokenKind.NL) {
                this.tokens.add(t);
            }
        }
    }

    /**
     * Tokenize and parse the given source
     *
     * @param source source text
     * @return root of the syntax tree
     * @throws ParseException syntax error
     */
    public static Module parse(String source) throws ParseException {
        return new Parser(source, new Lexer(source).tokenize()).parseModule();
    }

    /**
     * Parse all statements
     *
     * @return root of the syntax tree
     * @throws ParseException syntax error
     */
    public Module parseModule() throws ParseException {
        pos = 0;
        List<Node> body = new ArrayList<>();
        while (peek().getKind() != TokenKind.END) {
            if (peek().getKind() == TokenKind.NEWLINE) {
                next();
                continue;
            }
            parseStatement(body);
        }
        return new Module(body);
    }

    ////////////////
    // Statements //
    ////////////////

    private void parseStatement(List<Node> out) throws ParseException {
        Token t = peek();
        if (t.isName("if")) {
            out.add(parseIf(next()));
        }
        else if (t.isName("while")) {
            out.add(parseWhile(next()));
        }
        else if (t.isName("for")) {
            out.add(parseFor(next()));
        }
        else if (t.isName("def")) {
            out.add(parseFunctionDef(next()));
        }
        else if (t.getKind() == TokenKind.INDENT) {
            throw error("unexpected indent", t);
        }
        else {
            parseSimpleStatements(out);
        }
    }

    /**
     * One or more small statements separated by ";" and ended by a NEWLINE
     */
    private void parseSimpleStatements(List<Node> out) throws ParseException {
        out.add(parseSmallStatement());
        while (accept(";")) {
            if (peek().getKind() == TokenKind.NEWLINE) {
                break;
            }
            out.add(parseSmallStatement());
        }
        expect(TokenKind.NEWLINE);
    }

    private Node parseSmallStatement() throws ParseException {
        Token first = peek();
        if (first.isName("pass") || first.isName("break") || first.isName("continue")) {
            next();
            return new NoOp(first.getLine(), first.getText(), first.getText());
        }
        if (first.isName("return")) {
            next();
            Node value = null;
            if (!endsStatement(peek())) {
                value = parseExpressionList();
            }
            return new Return(first.getLine(), span(first, previous()), value);
        }
        if (first.getKind() == TokenKind.NAME && KEYWORDS.contains(first.getText()) && !isExpressionKeyword(first)) {
            throw error("unsupported statement '" + first.getText() + "'", first);
        }

        Node expr = parseExpressionList();
        if (peek().isOperator("=")) {
            List<Node> items = new ArrayList<>();
            items.add(expr);
            while (accept("=")) {
                items.add(parseExpressionList());
            }
            List<Node> targets = new ArrayList<>();
            for (Node n : items.subList(0, items.size() - 1)) {
                targets.add(toTarget(n));
            }
            return new Assign(first.getLine(), span(first, previous()), targets, items.get(items.size() - 1));
        }
        if (peek().getKind() == TokenKind.OPERATOR && AUGMENTED_OPERATORS.contains(peek().getText())) {
            String op = next().getText();
            Node value = parseExpressionList();
            return new AugmentedAssign(first.getLine(), span(first, previous()), toTarget(expr), op, value);
        }
        return new ExpressionStatement(first.getLine(), span(first, previous()), expr);
    }

    private If parseIf(Token keyword) throws ParseException {
        Node test = parseTest();
        Token colon = expect(":");
        String code = span(keyword, colon);
        List<Node> body = parseSuite();
        List<Node> orelse = Collections.emptyList();
        if (peek().isName("elif")) {
            orelse = Collections.<Node> singletonList(parseIf(next()));
        }
        else if (peek().isName("else")) {
            next();
            expect(":");
            orelse = parseSuite();
        }
        return new If(keyword.getLine(), code, test, body, orelse);
    }

    private While parseWhile(Token keyword) throws ParseException {
        Node test = parseTest();
        Token colon = expect(":");
        String code = span(keyword, colon);
        List<Node> body = parseSuite();
        List<Node> orelse = parseElse();
        return new While(keyword.getLine(), code, test, body, orelse);
    }

    private For parseFor(Token keyword) throws ParseException {
        Node target = parseTargetList();
        expectName("in");
        Node iter = parseExpressionList();
        Token colon = expect(":");
        String code = span(keyword, colon);
        List<Node> body = parseSuite();
        List<Node> orelse = parseElse();
        return new For(keyword.getLine(), code, target, iter, body, orelse);
    }

    private List<Node> parseElse() throws ParseException {
        if (peek().isName("else")) {
            next();
            expect(":");
            return parseSuite();
        }
        return Collections.emptyList();
    }

    private FunctionDef parseFunctionDef(Token keyword) throws ParseException {
        Token name = expect(TokenKind.NAME);
        checkNotKeyword(name);
        expect("(");
        List<String> params = new ArrayList<>();
        while (!peek().isOperator(")")) {
            boolean starred = accept("*") || accept("**");
            // "/" and a bare "*" are markers, not parameters
            boolean marker = (!starred && accept("/"))
                    || (starred && (peek().isOperator(",") || peek().isOperator(")")));
            if (!marker) {
                Token param = expect(TokenKind.NAME);
                checkNotKeyword(param);
                params.add(param.getText());
                if (accept(":")) {
                    parseTest();
                }
                if (accept("=")) {
                    parseTest();
                }
            }
            if (!accept(",")) {
                break;
            }
        }
        expect(")");
        if (accept("->")) {
            parseTest();
        }
        Token colon = expect(":");
        String code = span(keyword, colon);
        List<Node> body = parseSuite();
        return new FunctionDef(keyword.getLine(), code, name.getText(), params, body);
    }

    /**
     * Either simple statements on the same line or an indented block
     */
    private List<Node> parseSuite() throws ParseException {
        List<Node> body = new ArrayList<>();
        if (peek().getKind() != TokenKind.NEWLINE) {
            parseSimpleStatements(body);
            return body;
        }
        next();
        expect(TokenKind.INDENT);
        while (peek().getKind() != TokenKind.DEDENT && peek().getKind() != TokenKind.END) {
            parseStatement(body);
        }
        expect(TokenKind.DEDENT);
        return body;
    }

    /**
     * Convert an expression parsed on the left of "=" (or after "for") into a target
     *
     * @param n expression
     * @return the same expression in {@link ExprContext#STORE} context
     * @throws ParseException if the expression cannot be assigned to
     */
    private static Node toTarget(Node n) throws ParseException {
        switch (n.getKind()) {
        case NAME:
            Name name = (Name) n;
            return new Name(n.getLine(), n.getCode(), name.getId(), ExprContext.STORE);
        case SEQUENCE:
            Sequence seq = (Sequence) n;
            List<Node> elements = new ArrayList<>();
            for (Node e : seq.getElements()) {
                elements.add(toTarget(e));
            }
            return new Sequence(n.getLine(), n.getCode(), elements, ExprContext.STORE, seq.isList());
        case ATTRIBUTE:
            Attribute a = (Attribute) n;
            return new Attribute(n.getLine(), n.getCode(), a.getValue(), a.getAttribute(), ExprContext.STORE);
        case SUBSCRIPT:
            Subscript s = (Subscript) n;
            return new Subscript(n.getLine(), n.getCode(), s.getValue(), s.getIndex(), ExprContext.STORE);
        default:
            throw new ParseException("cannot assign to " + n.getCode(), n.getLine());
        }
    }

    /////////////////
    // Expressions //
    /////////////////

    /**
     * <code>test (, test)* [,]</code>, a tuple if there is at least one comma
     */
    private Node parseExpressionList() throws ParseException {
        Token first = peek();
        Node e = parseTest();
        if (!peek().isOperator(",")) {
            return e;
        }
        List<Node> elements = new ArrayList<>();
        elements.add(e);
        while (accept(",")) {
            if (endsExpressionList(peek())) {
                break;
            }
            elements.add(parseTest());
        }
        return new Sequence(first.getLine(), span(first, previous()), elements, ExprContext.LOAD, false);
    }

    /**
     * Loop targets of a <code>for</code>, parsed below comparisons so that <code>in</code> is not consumed
     */
    private Node parseTargetList() throws ParseException {
        Token first = peek();
        Node e = parseBinary(0);
        if (peek().isOperator(",")) {
            List<Node> elements = new ArrayList<>();
            elements.add(e);
            while (accept(",")) {
                if (peek().isName("in")) {
                    break;
                }
                elements.add(parseBinary(0));
            }
            e = new Sequence(first.getLine(), span(first, previous()), elements, ExprContext.LOAD, false);
        }
        return toTarget(e);
    }

    private Node parseTest() throws ParseException {
        Token first = peek();
        if (first.isName("lambda")) {
            throw error("lambda expressions are not supported", first);
        }
        Node body = parseOrTest();
        if (peek().isName("if")) {
            next();
            Node test = parseOrTest();
            expectName("else");
            Node orelse = parseTest();
            return new ConditionalExpression(first.getLine(), span(first, previous()), test, body, orelse);
        }
        return body;
    }

    private Node parseOrTest() throws ParseException {
        return parseBooleanOperator("or");
    }

    private Node parseAndTest() throws ParseException {
        return parseBooleanOperator("and");
    }

    private Node parseBooleanOperator(String op) throws ParseException {
        Token first = peek();
        Node e = op.equals("or") ? parseAndTest() : parseNotTest();
        if (!peek().isName(op)) {
            return e;
        }
        List<Node> operands = new ArrayList<>();
        operands.add(e);
        while (peek().isName(op)) {
            next();
            operands.add(op.equals("or") ? parseAndTest() : parseNotTest());
        }
        return new Operator(first.getLine(), span(first, previous()), op, operands);
    }

    private Node parseNotTest() throws ParseException {
        Token first = peek();
        if (first.isName("not")) {
            next();
            Node operand = parseNotTest();
            return new Operator(first.getLine(), span(first, previous()), "not",
                    Collections.singletonList(operand));
        }
        return parseComparison();
    }

    private Node parseComparison() throws ParseException {
        Token first = peek();
        Node left = parseBinary(0);
        List<String> ops = new ArrayList<>();
        List<Node> comparators = new ArrayList<>();
        while (true) {
            Token t = peek();
            String op;
            if (t.getKind() == TokenKind.OPERATOR && COMPARISON_OPERATORS.contains(t.getText())) {
                next();
                op = t.getText();
            }
            else if (t.isName("in")) {
                next();
                op = "in";
            }
            else if (t.isName("not") && peekAhead(1).isName("in")) {
                next();
                next();
                op = "not in";
            }
            else if (t.isName("is")) {
                next();
                op = accept("not", TokenKind.NAME) ? "is not" : "is";
            }
            else {
                break;
            }
            ops.add(op);
            comparators.add(parseBinary(0));
        }
        if (ops.isEmpty()) {
            return left;
        }
        return new Comparison(first.getLine(), span(first, previous()), left, ops, comparators);
    }

    /**
     * Left associative binary operators at the given precedence level
     */
    private Node parseBinary(int level) throws ParseException {
        if (level == BINARY_OPERATORS.length) {
            return parseFactor();
        }
        Token first = peek();
        Node left = parseBinary(level + 1);
        while (isBinaryOperator(peek(), level)) {
            String op = next().getText();
            Node right = parseBinary(level + 1);
            left = new Operator(first.getLine(), span(first, previous()), op, Arrays.asList(left, right));
        }
        return left;
    }

    private static boolean isBinaryOperator(Token t, int level) {
        if (t.getKind() != TokenKind.OPERATOR) {
            return false;
        }
        for (String op : BINARY_OPERATORS[level]) {
            if (t.getText().equals(op)) {
                return true;
            }
        }
        return false;
    }

    private Node parseFactor() throws ParseException {
        Token first = peek();
        if (first.isOperator("+") || first.isOperator("-") || first.isOperator("~")) {
            next();
            Node operand = parseFactor();
            return new Operator(first.getLine(), span(first, previous()), first.getText(),
                    Collections.singletonList(operand));
        }
        return parsePower();
    }

    private Node parsePower() throws ParseException {
        Token first = peek();
        Node base = parseAtomExpression();
        if (accept("**")) {
            Node exponent = parseFactor();
            return new Operator(first.getLine(), span(first, previous()), "**", Arrays.asList(base, exponent));
        }
        return base;
    }

    /**
     * Atom followed by calls, subscripts and attribute accesses
     */
    private Node parseAtomExpression() throws ParseException {
        Token first = peek();
        Node e = parseAtom();
        while (true) {
            if (accept("(")) {
                List<Node> args = parseArguments();
                e = new Call(first.getLine(), span(first, previous()), e, args);
            }
            else if (accept("[")) {
                Node index = parseSubscriptIndex();
                expect("]");
                e = new Subscript(first.getLine(), span(first, previous()), e, index, ExprContext.LOAD);
            }
            else if (accept(".")) {
                Token attr = expect(TokenKind.NAME);
                e = new Attribute(first.getLine(), span(first, previous()), e, attr.getText(), ExprContext.LOAD);
            }
            else {
                return e;
            }
        }
    }

    /**
     * Arguments of a call, the opening parenthesis has been consumed
     */
    private List<Node> parseArguments() throws ParseException {
        List<Node> args = new ArrayList<>();
        while (!peek().isOperator(")")) {
            if (!accept("*")) {
                accept("**");
            }
            if (peek().getKind() == TokenKind.NAME && peekAhead(1).isOperator("=")) {
                // keyword argument, only the value matters
                next();
                next();
            }
            args.add(parseTest());
            if (!accept(",")) {
                break;
            }
        }
        expect(")");
        return args;
    }

    /**
     * Index or slice, a slice <code>a:b:c</code> is represented as an {@link Operator} ":" over the parts present
     */
    private Node parseSubscriptIndex() throws ParseException {
        Token first = peek();
        List<Node> parts = new ArrayList<>();
        boolean slice = false;
        while (true) {
            if (peek().isOperator(":")) {
                next();
                slice = true;
            }
            else if (peek().isOperator("]") || peek().isOperator(",")) {
                break;
            }
            else {
                parts.add(parseTest());
                if (!peek().isOperator(":")) {
                    break;
                }
            }
        }
        if (peek().isOperator(",")) {
            throw error("multi-dimensional subscripts are not supported", peek());
        }
        if (!slice) {
            if (parts.isEmpty()) {
                throw error("empty subscript", first);
            }
            return parts.get(0);
        }
        return new Operator(first.getLine(), span(first, previous()), ":", parts);
    }

    private Node parseAtom() throws ParseException {
        Token t = next();
        switch (t.getKind()) {
        case NAME:
            if (t.isName("True") || t.isName("False") || t.isName("None")) {
                return new Constant(t.getLine(), t.getText());
            }
            checkNotKeyword(t);
            return new Name(t.getLine(), t.getText(), t.getText(), ExprContext.LOAD);
        case NUMBER:
            return new Constant(t.getLine(), t.getText());
        case STRING:
            while (peek().getKind() == TokenKind.STRING) {
                next();
            }
            return new Constant(t.getLine(), span(t, previous()));
        case OPERATOR:
            if (t.isOperator("(")) {
                return parseParenthesized(t);
            }
            if (t.isOperator("[")) {
                List<Node> elements = parseSequenceElements("]");
                return new Sequence(t.getLine(), span(t, previous()), elements, ExprContext.LOAD, true);
            }
            if (t.isOperator("{")) {
                return parseDisplay(t);
            }
            if (t.isOperator("...")) {
                return new Constant(t.getLine(), t.getText());
            }
            throw error("unexpected '" + t.getText() + "'", t);
        default:
            throw error("unexpected " + describe(t), t);
        }
    }

    /**
     * Parenthesized expression or tuple, the opening parenthesis has been consumed
     */
    private Node parseParenthesized(Token open) throws ParseException {
        if (accept(")")) {
            return new Sequence(open.getLine(), span(open, previous()), Collections.<Node> emptyList(),
                    ExprContext.LOAD, false);
        }
        Node e = parseTest();
        if (accept(")")) {
            return e;
        }
        expect(",");
        List<Node> elements = new ArrayList<>();
        elements.add(e);
        elements.addAll(parseSequenceElements(")"));
        return new Sequence(open.getLine(), span(open, previous()), elements, ExprContext.LOAD, false);
    }

    /**
     * Comma separated expressions up to and including the closing bracket, a trailing comma is allowed
     */
    private List<Node> parseSequenceElements(String close) throws ParseException {
        List<Node> elements = new ArrayList<>();
        while (!peek().isOperator(close)) {
            elements.add(parseTest());
            if (!accept(",")) {
                break;
            }
        }
        expect(close);
        return elements;
    }

    /**
     * Dictionary or set display, represented as an {@link Operator} "{}" over all keys and values
     */
    private Node parseDisplay(Token open) throws ParseException {
        List<Node> parts = new ArrayList<>();
        while (!peek().isOperator("}")) {
            parts.add(parseTest());
            if (accept(":")) {
                parts.add(parseTest());
            }
            if (!accept(",")) {
                break;
            }
        }
        expect("}");
        return new Operator(open.getLine(), span(open, previous()), "{}", parts);
    }

    /////////////
    // Helpers //
    /////////////

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAhead(int n) {
        return tokens.get(Math.min(pos + n, tokens.size() - 1));
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.getKind() != TokenKind.END) {
            pos++;
        }
        return t;
    }

    /**
     * Last consumed token
     */
    private Token previous() {
        return tokens.get(pos - 1);
    }

    private boolean accept(String operator) {
        if (peek().isOperator(operator)) {
            pos++;
            return true;
        }
        return false;
    }

    private boolean accept(String text, TokenKind kind) {
        if (peek().getKind() == kind && peek().getText().equals(text)) {
            pos++;
            return true;
        }
        return false;
    }

    private Token expect(String operator) throws ParseException {
        if (!peek().isOperator(operator)) {
            throw error("expected '" + operator + "' but found " + describe(peek()), peek());
        }
        return next();
    }

    private Token expect(TokenKind kind) throws ParseException {
        if (peek().getKind() != kind) {
            throw error("expected " + kind + " but found " + describe(peek()), peek());
        }
        return next();
    }

    private Token expectName(String keyword) throws ParseException {
        if (!peek().isName(keyword)) {
            throw error("expected '" + keyword + "' but found " + describe(peek()), peek());
        }
        return next();
    }

    private static void checkNotKeyword(Token t) throws ParseException {
        if (KEYWORDS.contains(t.getText())) {
            throw error("unexpected keyword '" + t.getText() + "'", t);
        }
    }

    /**
     * Keywords that may start an expression statement
     */
    private static boolean isExpressionKeyword(Token t) {
        return t.isName("not") || t.isName("True") || t.isName("False") || t.isName("None")
                || t.isName("lambda");
    }

    private static boolean endsStatement(Token t) {
        return t.getKind() == TokenKind.NEWLINE || t.getKind() == TokenKind.END || t.isOperator(";");
    }

    /**
     * Whether a trailing comma of an expression list is followed by the end of the list
     */
    private static boolean endsExpressionList(Token t) {
        return endsStatement(t) || t.isOperator("=") || t.isOperator(":") || t.isOperator(")")
                || (t.getKind() == TokenKind.OPERATOR && AUGMENTED_OPERATORS.contains(t.getText()));
    }

    /**
     * Source text from the start of <code>from</code> to the end of <code>to</code>
     */
    private String span(Token from, Token to) {
        if (to.getEnd() < from.getStart()) {
            return from.getText();
        }
        return source.substring(from.getStart(), to.getEnd());
    }

    private static String describe(Token t) {
        switch (t.getKind()) {
        case NEWLINE:
            return "end of line";
        case END:
            return "end of input";
        case INDENT:
            return "indent";
        case DEDENT:
            return "dedent";
        default:
            return "'" + t.getText() + "'";
        }
    }

    private static ParseException error(String message, Token t) {
        return new ParseException(message, t.getLine());
    }
}

package com.valyxo.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.valyxo.script.parser.Expr.Binary;
import com.valyxo.script.parser.Expr.DictLiteral;
import com.valyxo.script.parser.Expr.Index;
import com.valyxo.script.parser.Expr.ListLiteral;
import com.valyxo.script.parser.Expr.Literal;
import com.valyxo.script.parser.Expr.Logical;
import com.valyxo.script.parser.Expr.Unary;
import com.valyxo.script.parser.Expr.Variable;
import com.valyxo.script.parser.Statement.CallStmt;
import com.valyxo.script.parser.Statement.ExitStmt;
import com.valyxo.script.parser.Statement.ForStmt;
import com.valyxo.script.parser.Statement.FuncDefStmt;
import com.valyxo.script.parser.Statement.IfStmt;
import com.valyxo.script.parser.Statement.PrintStmt;
import com.valyxo.script.parser.Statement.SetStmt;
import com.valyxo.script.parser.Statement.Stmt;
import com.valyxo.script.parser.Statement.VarsStmt;
import com.valyxo.script.parser.Statement.WhileStmt;

/**
 * Recursive-descent parser for statements and the restricted expression grammar.
 *
 * Expression precedence, lowest to highest:
 * or, and, not, comparison, additive, multiplicative, power, unary minus, postfix index, primary.
 */
public class Parser {
    static final int MAX_PARAMS = 64;

    private final List<Token> tokens;
    private final Map<Integer, String> sourceByLine = new HashMap<>();
    private int current = 0;

    public Parser(List<Token> tokens, List<SourceLine> lines) {
        this.tokens = tokens;
        if (lines != null) {
            for (SourceLine sl : lines) sourceByLine.put(sl.number, sl.text);
        }
    }

    /** Lexes and parses a chunk of source lines into statements. */
    public static List<Stmt> parseProgram(List<SourceLine> lines) {
        List<Token> tokens = new Lexer(lines).tokenize();
        return new Parser(tokens, lines).parse();
    }

    /** Parses one standalone expression. */
    public static Expr.ExprInterface parseExpression(String text) {
        List<SourceLine> lines = Collections.singletonList(new SourceLine(1, text.trim()));
        List<Token> tokens = new Lexer(lines).tokenize();
        Parser parser = new Parser(tokens, lines);
        Expr.ExprInterface expr = parser.expression();
        parser.match(TokenType.NEWLINE);
        if (!parser.isAtEnd()) {
            throw parser.error(parser.peek(), "Unexpected " + describe(parser.peek()) + " in expression.", null);
        }
        return expr;
    }

    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<>();
        skipSeparators();
        while (!isAtEnd()) {
            if (check(TokenType.RIGHT_BRACE)) {
                throw error(peek(), "Unexpected closing brace '}'.", "Check that all blocks are properly opened");
            }
            statements.add(statement());
            endOfStatement();
            skipSeparators();
        }
        return statements;
    }

    // -------------------------
    // Statements
    // -------------------------

    private Stmt statement() {
        if (match(TokenType.SET)) return setStatement();
        if (match(TokenType.PRINT)) return printStatement();
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.FOR)) return forStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.FUNC)) return funcDeclaration();
        if (match(TokenType.VARS)) return new VarsStmt(previous().line, sourceOf(previous()));
        if (match(TokenType.EXIT)) return new ExitStmt(previous().line, sourceOf(previous()));
        if (check(TokenType.IDENTIFIER)) return callStatement();
        if (check(TokenType.ELSE)) {
            throw error(peek(), "'else' without a matching 'if'.", "Put 'else' right after the closing '}' of an if block: } else {");
        }
        throw error(peek(), "Expect statement, got " + describe(peek()) + ".",
                "Statements start with set, print, if, for, while, func, vars, exit or a function call");
    }

    private Stmt setStatement() {
        Token keyword = previous();
        if (!check(TokenType.IDENTIFIER)) {
            if (!isSeparator(peek()) && Lexer.isKeyword(peek().lexeme)) {
                throw error(peek(), "Invalid variable name: '" + peek().lexeme + "' is a reserved word.",
                        "Variable names must start with letter or underscore, contain only alphanumerics");
            }
            throw error(peek(), "Expect variable name after 'set'.", "Use: set <variable> = <value>");
        }
        Token name = advance();
        consume(TokenType.EQUAL, "Expect '=' after variable name.", "Use: set " + name.lexeme + " = <value>");
        Expr.ExprInterface value = expression();
        return new SetStmt(keyword.line, sourceOf(keyword), name, value);
    }

    private Stmt printStatement() {
        Token keyword = previous();
        List<Expr.ExprInterface> exprs = new ArrayList<>();
        if (!atStatementEnd()) {
            do {
                exprs.add(expression());
            } while (match(TokenType.COMMA));
        }
        return new PrintStmt(keyword.line, sourceOf(keyword), exprs);
    }

    private Stmt ifStatement() {
        Token keyword = previous();
        Expr.ExprInterface condition = bracketedCondition("if");
        consume(TokenType.THEN, "Expect 'then' after if condition.", "Use: if [condition] then { ... }");

        if (match(TokenType.LEFT_BRACKET)) {
            // inline form: if [c] then [stmt] else [stmt]
            List<Stmt> thenBlock = inlineBody();
            List<Stmt> elseBlock = null;
            if (match(TokenType.ELSE)) {
                consume(TokenType.LEFT_BRACKET, "Expect '[' after 'else'.", "Use: if [condition] then [command] else [command]");
                elseBlock = inlineBody();
            }
            return new IfStmt(keyword.line, sourceOf(keyword), condition, thenBlock, elseBlock);
        }

        consume(TokenType.LEFT_BRACE, "Expect '{' or '[' after 'then'.", "Use: if [condition] then { ... } or if [condition] then [command]");
        List<Stmt> thenBlock = block();
        List<Stmt> elseBlock = null;

        // 'else' may sit on the line after the closing brace
        int save = current;
        while (match(TokenType.NEWLINE)) { }
        if (match(TokenType.ELSE)) {
            if (match(TokenType.IF)) {
                List<Stmt> chained = new ArrayList<>();
                chained.add(ifStatement());
                elseBlock = chained;
            } else {
                consume(TokenType.LEFT_BRACE, "Expect '{' after 'else'.", "Use: } else { ... }");
                elseBlock = block();
            }
        } else {
            current = save;
        }
        return new IfStmt(keyword.line, sourceOf(keyword), condition, thenBlock, elseBlock);
    }

    private Stmt forStatement() {
        Token keyword = previous();
        Token var = consume(TokenType.IDENTIFIER, "Expect loop variable after 'for'.", "Use: for i in 1 to 10 { ... }");
        consume(TokenType.IN, "Expect 'in' after loop variable.", "Use: for " + var.lexeme + " in 1 to 10 { ... }");
        Expr.ExprInterface start = expression();
        consume(TokenType.TO, "Expect 'to' between loop bounds.", "Use: for " + var.lexeme + " in 1 to 10 { ... }");
        Expr.ExprInterface end = expression();
        consume(TokenType.LEFT_BRACE, "Expect '{' before loop body.", null);
        List<Stmt> body = block();
        return new ForStmt(keyword.line, sourceOf(keyword), var, start, end, body);
    }

    private Stmt whileStatement() {
        Token keyword = previous();
        Expr.ExprInterface condition = bracketedCondition("while");
        consume(TokenType.LEFT_BRACE, "Expect '{' before loop body.", "Use: while [condition] { ... }");
        List<Stmt> body = block();
        return new WhileStmt(keyword.line, sourceOf(keyword), condition, body);
    }

    private Stmt funcDeclaration() {
        Token keyword = previous();
        Token name = consume(TokenType.IDENTIFIER, "Expect function name.", "Use: func name(a, b) { ... }");
        consume(TokenType.LEFT_PAREN, "Expect '(' after function name.", "Use: func " + name.lexeme + "(a, b) { ... }");

        List<Token> params = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (params.size() >= MAX_PARAMS) {
                    throw error(peek(), "Too many parameters (max " + MAX_PARAMS + ").", null);
                }
                Token p = consume(TokenType.IDENTIFIER, "Expect parameter name.", null);
                if (!seen.add(p.lexeme)) {
                    throw error(p, "Duplicate parameter '" + p.lexeme + "'.", null);
                }
                params.add(p);
            } while (match(TokenType.COMMA));
        }

        consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters.", null);
        consume(TokenType.LEFT_BRACE, "Expect '{' before function body.", "Use: func " + name.lexeme + "(...) { ... }");
        List<Stmt> body = block();
        return new FuncDefStmt(keyword.line, sourceOf(keyword), name, params, body);
    }

    private Stmt callStatement() {
        Token name = advance();
        if (!match(TokenType.LEFT_PAREN)) {
            String hint = check(TokenType.EQUAL)
                    ? "Use: set " + name.lexeme + " = <value>"
                    : "Call a function with: " + name.lexeme + "(args)";
            throw error(name, "Unknown command '" + name.lexeme + "'.", hint);
        }
        List<Expr.ExprInterface> args = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                args.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.", null);
        return new CallStmt(name.line, sourceOf(name), name, args);
    }

    private Expr.ExprInterface bracketedCondition(String keyword) {
        consume(TokenType.LEFT_BRACKET, "Expect '[' after '" + keyword + "'.",
                "Conditions are written in brackets: " + keyword + " [x > 0]");
        Expr.ExprInterface condition = expression();
        consume(TokenType.RIGHT_BRACKET, "Expect ']' after condition.", "Check parentheses, brackets, and quotes");
        return condition;
    }

    /** Statements up to the closing '}' (the '{' is already consumed). */
    private List<Stmt> block() {
        List<Stmt> statements = new ArrayList<>();
        skipSeparators();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            statements.add(statement());
            endOfStatement();
            skipSeparators();
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' to close block.", "Add a closing '}'");
        return statements;
    }

    /** Statements up to the closing ']' of an inline if branch. */
    private List<Stmt> inlineBody() {
        List<Stmt> statements = new ArrayList<>();
        while (match(TokenType.SEMICOLON)) { }
        while (!check(TokenType.RIGHT_BRACKET) && !isAtEnd() && !check(TokenType.NEWLINE)) {
            statements.add(statement());
            endOfStatement();
            while (match(TokenType.SEMICOLON)) { }
        }
        consume(TokenType.RIGHT_BRACKET, "Expect ']' after inline command.", "Use: if [condition] then [command] else [command]");
        return statements;
    }

    private void endOfStatement() {
        if (atStatementEnd()) return;
        throw error(peek(), "Unexpected " + describe(peek()) + " after statement.",
                "Put each statement on its own line or separate them with ';'");
    }

    private boolean atStatementEnd() {
        return isAtEnd() || isSeparator(peek())
                || check(TokenType.RIGHT_BRACE) || check(TokenType.RIGHT_BRACKET);
    }

    private static boolean isSeparator(Token t) {
        return t.type == TokenType.NEWLINE || t.type == TokenType.SEMICOLON || t.type == TokenType.EOF;
    }

    private void skipSeparators() {
        while (match(TokenType.NEWLINE, TokenType.SEMICOLON)) { }
    }

    // -------------------------
    // Expressions
    // -------------------------

    public Expr.ExprInterface expression() { return or(); }

    private Expr.ExprInterface or() {
        Expr.ExprInterface expr = and();
        while (match(TokenType.OR)) {
            Token op = previous();
            Expr.ExprInterface right = and();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface and() {
        Expr.ExprInterface expr = not();
        while (match(TokenType.AND)) {
            Token op = previous();
            Expr.ExprInterface right = not();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface not() {
        if (match(TokenType.NOT)) {
            Token op = previous();
            return new Unary(op, not());
        }
        return comparison();
    }

    private Expr.ExprInterface comparison() {
        Expr.ExprInterface expr = additive();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL,
                TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
            Token op = previous();
            Expr.ExprInterface right = additive();
            expr = new Binary(expr, op, right);
        }
        if (check(TokenType.EQUAL)) {
            throw error(peek(), "Unexpected '=' in expression.", "Use '==' to compare values");
        }
        return expr;
    }

    private Expr.ExprInterface additive() {
        Expr.ExprInterface expr = multiplicative();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = multiplicative();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface multiplicative() {
        Expr.ExprInterface expr = power();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.DOUBLE_SLASH, TokenType.PERCENT)) {
            Token op = previous();
            Expr.ExprInterface right = power();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    // right-associative: 2 ** 3 ** 2 == 2 ** 9
    private Expr.ExprInterface power() {
        Expr.ExprInterface base = unary();
        if (match(TokenType.DOUBLE_STAR)) {
            Token op = previous();
            Expr.ExprInterface exponent = power();
            return new Binary(base, op, exponent);
        }
        return base;
    }

    private Expr.ExprInterface unary() {
        if (match(TokenType.MINUS, TokenType.PLUS)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            return new Unary(op, right);
        }
        return postfix();
    }

    private Expr.ExprInterface postfix() {
        Expr.ExprInterface expr = primary();
        while (match(TokenType.LEFT_BRACKET)) {
            Token bracket = previous();
            Expr.ExprInterface index = expression();
            consume(TokenType.RIGHT_BRACKET, "Expect ']' after index.", null);
            expr = new Index(expr, index, bracket);
        }
        return expr;
    }

    private Expr.ExprInterface primary() {
        if (match(TokenType.FALSE)) return new Literal(Value.bool(false));
        if (match(TokenType.TRUE)) return new Literal(Value.bool(true));
        if (match(TokenType.NONE)) return new Literal(Value.none());
        if (match(TokenType.INTEGER)) return new Literal(Value.integer((java.math.BigInteger) previous().literal));
        if (match(TokenType.FLOAT)) return new Literal(Value.floating((Double) previous().literal));
        if (match(TokenType.STRING)) return new Literal(Value.string((String) previous().literal));

        if (match(TokenType.IDENTIFIER)) {
            Token name = previous();
            if (check(TokenType.LEFT_PAREN)) {
                throw error(name, "Function calls are not allowed in expressions.",
                        "Call functions as a statement on their own line: " + name.lexeme + "(...)");
            }
            return new Variable(name);
        }

        if (match(TokenType.LEFT_PAREN)) {
            Expr.ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.", "Check parentheses, brackets, and quotes");
            return expr;
        }

        if (match(TokenType.LEFT_BRACKET)) {
            List<Expr.ExprInterface> items = new ArrayList<>();
            if (!check(TokenType.RIGHT_BRACKET)) {
                do {
                    items.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_BRACKET, "Expect ']' after list literal.", "Check parentheses, brackets, and quotes");
            return new ListLiteral(items);
        }

        if (match(TokenType.LEFT_BRACE)) {
            LinkedHashMap<String, Expr.ExprInterface> entries = new LinkedHashMap<>();
            if (!check(TokenType.RIGHT_BRACE)) {
                do {
                    Token key = consume(TokenType.STRING, "Expect string key in dict literal.", "Use: {\"key\": value}");
                    consume(TokenType.COLON, "Expect ':' after dict key.", null);
                    entries.put((String) key.literal, expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_BRACE, "Expect '}' after dict literal.", null);
            return new DictLiteral(entries);
        }

        throw error(peek(), "Expect expression, got " + describe(peek()) + ".", null);
    }

    // -------------------------
    // Token helpers
    // -------------------------

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message, String suggestion) {
        if (check(type)) return advance();
        throw error(peek(), message, suggestion);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return type == TokenType.EOF;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private String sourceOf(Token token) {
        return sourceByLine.get(token.line);
    }

    private static String describe(Token token) {
        switch (token.type) {
            case NEWLINE: return "end of line";
            case EOF: return "end of input";
            default: return "'" + token.lexeme + "'";
        }
    }

    private ScriptError error(Token token, String message, String suggestion) {
        return new ScriptError(ErrorKind.SYNTAX_ERROR, token.line, sourceOf(token), message, suggestion);
    }
}

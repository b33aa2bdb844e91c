package com.github.izanami.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.github.izanami.Tokenizer.Token;
import com.github.izanami.Tokenizer.TokenType;
import com.github.izanami.Tokenizer.Tokens;
import com.github.izanami.parser.CompilationUnit.AssignmentExpression;
import com.github.izanami.parser.CompilationUnit.BinaryExpression;
import com.github.izanami.parser.CompilationUnit.BlockStatement;
import com.github.izanami.parser.CompilationUnit.BreakStatement;
import com.github.izanami.parser.CompilationUnit.CallExpression;
import com.github.izanami.parser.CompilationUnit.Expression;
import com.github.izanami.parser.CompilationUnit.ExpressionStatement;
import com.github.izanami.parser.CompilationUnit.FunctionDeclaration;
import com.github.izanami.parser.CompilationUnit.GroupingExpression;
import com.github.izanami.parser.CompilationUnit.IfStatement;
import com.github.izanami.parser.CompilationUnit.LiteralExpression;
import com.github.izanami.parser.CompilationUnit.LogicalExpression;
import com.github.izanami.parser.CompilationUnit.PrintStatement;
import com.github.izanami.parser.CompilationUnit.ReturnStatement;
import com.github.izanami.parser.CompilationUnit.Statement;
import com.github.izanami.parser.CompilationUnit.TernaryExpression;
import com.github.izanami.parser.CompilationUnit.UnaryExpression;
import com.github.izanami.parser.CompilationUnit.VariableDeclaration;
import com.github.izanami.parser.CompilationUnit.VariableExpression;
import com.github.izanami.parser.CompilationUnit.WhileStatement;
import com.github.izanami.runtime.BooleanValue;
import com.github.izanami.runtime.NilValue;

public class Parser {

    static final int MAX_ARGUMENTS = 255;

    private final List<ParseError> errors = new ArrayList<>();
    private int loopDepth;
    private int functionDepth;

    public CompilationUnit parseCompilationUnit(Tokens tokens) {
        List<Statement> statements = new ArrayList<>();
        List<ParseError> unitErrors = new ArrayList<>();

        for (var result : parseDeclarations(tokens)) {
            if (result instanceof ParseResult.Success success) {
                statements.add(success.statement());
            } else if (result instanceof ParseResult.Failure failure) {
                unitErrors.addAll(failure.errors());
            }
        }

        return new CompilationUnit(statements, unitErrors);
    }

    public List<ParseResult> parseDeclarations(Tokens tokens) {
        loopDepth = 0;
        functionDepth = 0;

        List<ParseResult> results = new ArrayList<>();
        while (!tokens.isAtEnd()) {
            errors.clear();
            var statement = parseDeclarationOrRecover(tokens);
            if (errors.isEmpty()) {
                results.add(new ParseResult.Success(statement.orElseThrow()));
            } else {
                results.add(new ParseResult.Failure(List.copyOf(errors)));
            }
        }
        return results;
    }

    private Optional<Statement> parseDeclarationOrRecover(Tokens tokens) {
        try {
            return Optional.of(parseDeclaration(tokens));
        } catch (ParseError e) {
            errors.add(e);
            synchronize(tokens);
            return Optional.empty();
        }
    }

    // discard tokens until the previous one closed a statement or the next one opens one
    private void synchronize(Tokens tokens) {
        tokens.next();

        while (!tokens.isAtEnd()) {
            if (tokens.previous().type() == TokenType.SEMICOLON) {
                return;
            }

            switch (tokens.peek().type()) {
                case CLASS, FUN, VAR, FOR, IF, WHILE, PRINT, RETURN -> {
                    return;
                }
                default -> tokens.next();
            }
        }
    }

    // <> funDecl | varDecl | statement
    Statement parseDeclaration(Tokens tokens) {
        var token = tokens.peek();

        return switch (token.type()) {
            case FUN -> parseFunctionDeclaration(tokens);
            case VAR -> parseVariableDeclaration(tokens);
            default -> parseStatement(tokens);
        };
    }

    private Statement parseStatement(Tokens tokens) {
        var token = tokens.peek();

        return switch (token.type()) {
            case PRINT -> parsePrintStatement(tokens);
            case LBRACE -> {
                tokens.next();
                yield new BlockStatement(parseBlock(tokens));
            }
            case IF -> parseIfStatement(tokens);
            case WHILE -> parseWhileStatement(tokens);
            case FOR -> parseForStatement(tokens);
            case BREAK -> parseBreakStatement(tokens);
            case RETURN -> parseReturnStatement(tokens);
            default -> parseExpressionStatement(tokens);
        };
    }

    // <> fun name "(" parameters? ")" block
    private FunctionDeclaration parseFunctionDeclaration(Tokens tokens) {
        next(tokens, TokenType.FUN, "Expect 'fun'.");
        var nameToken = next(tokens, TokenType.IDENTIFIER, "Expect function name.");
        next(tokens, TokenType.LPAREN, "Expect '(' after function name.");

        List<Token> parameters = new ArrayList<>();
        if (!tokens.matches(TokenType.RPAREN)) {
            do {
                if (parameters.size() >= MAX_ARGUMENTS) {
                    throw new ParseError(tokens.peek(), "Can't have more than " + MAX_ARGUMENTS + " parameters.");
                }
                parameters.add(next(tokens, TokenType.IDENTIFIER, "Expect parameter name."));
            } while (tokens.advanceIf(TokenType.COMMA));
        }
        next(tokens, TokenType.RPAREN, "Expect ')' after parameters.");
        next(tokens, TokenType.LBRACE, "Expect '{' before function body.");

        // a function body starts outside of any loop, whatever encloses the declaration
        int enclosingLoopDepth = loopDepth;
        loopDepth = 0;
        functionDepth++;
        try {
            var body = parseBlock(tokens);
            return new FunctionDeclaration(nameToken, parameters, body);
        } finally {
            functionDepth--;
            loopDepth = enclosingLoopDepth;
        }
    }

    // <> var name ( "=" expression )? ";"
    private VariableDeclaration parseVariableDeclaration(Tokens tokens) {
        next(tokens, TokenType.VAR, "Expect 'var'.");
        var nameToken = next(tokens, TokenType.IDENTIFIER, "Expect variable name.");

        Optional<Expression> initializer = Optional.empty();
        if (tokens.advanceIf(TokenType.EQUALS)) {
            initializer = Optional.of(parseExpression(tokens));
        }
        next(tokens, TokenType.SEMICOLON, "Expect ';' after variable declaration.");
        return new VariableDeclaration(nameToken, initializer);
    }

    private PrintStatement parsePrintStatement(Tokens tokens) {
        next(tokens, TokenType.PRINT, "Expect 'print'.");
        var value = parseExpression(tokens);
        next(tokens, TokenType.SEMICOLON, "Expect ';' after value.");
        return new PrintStatement(value);
    }

    private ExpressionStatement parseExpressionStatement(Tokens tokens) {
        var expression = parseExpression(tokens);
        next(tokens, TokenType.SEMICOLON, "Expect ';' after expression.");
        return new ExpressionStatement(expression);
    }

    // "{" already consumed <> declaration* "}"
    private List<Statement> parseBlock(Tokens tokens) {
        List<Statement> statements = new ArrayList<>();
        while (!tokens.matches(TokenType.RBRACE) && !tokens.isAtEnd()) {
            parseDeclarationOrRecover(tokens).ifPresent(statements::add);
        }
        next(tokens, TokenType.RBRACE, "Expect '}' after block.");
        return statements;
    }

    // <> if "(" expression ")" statement ( else statement )?
    private IfStatement parseIfStatement(Tokens tokens) {
        next(tokens, TokenType.IF, "Expect 'if'.");
        next(tokens, TokenType.LPAREN, "Expect '(' after 'if'.");
        var condition = parseExpression(tokens);
        next(tokens, TokenType.RPAREN, "Expect ')' after if condition.");

        var thenBranch = parseStatement(tokens);
        Optional<Statement> elseBranch = Optional.empty();
        if (tokens.advanceIf(TokenType.ELSE)) {
            elseBranch = Optional.of(parseStatement(tokens));
        }
        return new IfStatement(condition, thenBranch, elseBranch);
    }

    // <> while "(" expression ")" statement
    private WhileStatement parseWhileStatement(Tokens tokens) {
        next(tokens, TokenType.WHILE, "Expect 'while'.");
        next(tokens, TokenType.LPAREN, "Expect '(' after 'while'.");
        var condition = parseExpression(tokens);
        next(tokens, TokenType.RPAREN, "Expect ')' after condition.");

        return new WhileStatement(condition, parseLoopBody(tokens));
    }

    // <> for "(" ( varDecl | exprStmt | ";" ) expression? ";" expression? ")" statement
    // desugared into { initializer; while (condition) { body; increment; } }
    private BlockStatement parseForStatement(Tokens tokens) {
        next(tokens, TokenType.FOR, "Expect 'for'.");
        next(tokens, TokenType.LPAREN, "Expect '(' after 'for'.");

        Optional<Statement> initializer;
        if (tokens.advanceIf(TokenType.SEMICOLON)) {
            initializer = Optional.empty();
        } else if (tokens.matches(TokenType.VAR)) {
            initializer = Optional.of(parseVariableDeclaration(tokens));
        } else {
            initializer = Optional.of(parseExpressionStatement(tokens));
        }

        Expression condition = new LiteralExpression(BooleanValue.TRUE);
        if (!tokens.matches(TokenType.SEMICOLON)) {
            condition = parseExpression(tokens);
        }
        next(tokens, TokenType.SEMICOLON, "Expect ';' after loop condition.");

        Optional<Expression> increment = Optional.empty();
        if (!tokens.matches(TokenType.RPAREN)) {
            increment = Optional.of(parseExpression(tokens));
        }
        next(tokens, TokenType.RPAREN, "Expect ')' after for clauses.");

        var body = parseLoopBody(tokens);

        List<Statement> loopBody = new ArrayList<>();
        loopBody.add(body);
        increment.ifPresent(i -> loopBody.add(new ExpressionStatement(i)));

        List<Statement> outer = new ArrayList<>();
        initializer.ifPresent(outer::add);
        outer.add(new WhileStatement(condition, new BlockStatement(loopBody)));
        return new BlockStatement(outer);
    }

    private Statement parseLoopBody(Tokens tokens) {
        loopDepth++;
        try {
            return parseStatement(tokens);
        } finally {
            loopDepth--;
        }
    }

    private BreakStatement parseBreakStatement(Tokens tokens) {
        var keyword = next(tokens, TokenType.BREAK, "Expect 'break'.");
        if (loopDepth == 0) {
            throw new ParseError(keyword, "Must be inside a loop to use 'break'.");
        }
        next(tokens, TokenType.SEMICOLON, "Expect ';' after 'break'.");
        return new BreakStatement(keyword);
    }

    private ReturnStatement parseReturnStatement(Tokens tokens) {
        var keyword = next(tokens, TokenType.RETURN, "Expect 'return'.");
        if (functionDepth == 0) {
            throw new ParseError(keyword, "Can't return from top-level code.");
        }

        Optional<Expression> value = Optional.empty();
        if (!tokens.matches(TokenType.SEMICOLON)) {
            value = Optional.of(parseExpression(tokens));
        }
        next(tokens, TokenType.SEMICOLON, "Expect ';' after return value.");
        return new ReturnStatement(keyword, value);
    }

    public Expression parseExpression(Tokens tokens) {
        return parseComma(tokens);
    }

    // <> assignment ( "," assignment )*
    private Expression parseComma(Tokens tokens) {
        var expr = parseAssignment(tokens);

        while (tokens.advanceIf(TokenType.COMMA)) {
            var operator = tokens.previous();
            var right = parseAssignment(tokens);
            expr = new BinaryExpression(expr, operator, right);
        }
        return expr;
    }

    // <> ternary ( "=" assignment )?
    private Expression parseAssignment(Tokens tokens) {
        var expr = parseTernary(tokens);

        if (tokens.advanceIf(TokenType.EQUALS)) {
            var equals = tokens.previous();
            var value = parseAssignment(tokens);
            if (expr instanceof VariableExpression ve) {
                return new AssignmentExpression(ve.name(), value);
            }
            throw new ParseError(equals, "Invalid assignment target.");
        }
        return expr;
    }

    // <> logic_or ( "?" expression ":" ternary )?
    private Expression parseTernary(Tokens tokens) {
        var expr = parseOr(tokens);

        if (tokens.advanceIf(TokenType.QUESTION)) {
            var thenBranch = parseExpression(tokens);
            next(tokens, TokenType.COLON, "Expect ':' after then branch of ternary expression.");
            var elseBranch = parseTernary(tokens);
            expr = new TernaryExpression(expr, thenBranch, elseBranch);
        }
        return expr;
    }

    private Expression parseOr(Tokens tokens) {
        var expr = parseAnd(tokens);

        while (tokens.advanceIf(TokenType.OR)) {
            var operator = tokens.previous();
            var right = parseAnd(tokens);
            expr = new LogicalExpression(expr, operator, right);
        }
        return expr;
    }

    private Expression parseAnd(Tokens tokens) {
        var expr = parseEquality(tokens);

        while (tokens.advanceIf(TokenType.AND)) {
            var operator = tokens.previous();
            var right = parseEquality(tokens);
            expr = new LogicalExpression(expr, operator, right);
        }
        return expr;
    }

    private Expression parseEquality(Tokens tokens) {
        var expr = parseComparison(tokens);

        while (tokens.advanceIf(TokenType.NOT_EQUALS, TokenType.EQUALS_EQUALS)) {
            var operator = tokens.previous();
            var right = parseComparison(tokens);
            expr = new BinaryExpression(expr, operator, right);
        }
        return expr;
    }

    private Expression parseComparison(Tokens tokens) {
        var expr = parseTerm(tokens);

        while (tokens.advanceIf(TokenType.GT, TokenType.GE, TokenType.LT, TokenType.LE)) {
            var operator = tokens.previous();
            var right = parseTerm(tokens);
            expr = new BinaryExpression(expr, operator, right);
        }
        return expr;
    }

    private Expression parseTerm(Tokens tokens) {
        var expr = parseFactor(tokens);

        while (tokens.advanceIf(TokenType.MINUS, TokenType.PLUS)) {
            var operator = tokens.previous();
            var right = parseFactor(tokens);
            expr = new BinaryExpression(expr, operator, right);
        }
        return expr;
    }

    private Expression parseFactor(Tokens tokens) {
        var expr = parseUnary(tokens);

        while (tokens.advanceIf(TokenType.SLASH, TokenType.STAR)) {
            var operator = tokens.previous();
            var right = parseUnary(tokens);
            expr = new BinaryExpression(expr, operator, right);
        }
        return expr;
    }

    private Expression parseUnary(Tokens tokens) {
        if (tokens.advanceIf(TokenType.BANG, TokenType.MINUS)) {
            var operator = tokens.previous();
            var operand = parseUnary(tokens);
            return new UnaryExpression(operator, operand);
        }
        return parseCall(tokens);
    }

    // <> primary ( "(" arguments? ")" )*
    private Expression parseCall(Tokens tokens) {
        var expr = parsePrimary(tokens);

        while (tokens.advanceIf(TokenType.LPAREN)) {
            expr = finishCall(tokens, expr);
        }
        return expr;
    }

    private CallExpression finishCall(Tokens tokens, Expression callee) {
        List<Expression> arguments = new ArrayList<>();
        if (!tokens.matches(TokenType.RPAREN)) {
            do {
                if (arguments.size() >= MAX_ARGUMENTS) {
                    throw new ParseError(tokens.peek(), "Can't have more than " + MAX_ARGUMENTS + " arguments.");
                }
                arguments.add(parseAssignment(tokens));
            } while (tokens.advanceIf(TokenType.COMMA));
        }
        var paren = next(tokens, TokenType.RPAREN, "Expect ')' after arguments.");
        return new CallExpression(callee, paren, arguments);
    }

    private Expression parsePrimary(Tokens tokens) {
        var token = tokens.peek();

        return switch (token.type()) {
            case FALSE -> {
                tokens.next();
                yield new LiteralExpression(BooleanValue.FALSE);
            }
            case TRUE -> {
                tokens.next();
                yield new LiteralExpression(BooleanValue.TRUE);
            }
            case NIL -> {
                tokens.next();
                yield new LiteralExpression(NilValue.get());
            }
            case NUMBER, STRING -> {
                tokens.next();
                yield new LiteralExpression(token.literal().orElseThrow());
            }
            case IDENTIFIER -> {
                tokens.next();
                yield new VariableExpression(token);
            }
            case LPAREN -> {
                tokens.next();
                var e = parseExpression(tokens);
                next(tokens, TokenType.RPAREN, "Expect ')' after expression.");
                yield new GroupingExpression(e);
            }
            // binary operators without a left operand: parse the right side anyway, then complain
            case NOT_EQUALS, EQUALS_EQUALS -> {
                tokens.next();
                parseEquality(tokens);
                throw missingLeftOperand(token);
            }
            case GT, GE, LT, LE -> {
                tokens.next();
                parseComparison(tokens);
                throw missingLeftOperand(token);
            }
            case PLUS -> {
                tokens.next();
                parseTerm(tokens);
                throw missingLeftOperand(token);
            }
            case SLASH, STAR -> {
                tokens.next();
                parseFactor(tokens);
                throw missingLeftOperand(token);
            }
            default -> throw new ParseError(token, "Expect expression.");
        };
    }

    private static ParseError missingLeftOperand(Token operator) {
        return new ParseError(operator, "Missing left-hand operand.");
    }

    private static Token next(Tokens tokens, TokenType type, String message) {
        if (tokens.matches(type)) {
            return tokens.next();
        }
        throw new ParseError(tokens.peek(), message);
    }

}

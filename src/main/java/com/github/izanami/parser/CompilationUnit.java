package com.github.izanami.parser;

import java.util.List;
import java.util.Optional;

import com.github.izanami.Tokenizer.Token;
import com.github.izanami.runtime.Value;

public record CompilationUnit(List<Statement> statements, List<ParseError> errors) {

    public CompilationUnit {
        statements = List.copyOf(statements);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public sealed interface Statement {}

    public record BlockStatement(List<Statement> statements) implements Statement {
        public BlockStatement {
            statements = List.copyOf(statements);
        }
    }
    public record ExpressionStatement(Expression expression) implements Statement {}
    public record PrintStatement(Expression expression) implements Statement {}
    public record VariableDeclaration(Token name, Optional<Expression> initializer) implements Statement {}
    public record IfStatement(Expression condition, Statement thenBranch, Optional<Statement> elseBranch) implements Statement {}
    public record WhileStatement(Expression condition, Statement body) implements Statement {}
    public record FunctionDeclaration(Token name, List<Token> parameters, List<Statement> body) implements Statement {
        public FunctionDeclaration {
            parameters = List.copyOf(parameters);
            body = List.copyOf(body);
        }
    }
    public record ReturnStatement(Token keyword, Optional<Expression> value) implements Statement {}
    public record BreakStatement(Token keyword) implements Statement {}

    public sealed interface Expression {}

    public record TernaryExpression(Expression condition, Expression thenBranch, Expression elseBranch) implements Expression {}
    public record BinaryExpression(Expression left, Token operator, Expression right) implements Expression {}
    /** Short-circuiting {@code and} / {@code or}. */
    public record LogicalExpression(Expression left, Token operator, Expression right) implements Expression {}
    public record CallExpression(Expression callee, Token paren, List<Expression> arguments) implements Expression {
        public CallExpression {
            arguments = List.copyOf(arguments);
        }
    }
    public record GroupingExpression(Expression expression) implements Expression {}
    public record LiteralExpression(Value value) implements Expression {}
    public record UnaryExpression(Token operator, Expression operand) implements Expression {}
    public record VariableExpression(Token name) implements Expression {}
    public record AssignmentExpression(Token name, Expression value) implements Expression {}

}

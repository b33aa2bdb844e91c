package com.github.izanami.runtime;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import com.github.izanami.Tokenizer.Token;
import com.github.izanami.natives.Io;
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

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Tree-walking evaluator. Loop bodies intercept {@link BreakSignal}, function calls intercept
 * {@link ReturnSignal}, and a {@link RuntimeError} escapes {@link #interpret} to the caller.
 */
public class Interpreter {

    private final PrintStream out;
    @Getter
    @Accessors(fluent = true)
    private final Scope globals = new Scope();

    public Interpreter(PrintStream out) {
        this.out = out;
    }

    public void defineNative(NativeFunction function) {
        globals.define(function.name(), function);
    }

    /**
     * Runs the statements against the global scope, stopping at the first runtime error.
     *
     * @throws RuntimeError if evaluation fails
     */
    public void interpret(List<Statement> statements) {
        var frame = StackFrame.global(globals);
        for (var statement : statements) {
            execute(statement, frame);
        }
    }

    void execute(Statement statement, StackFrame frame) {
        if (statement instanceof ExpressionStatement es) {
            evaluate(es.expression(), frame);
        } else if (statement instanceof PrintStatement ps) {
            var value = evaluate(ps.expression(), frame);
            out.println(Io.stringify(value));
        } else if (statement instanceof VariableDeclaration vd) {
            var name = vd.name().lexeme();
            if (vd.initializer().isPresent()) {
                frame.scope().define(name, evaluate(vd.initializer().get(), frame));
            } else {
                frame.scope().declare(name);
            }
        } else if (statement instanceof BlockStatement bs) {
            executeBlock(bs.statements(), frame.pushScope());
        } else if (statement instanceof IfStatement is) {
            if (evaluate(is.condition(), frame).isTruthy()) {
                execute(is.thenBranch(), frame);
            } else if (is.elseBranch().isPresent()) {
                execute(is.elseBranch().get(), frame);
            }
        } else if (statement instanceof WhileStatement ws) {
            executeWhile(ws, frame);
        } else if (statement instanceof FunctionDeclaration fd) {
            frame.scope().define(fd.name().lexeme(), new UserFunction(fd, frame.scope()));
        } else if (statement instanceof ReturnStatement rs) {
            Value value = NilValue.get();
            if (rs.value().isPresent()) {
                value = evaluate(rs.value().get(), frame);
            }
            throw new ReturnSignal(value);
        } else if (statement instanceof BreakStatement) {
            throw new BreakSignal();
        } else {
            throw new IllegalStateException("not yet implemented " + statement);
        }
    }

    // the caller has already pushed the frame's scope
    void executeBlock(List<Statement> statements, StackFrame frame) {
        for (var statement : statements) {
            execute(statement, frame);
        }
    }

    private void executeWhile(WhileStatement ws, StackFrame frame) {
        while (evaluate(ws.condition(), frame).isTruthy()) {
            try {
                execute(ws.body(), frame);
            } catch (BreakSignal breakSignal) {
                return;
            }
        }
    }

    public Value evaluate(Expression expression, StackFrame frame) {
        if (expression instanceof LiteralExpression le) {
            return le.value();
        }
        if (expression instanceof GroupingExpression ge) {
            return evaluate(ge.expression(), frame);
        }
        if (expression instanceof VariableExpression ve) {
            return lookUpVariable(ve.name(), frame);
        }
        if (expression instanceof AssignmentExpression ae) {
            var value = evaluate(ae.value(), frame);
            try {
                frame.scope().assign(ae.name().lexeme(), value);
            } catch (SymbolNotFoundException e) {
                throw undefinedVariable(ae.name());
            }
            return value;
        }
        if (expression instanceof UnaryExpression ue) {
            return evaluateUnary(ue, frame);
        }
        if (expression instanceof BinaryExpression be) {
            var left = evaluate(be.left(), frame);
            var right = evaluate(be.right(), frame);
            return evaluateBinary(be.operator(), left, right);
        }
        if (expression instanceof LogicalExpression lo) {
            var left = evaluate(lo.left(), frame);
            return switch (lo.operator().type()) {
                case OR -> left.isTruthy() ? left : evaluate(lo.right(), frame);
                case AND -> !left.isTruthy() ? left : evaluate(lo.right(), frame);
                default -> throw new IllegalStateException("not a logical operator " + lo.operator());
            };
        }
        if (expression instanceof TernaryExpression te) {
            return evaluate(te.condition(), frame).isTruthy()
                ? evaluate(te.thenBranch(), frame)
                : evaluate(te.elseBranch(), frame);
        }
        if (expression instanceof CallExpression ce) {
            return evaluateCall(ce, frame);
        }
        throw new IllegalStateException("not yet implemented " + expression);
    }

    private Value lookUpVariable(Token name, StackFrame frame) {
        try {
            return frame.scope().get(name.lexeme())
                .orElseThrow(() -> new RuntimeError(name, "Uninitialized variable '" + name.lexeme() + "'."));
        } catch (SymbolNotFoundException e) {
            throw undefinedVariable(name);
        }
    }

    private static RuntimeError undefinedVariable(Token name) {
        return new RuntimeError(name, "Undefined variable '" + name.lexeme() + "'.");
    }

    private Value evaluateUnary(UnaryExpression ue, StackFrame frame) {
        var operand = evaluate(ue.operand(), frame);
        var operator = ue.operator();

        return switch (operator.type()) {
            case BANG -> BooleanValue.of(!operand.isTruthy());
            case MINUS -> {
                if (operand instanceof NumberValue nv) {
                    yield new NumberValue(-nv.number());
                }
                throw new RuntimeError(operator, "Operand must be a number.");
            }
            default -> throw new IllegalStateException("not a unary operator " + operator);
        };
    }

    private Value evaluateBinary(Token operator, Value left, Value right) {
        return switch (operator.type()) {
            // both sides already ran for their side effects; the right one is the result
            case COMMA -> right;
            case EQUALS_EQUALS -> BooleanValue.of(Value.isEqual(left, right));
            case NOT_EQUALS -> BooleanValue.of(!Value.isEqual(left, right));
            case GT, GE, LT, LE, MINUS, STAR, SLASH -> arithmetic(operator, left, right);
            case PLUS -> add(operator, left, right);
            default -> throw new IllegalStateException("not a binary operator " + operator);
        };
    }

    private static Value arithmetic(Token operator, Value left, Value right) {
        if (!(left instanceof NumberValue ln && right instanceof NumberValue rn)) {
            throw new RuntimeError(operator, "Operands must be numbers.");
        }
        double l = ln.number();
        double r = rn.number();

        return switch (operator.type()) {
            case GT -> BooleanValue.of(l > r);
            case GE -> BooleanValue.of(l >= r);
            case LT -> BooleanValue.of(l < r);
            case LE -> BooleanValue.of(l <= r);
            case MINUS -> new NumberValue(l - r);
            case STAR -> new NumberValue(l * r);
            case SLASH -> new NumberValue(l / r);
            default -> throw new IllegalStateException("not an arithmetic operator " + operator);
        };
    }

    private static Value add(Token operator, Value left, Value right) {
        if (left instanceof NumberValue ln && right instanceof NumberValue rn) {
            return new NumberValue(ln.number() + rn.number());
        }
        boolean leftText = left instanceof StringValue || left instanceof NumberValue;
        boolean rightText = right instanceof StringValue || right instanceof NumberValue;
        if (leftText && rightText) {
            return new StringValue(Io.concatenationText(left) + Io.concatenationText(right));
        }
        throw new RuntimeError(operator, "Operands must be two numbers or two strings.");
    }

    private Value evaluateCall(CallExpression ce, StackFrame frame) {
        var callee = evaluate(ce.callee(), frame);

        List<Value> arguments = new ArrayList<>();
        for (var argument : ce.arguments()) {
            arguments.add(evaluate(argument, frame));
        }

        if (!(callee instanceof Callable callable)) {
            throw new RuntimeError(ce.paren(), "Can only call functions and classes.");
        }
        if (arguments.size() != callable.arity()) {
            throw new RuntimeError(ce.paren(),
                "Expected " + callable.arity() + " arguments but got " + arguments.size() + ".");
        }

        try {
            return callable.call(this, frame, arguments);
        } catch (NativeFunctionException e) {
            throw new RuntimeError(ce.paren(), e.getMessage());
        }
    }

}

package com.github.izanami.runtime;

import java.util.List;

import com.github.izanami.parser.CompilationUnit.FunctionDeclaration;

public record UserFunction(FunctionDeclaration declaration, Scope closure) implements Callable {

    @Override
    public String name() {
        return declaration.name().lexeme();
    }

    @Override
    public int arity() {
        return declaration.parameters().size();
    }

    @Override
    public Value call(Interpreter interpreter, StackFrame caller, List<Value> arguments) {
        var scope = new Scope(closure);
        var parameters = declaration.parameters();
        for (int i = 0; i < parameters.size(); i++) {
            scope.define(parameters.get(i).lexeme(), arguments.get(i));
        }

        try {
            interpreter.executeBlock(declaration.body(), caller.enter(scope));
        } catch (ReturnSignal returnSignal) {
            return returnSignal.value();
        }
        return NilValue.get();
    }

    @Override
    public String toString() {
        return "<fn " + name() + ">";
    }
}

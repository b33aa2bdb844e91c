package com.github.izanami.runtime;

import java.util.List;

public record NativeFunction(String name, int arity, NativeFunctionHandle handle) implements Callable {

    @Override
    public Value call(Interpreter interpreter, StackFrame caller, List<Value> arguments) {
        return handle.call(arguments);
    }

    @Override
    public String toString() {
        return "<fn " + name + ">";
    }

    @FunctionalInterface
    public interface NativeFunctionHandle {
        Value call(List<Value> arguments);
    }
}

package com.github.izanami.runtime;

import java.util.List;

public sealed interface Callable extends Value permits UserFunction, NativeFunction {

    String name();

    int arity();

    Value call(Interpreter interpreter, StackFrame caller, List<Value> arguments);

}

package com.github.izanami.runtime;

public abstract sealed class InterpreterSignal extends RuntimeException permits RuntimeError, BreakSignal, ReturnSignal {

    protected InterpreterSignal(String message) {
        super(message, null, false, false);
    }

}

package com.github.izanami.runtime;

public final class BreakSignal extends InterpreterSignal {

    public BreakSignal() {
        super(null);
    }

}

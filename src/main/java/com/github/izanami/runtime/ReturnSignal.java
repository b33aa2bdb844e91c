package com.github.izanami.runtime;

import lombok.Getter;
import lombok.experimental.Accessors;

public final class ReturnSignal extends InterpreterSignal {

    @Getter
    @Accessors(fluent = true)
    private final Value value;

    public ReturnSignal(Value value) {
        super(null);
        this.value = value;
    }

}

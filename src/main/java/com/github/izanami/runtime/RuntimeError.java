package com.github.izanami.runtime;

import com.github.izanami.Tokenizer.Token;

import lombok.Getter;
import lombok.experimental.Accessors;

public final class RuntimeError extends InterpreterSignal {

    @Getter
    @Accessors(fluent = true)
    private final Token token;

    public RuntimeError(Token token, String message) {
        super(message);
        this.token = token;
    }

}

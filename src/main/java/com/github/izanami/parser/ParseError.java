package com.github.izanami.parser;

import com.github.izanami.Tokenizer.Token;

import lombok.Getter;
import lombok.experimental.Accessors;

public class ParseError extends RuntimeException {

    @Getter
    @Accessors(fluent = true)
    private final Token token;

    public ParseError(Token token, String message) {
        super(message);
        this.token = token;
    }

}

package com.github.izanami;

import java.io.PrintStream;

import com.github.izanami.Tokenizer.LexError;
import com.github.izanami.Tokenizer.Token;
import com.github.izanami.Tokenizer.TokenType;
import com.github.izanami.parser.ParseError;
import com.github.izanami.runtime.RuntimeError;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class Reporter {

    private final PrintStream err;

    public void lexError(LexError error) {
        report(error.line(), "", error.message());
    }

    public void parseError(ParseError error) {
        var token = error.token();
        report(token.line(), location(token), error.getMessage());
    }

    public void runtimeError(RuntimeError error) {
        var token = error.token();
        report(token.line(), location(token), error.getMessage());
    }

    private static String location(Token token) {
        if (token.type() == TokenType.EOF) {
            return " at end";
        }
        return " at '" + token.lexeme() + "'";
    }

    private void report(int line, String location, String message) {
        err.println("[line " + line + "] Error" + location + ": " + message);
    }

}

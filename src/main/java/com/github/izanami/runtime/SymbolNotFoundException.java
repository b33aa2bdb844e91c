package com.github.izanami.runtime;

public class SymbolNotFoundException extends RuntimeException {
    public SymbolNotFoundException(String name) {
        super("symbol " + name + " not found");
    }
}

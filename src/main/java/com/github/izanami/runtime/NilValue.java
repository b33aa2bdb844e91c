package com.github.izanami.runtime;

public record NilValue() implements Value {

    private static final NilValue INSTANCE = new NilValue();

    public static NilValue get() {
        return INSTANCE;
    }

    @Override
    public boolean isTruthy() {
        return false;
    }

    @Override
    public String toString() {
        return "nil";
    }
}

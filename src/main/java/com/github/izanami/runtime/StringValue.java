package com.github.izanami.runtime;

public record StringValue(String string) implements Value {
    @Override
    public String toString() {
        return string;
    }
}

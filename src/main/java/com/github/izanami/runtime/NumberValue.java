package com.github.izanami.runtime;

public record NumberValue(double number) implements Value {
    @Override
    public String toString() {
        return Double.toString(number);
    }
}

package com.github.izanami.runtime;

public class NativeFunctionException extends RuntimeException {
    public NativeFunctionException(String message) {
        super(message);
    }
    public NativeFunctionException(String message, Throwable cause) {
        super(message, cause);
    }
}

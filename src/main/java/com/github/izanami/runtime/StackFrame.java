package com.github.izanami.runtime;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

// frames are immutable; entering a block or a call makes a new one
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public class StackFrame {

    private final Scope scope;

    public static StackFrame global(Scope globals) {
        return new StackFrame(globals);
    }

    public StackFrame pushScope() {
        return new StackFrame(new Scope(scope));
    }

    /**
     * Pushes a frame with a new scope when running a function. The scope passed encloses the
     * function definition, not the caller.
     */
    public StackFrame enter(Scope scope) {
        return new StackFrame(scope);
    }
}

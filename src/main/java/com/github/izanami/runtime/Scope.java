package com.github.izanami.runtime;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class Scope {

    // a null value marks a variable declared without an initializer
    private final Map<String, Value> variables = new HashMap<>();
    private final Scope parent;

    public Scope() {
        this(null);
    }

    public Scope(Scope parent) {
        this.parent = parent;
    }

    public void define(String name, Value value) {
        variables.put(name, value);
    }

    public void declare(String name) {
        variables.put(name, null);
    }

    /**
     * @return the value of the nearest binding, empty if that binding was never given one
     * @throws SymbolNotFoundException if no scope in the chain binds {@code name}
     */
    public Optional<Value> get(String name) {
        if (variables.containsKey(name)) {
            return Optional.ofNullable(variables.get(name));
        }
        if (parent != null) {
            return parent.get(name);
        } else {
            throw new SymbolNotFoundException(name);
        }
    }

    /**
     * Overwrites the nearest existing binding. Never creates one.
     *
     * @throws SymbolNotFoundException if no scope in the chain binds {@code name}
     */
    public void assign(String name, Value value) {
        if (variables.containsKey(name)) {
            variables.put(name, value);
        } else if (parent != null) {
            parent.assign(name, value);
        } else {
            throw new SymbolNotFoundException(name);
        }
    }

    @Override
    public String toString() {
        return variables.keySet() + (parent == null ? "" : " -> " + parent);
    }
}

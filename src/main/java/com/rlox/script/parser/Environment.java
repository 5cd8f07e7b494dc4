package com.rlox.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The single flat namespace of a run. No enclosing scopes: a name is either bound here or undefined.
 * Owned by one interpreter run at a time, so it takes no locks.
 */
public class Environment {

    private final Map<String, Value> values = new LinkedHashMap<>();

    public Environment() {
    }

    /** Seeded with host-provided bindings; entries are copied in, the map itself is not retained. */
    public Environment(Map<String, Value> initial) {
        if (initial != null) {
            for (Map.Entry<String, Value> e : initial.entrySet()) {
                define(e.getKey(), e.getValue());
            }
        }
    }

    /** Insert or overwrite. Never fails. */
    public void define(String name, Value value) {
        if (name == null) throw new IllegalArgumentException("variable name must not be null");
        values.put(name, value == null ? Value.nil() : value);
    }

    public Value get(Token name) {
        Value v = values.get(name.lexeme);
        if (v == null) {
            throw RuntimeError.undefinedVariable(name);
        }
        return v.copy();
    }

    public boolean exists(String name) {
        return values.containsKey(name);
    }

    public int size() {
        return values.size();
    }

    /** Read-only copy in definition order. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}

package com.prqlc.semantic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The lexical scope an expression is resolved in: the bound function
 * parameters, innermost first, on top of the enclosing module.
 */
public final class Scope {

    private final Scope parent;
    private final Module module;
    private final Map<String, PendingArg> params;

    private Scope(Scope parent, Module module, Map<String, PendingArg> params) {
        this.parent = parent;
        this.module = Objects.requireNonNull(module, "module must not be null");
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static Scope of(Module module) {
        return new Scope(null, module, Map.of());
    }

    public Scope withParams(Map<String, PendingArg> bound) {
        return new Scope(this, module, bound);
    }

    public Module module() {
        return module;
    }

    /**
     * Returns the argument bound to a parameter, or null if no enclosing
     * function has a parameter of that name.
     */
    public PendingArg param(String name) {
        for (Scope scope = this; scope != null; scope = scope.parent) {
            PendingArg arg = scope.params.get(name);
            if (arg != null) {
                return arg;
            }
        }
        return null;
    }

    public Map<String, PendingArg> params() {
        return params;
    }
}

package com.prqlc.semantic;

import com.prqlc.pl.Func;
import com.prqlc.pl.Internal;
import com.prqlc.pl.Span;
import com.prqlc.semantic.ir.ResolvedExpr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A function as a value: its definition, the scope it was defined in and the
 * arguments applied so far. A function value with fewer arguments than
 * parameters is the result of partial application.
 */
public final class FunctionValue extends ResolvedExpr {

    private final String name;
    private final Func func;
    private final Scope scope;
    private final List<PendingArg> args;
    private final Map<String, PendingArg> namedArgs;

    public FunctionValue(String name, Func func, Scope scope, Span span) {
        this(name, func, scope, List.of(), Map.of(), span);
    }

    private FunctionValue(String name, Func func, Scope scope, List<PendingArg> args,
                          Map<String, PendingArg> namedArgs, Span span) {
        super(span);
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.func = Objects.requireNonNull(func, "func must not be null");
        this.scope = Objects.requireNonNull(scope, "scope must not be null");
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
        this.namedArgs = Collections.unmodifiableMap(new LinkedHashMap<>(namedArgs));
    }

    /**
     * Returns a copy with more arguments applied.
     */
    public FunctionValue withArgs(List<PendingArg> allArgs, Map<String, PendingArg> allNamed, Span callSpan) {
        return new FunctionValue(name, func, scope, allArgs, allNamed, callSpan);
    }

    public String name() {
        return name;
    }

    public Func func() {
        return func;
    }

    public Scope scope() {
        return scope;
    }

    public List<PendingArg> args() {
        return args;
    }

    public Map<String, PendingArg> namedArgs() {
        return namedArgs;
    }

    /**
     * Returns how many positional arguments are still missing.
     */
    public int missing() {
        return func.params().size() - args.size();
    }

    public boolean isBuiltin() {
        return func.body() instanceof Internal;
    }

    /**
     * Returns the name of the compiler-implemented body, or null for functions
     * written in PRQL.
     */
    public String internalName() {
        return func.body() instanceof Internal internal ? internal.name() : null;
    }

    @Override
    public String toString() {
        return "function " + name + (args.isEmpty() ? "" : " " + args);
    }
}

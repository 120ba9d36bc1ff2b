package com.prqlc.pl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A function call: a callee followed by positional and named ({@code name:value}) arguments.
 *
 * <p>Named arguments keep their source order.
 */
public final class FuncCall extends Expr {

    private final Expr name;
    private final List<Expr> args;
    private final Map<String, Expr> namedArgs;

    public FuncCall(Expr name, List<Expr> args, Map<String, Expr> namedArgs, Span span, String alias) {
        super(span, alias);
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
        this.namedArgs = Collections.unmodifiableMap(new LinkedHashMap<>(namedArgs));
    }

    public FuncCall(Expr name, List<Expr> args, Span span) {
        this(name, args, Map.of(), span, null);
    }

    public Expr name() {
        return name;
    }

    public List<Expr> args() {
        return args;
    }

    public Map<String, Expr> namedArgs() {
        return namedArgs;
    }

    /**
     * Returns a copy with {@code arg} appended as the last positional argument.
     * This is how {@code a | f b} becomes {@code f b a}.
     */
    public FuncCall withTrailingArg(Expr arg) {
        List<Expr> extended = new ArrayList<>(args);
        extended.add(arg);
        return new FuncCall(name, extended, namedArgs, span, alias);
    }

    @Override
    public FuncCall withAlias(String alias) {
        return new FuncCall(name, args, namedArgs, span, alias);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(aliasPrefix()).append(name);
        for (Map.Entry<String, Expr> entry : namedArgs.entrySet()) {
            sb.append(' ').append(entry.getKey()).append(':').append(entry.getValue());
        }
        for (Expr arg : args) {
            sb.append(' ').append(arg);
        }
        return sb.toString();
    }
}

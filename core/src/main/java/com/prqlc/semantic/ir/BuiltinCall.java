package com.prqlc.semantic.ir;

import com.prqlc.pl.Span;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A call of a function implemented by the compiler, named by its full standard
 * library path such as {@code std.sum}.
 */
public final class BuiltinCall extends ResolvedExpr {

    private final String name;
    private final List<ResolvedExpr> args;

    public BuiltinCall(String name, List<ResolvedExpr> args, Span span) {
        super(span);
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public String name() {
        return name;
    }

    public List<ResolvedExpr> args() {
        return args;
    }

    @Override
    public String toString() {
        return name + args;
    }
}

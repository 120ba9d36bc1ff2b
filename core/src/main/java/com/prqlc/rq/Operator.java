package com.prqlc.rq;

import com.prqlc.pl.Span;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A call of a builtin function or operator, such as {@code std.add} or
 * {@code std.text.lower}. How it renders is decided by the dialect.
 */
public final class Operator extends RqExpr {

    private final String name;
    private final List<RqExpr> args;

    public Operator(String name, List<RqExpr> args, Span span) {
        super(span);
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public String name() {
        return name;
    }

    public List<RqExpr> args() {
        return args;
    }

    @Override
    public String toString() {
        return name + args;
    }
}

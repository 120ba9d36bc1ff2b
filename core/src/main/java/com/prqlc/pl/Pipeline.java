package com.prqlc.pl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A sequence of steps separated by {@code |} or newlines.
 *
 * <p>The parser only produces a pipeline for two or more steps; a single step stands
 * for itself.
 */
public final class Pipeline extends Expr {

    private final List<Expr> exprs;

    public Pipeline(List<Expr> exprs, Span span, String alias) {
        super(span, alias);
        if (exprs.size() < 2) {
            throw new IllegalArgumentException("A pipeline needs at least two steps");
        }
        this.exprs = Collections.unmodifiableList(new ArrayList<>(exprs));
    }

    public List<Expr> exprs() {
        return exprs;
    }

    @Override
    public Pipeline withAlias(String alias) {
        return new Pipeline(exprs, span, alias);
    }

    @Override
    public String toString() {
        return aliasPrefix() + exprs.stream().map(Object::toString)
            .collect(Collectors.joining(" | ", "(", ")"));
    }
}

package com.prqlc.pl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public final class Array extends Expr {

    private final List<Expr> items;

    public Array(List<Expr> items, Span span, String alias) {
        super(span, alias);
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public List<Expr> items() {
        return items;
    }

    @Override
    public Array withAlias(String alias) {
        return new Array(items, span, alias);
    }

    @Override
    public String toString() {
        return aliasPrefix() + items.stream().map(Object::toString)
            .collect(Collectors.joining(", ", "[", "]"));
    }
}

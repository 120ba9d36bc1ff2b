package com.prqlc.rq;

import com.prqlc.pl.Span;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class ArrayExpr extends RqExpr {

    private final List<RqExpr> items;

    public ArrayExpr(List<RqExpr> items, Span span) {
        super(span);
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public List<RqExpr> items() {
        return items;
    }

    @Override
    public String toString() {
        return items.toString();
    }
}

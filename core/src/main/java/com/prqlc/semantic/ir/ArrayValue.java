package com.prqlc.semantic.ir;

import com.prqlc.pl.Span;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class ArrayValue extends ResolvedExpr {

    private final List<ResolvedExpr> items;

    public ArrayValue(List<ResolvedExpr> items, Span span) {
        super(span);
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public List<ResolvedExpr> items() {
        return items;
    }

    @Override
    public String toString() {
        return items.toString();
    }
}

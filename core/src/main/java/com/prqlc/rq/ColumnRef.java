package com.prqlc.rq;

import com.prqlc.pl.Span;
import java.util.Objects;

public final class ColumnRef extends RqExpr {

    private final CId id;

    public ColumnRef(CId id, Span span) {
        super(span);
        this.id = Objects.requireNonNull(id, "id must not be null");
    }

    public CId id() {
        return id;
    }

    @Override
    public String toString() {
        return id.toString();
    }
}

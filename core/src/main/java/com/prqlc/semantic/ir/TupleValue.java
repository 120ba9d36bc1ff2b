package com.prqlc.semantic.ir;

import com.prqlc.pl.Span;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A tuple of resolved fields. {@code this} resolves to the tuple of all columns
 * of the current frame.
 */
public final class TupleValue extends ResolvedExpr {

    private final List<ResolvedExpr> fields;

    public TupleValue(List<ResolvedExpr> fields, Span span) {
        super(span);
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public List<ResolvedExpr> fields() {
        return fields;
    }

    @Override
    public String toString() {
        return "{" + fields + "}";
    }
}

package com.prqlc.semantic.ir;

import com.prqlc.pl.Span;

/**
 * A range; either bound may be null for an open end.
 */
public final class RangeValue extends ResolvedExpr {

    private final ResolvedExpr start;
    private final ResolvedExpr end;

    public RangeValue(ResolvedExpr start, ResolvedExpr end, Span span) {
        super(span);
        this.start = start;
        this.end = end;
    }

    public ResolvedExpr start() {
        return start;
    }

    public ResolvedExpr end() {
        return end;
    }

    @Override
    public String toString() {
        return (start == null ? "" : start) + ".." + (end == null ? "" : end);
    }
}

package com.prqlc.rq;

import com.prqlc.pl.Span;

/**
 * Base class of RQ expressions. Columns are referenced only by {@link CId}.
 */
public abstract class RqExpr {

    private final Span span;

    protected RqExpr(Span span) {
        this.span = span;
    }

    /**
     * Returns the source range the expression was lowered from, or null.
     */
    public Span span() {
        return span;
    }
}

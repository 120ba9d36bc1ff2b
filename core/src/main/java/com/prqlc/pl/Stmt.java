package com.prqlc.pl;

/**
 * Base class for top-level and module-level statements.
 */
public abstract class Stmt {

    protected final Span span;

    protected Stmt(Span span) {
        this.span = span;
    }

    public Span span() {
        return span;
    }
}

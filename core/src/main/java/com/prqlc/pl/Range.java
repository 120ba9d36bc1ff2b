package com.prqlc.pl;

/**
 * A range {@code start..end}. Either bound may be absent.
 */
public final class Range extends Expr {

    private final Expr start;
    private final Expr end;

    public Range(Expr start, Expr end, Span span, String alias) {
        super(span, alias);
        this.start = start;
        this.end = end;
    }

    public Expr start() {
        return start;
    }

    public Expr end() {
        return end;
    }

    @Override
    public Range withAlias(String alias) {
        return new Range(start, end, span, alias);
    }

    @Override
    public String toString() {
        return aliasPrefix() + (start == null ? "" : start) + ".." + (end == null ? "" : end);
    }
}

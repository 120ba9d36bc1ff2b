package com.prqlc.semantic.ir;

import com.prqlc.pl.Span;

/**
 * Base class of the resolved form of PL expressions.
 *
 * <p>Resolved expressions no longer contain names: every column reference points
 * at a {@link FrameColumn}, every function call at a builtin or at an already
 * evaluated user function.
 */
public abstract class ResolvedExpr {

    protected final Span span;

    protected ResolvedExpr(Span span) {
        this.span = span;
    }

    public Span span() {
        return span;
    }
}

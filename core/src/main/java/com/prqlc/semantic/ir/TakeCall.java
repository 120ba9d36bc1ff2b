package com.prqlc.semantic.ir;

import com.prqlc.pl.Span;

/**
 * {@code take}: keeps rows {@code start} through {@code end}, both inclusive and
 * counted from 1. A null bound is open.
 */
public final class TakeCall extends TransformCall {

    private final Long start;
    private final Long end;

    public TakeCall(RelationValue input, Long start, Long end, ApplyContext context, Span span) {
        super(input, context, input.frame(), span);
        this.start = start;
        this.end = end;
    }

    public Long start() {
        return start;
    }

    public Long end() {
        return end;
    }

    @Override
    public String transformName() {
        return "take";
    }
}

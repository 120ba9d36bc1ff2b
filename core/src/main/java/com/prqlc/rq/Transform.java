package com.prqlc.rq;

import java.util.Objects;

/**
 * A relational operator applied to one input.
 */
public abstract class Transform extends Relation {

    private final Relation input;

    protected Transform(Relation input) {
        this.input = Objects.requireNonNull(input, "input must not be null");
    }

    @Override
    public Relation input() {
        return input;
    }
}

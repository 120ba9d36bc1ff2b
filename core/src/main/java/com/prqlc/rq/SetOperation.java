package com.prqlc.rq;

import java.util.Objects;

/**
 * Base class of {@link Append}, {@link Remove} and {@link Intersect}: combine
 * the input with the rows of another table, matching columns by position.
 */
public abstract class SetOperation extends Transform {

    private final TableRef other;

    protected SetOperation(Relation input, TableRef other) {
        super(input);
        this.other = Objects.requireNonNull(other, "other must not be null");
    }

    public TableRef other() {
        return other;
    }

    @Override
    public String toString() {
        return kind() + "(" + other + ", " + input() + ")";
    }
}

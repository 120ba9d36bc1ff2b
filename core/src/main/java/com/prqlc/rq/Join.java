package com.prqlc.rq;

import java.util.Objects;

public final class Join extends Transform {

    public enum Side {
        INNER,
        LEFT,
        RIGHT,
        FULL
    }

    private final Side side;
    private final TableRef with;
    private final RqExpr condition;

    public Join(Relation input, Side side, TableRef with, RqExpr condition) {
        super(input);
        this.side = Objects.requireNonNull(side, "side must not be null");
        this.with = Objects.requireNonNull(with, "with must not be null");
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    public Side side() {
        return side;
    }

    public TableRef with() {
        return with;
    }

    public RqExpr condition() {
        return condition;
    }

    @Override
    public String kind() {
        return "Join";
    }

    @Override
    public String toString() {
        return "Join(" + side + ", " + with + ", " + condition + ", " + input() + ")";
    }
}

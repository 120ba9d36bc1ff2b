package com.prqlc.rq;

import java.util.Objects;

public final class Filter extends Transform {

    private final RqExpr condition;

    public Filter(Relation input, RqExpr condition) {
        super(input);
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    public RqExpr condition() {
        return condition;
    }

    @Override
    public String kind() {
        return "Filter";
    }

    @Override
    public String toString() {
        return "Filter(" + condition + ", " + input() + ")";
    }
}

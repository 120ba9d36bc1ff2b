package com.prqlc.rq;

import com.prqlc.pl.Span;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Case extends RqExpr {

    public record Arm(RqExpr condition, RqExpr value) {
    }

    private final List<Arm> arms;

    public Case(List<Arm> arms, Span span) {
        super(span);
        this.arms = Collections.unmodifiableList(new ArrayList<>(arms));
    }

    public List<Arm> arms() {
        return arms;
    }

    @Override
    public String toString() {
        return "case" + arms;
    }
}

package com.prqlc.semantic.ir;

import com.prqlc.pl.Span;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class CaseExpr extends ResolvedExpr {

    public record Arm(ResolvedExpr condition, ResolvedExpr value) {
    }

    private final List<Arm> arms;

    public CaseExpr(List<Arm> arms, Span span) {
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

package com.prqlc.semantic.ir;

import com.prqlc.pl.Span;
import java.util.Objects;

public final class FilterCall extends TransformCall {

    private final ResolvedExpr condition;

    public FilterCall(RelationValue input, ResolvedExpr condition, ApplyContext context, Span span) {
        super(input, context, input.frame(), span);
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    public ResolvedExpr condition() {
        return condition;
    }

    @Override
    public String transformName() {
        return "filter";
    }
}

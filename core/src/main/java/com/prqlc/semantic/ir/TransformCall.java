package com.prqlc.semantic.ir;

import com.prqlc.pl.Span;
import java.util.Objects;

/**
 * A transform applied to an input relation. Each transform call lowers to
 * one relational operator, except inside a {@code group} where the operator
 * may need extra steps to respect the partition.
 */
public abstract class TransformCall extends RelationValue {

    private final RelationValue input;
    private final ApplyContext context;

    protected TransformCall(RelationValue input, ApplyContext context, Frame frame, Span span) {
        super(frame, span);
        this.input = Objects.requireNonNull(input, "input must not be null");
        this.context = context == null ? ApplyContext.NONE : context;
    }

    public RelationValue input() {
        return input;
    }

    public ApplyContext context() {
        return context;
    }

    /**
     * Returns the transform name as written in queries.
     */
    public abstract String transformName();

    @Override
    public String toString() {
        return transformName() + "(" + input + ")";
    }
}

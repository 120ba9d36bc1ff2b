package com.prqlc.semantic.ir;

import com.prqlc.pl.Span;
import java.util.Objects;

/**
 * A resolved expression that evaluates to a relation.
 */
public abstract class RelationValue extends ResolvedExpr {

    private final Frame frame;

    protected RelationValue(Frame frame, Span span) {
        super(span);
        this.frame = Objects.requireNonNull(frame, "frame must not be null");
    }

    /**
     * Returns the columns this relation exposes.
     */
    public Frame frame() {
        return frame;
    }
}

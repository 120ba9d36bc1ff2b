package com.prqlc.semantic.ir;

import com.prqlc.pl.Span;
import java.util.Objects;

public final class JoinCall extends TransformCall {

    public enum Side {
        INNER,
        LEFT,
        RIGHT,
        FULL
    }

    private final Side side;
    private final TableSource with;
    private final ResolvedExpr condition;

    public JoinCall(RelationValue input, Side side, TableSource with, ResolvedExpr condition, Frame frame,
                    Span span) {
        super(input, ApplyContext.NONE, frame, span);
        this.side = Objects.requireNonNull(side, "side must not be null");
        this.with = Objects.requireNonNull(with, "with must not be null");
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    public Side side() {
        return side;
    }

    public TableSource with() {
        return with;
    }

    public ResolvedExpr condition() {
        return condition;
    }

    @Override
    public String transformName() {
        return "join";
    }
}

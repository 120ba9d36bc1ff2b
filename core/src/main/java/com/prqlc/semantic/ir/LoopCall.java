package com.prqlc.semantic.ir;

import com.prqlc.pl.Span;
import java.util.Objects;

/**
 * {@code loop}: applies the step pipeline to the rows of the previous
 * iteration until it yields no rows. The result keeps the frame of the input;
 * the step's columns are matched by position.
 */
public final class LoopCall extends TransformCall {

    private final TableSource previous;
    private final RelationValue step;

    /**
     * @param input the initial rows
     * @param previous the instance the step reads the previous iteration from
     * @param step the step pipeline applied to {@code previous}
     */
    public LoopCall(RelationValue input, TableSource previous, RelationValue step, ApplyContext context, Span span) {
        super(input, context, input.frame(), span);
        this.previous = Objects.requireNonNull(previous, "previous must not be null");
        this.step = Objects.requireNonNull(step, "step must not be null");
    }

    public TableSource previous() {
        return previous;
    }

    public RelationValue step() {
        return step;
    }

    @Override
    public String transformName() {
        return "loop";
    }
}

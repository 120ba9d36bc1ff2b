package com.prqlc.rq;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Repeatedly applies a step to the rows it produced last, starting from the
 * input, and returns the rows of all iterations.
 *
 * <p>The step is its own chain. It reads the previous iteration through a
 * {@link From} of {@code table}, which is defined only while the loop runs. Its
 * output columns match {@code columns} by position.
 */
public final class Loop extends Transform {

    private final TId table;
    private final List<RelationColumn> columns;
    private final Relation step;

    /**
     * @param input the initial rows
     * @param table the table the step reads the previous iteration from
     * @param columns the output names of the input, in order
     * @param step the relation computing the next iteration
     */
    public Loop(Relation input, TId table, List<RelationColumn> columns, Relation step) {
        super(input);
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.step = Objects.requireNonNull(step, "step must not be null");
    }

    public TId table() {
        return table;
    }

    public List<RelationColumn> columns() {
        return columns;
    }

    public Relation step() {
        return step;
    }

    @Override
    public String kind() {
        return "Loop";
    }

    @Override
    public String toString() {
        return "Loop(" + table + ", step=" + step + ", " + input() + ")";
    }
}

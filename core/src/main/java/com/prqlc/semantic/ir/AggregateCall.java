package com.prqlc.semantic.ir;

import com.prqlc.pl.Span;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code aggregate}: reduces each partition of the context to one row.
 */
public final class AggregateCall extends TransformCall {

    private final List<ColumnDef> aggregates;

    public AggregateCall(RelationValue input, List<ColumnDef> aggregates, ApplyContext context, Frame frame,
                         Span span) {
        super(input, context, frame, span);
        this.aggregates = Collections.unmodifiableList(new ArrayList<>(aggregates));
    }

    public List<ColumnDef> aggregates() {
        return aggregates;
    }

    @Override
    public String transformName() {
        return "aggregate";
    }
}

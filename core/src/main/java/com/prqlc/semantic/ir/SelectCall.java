package com.prqlc.semantic.ir;

import com.prqlc.pl.Span;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code select}: the frame becomes exactly the listed columns. Listed columns
 * that are not plain references are computed first.
 */
public final class SelectCall extends TransformCall {

    private final List<ColumnDef> computed;

    public SelectCall(RelationValue input, List<ColumnDef> computed, ApplyContext context, Frame frame, Span span) {
        super(input, context, frame, span);
        this.computed = Collections.unmodifiableList(new ArrayList<>(computed));
    }

    public List<ColumnDef> computed() {
        return computed;
    }

    @Override
    public String transformName() {
        return "select";
    }
}

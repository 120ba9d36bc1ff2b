package com.prqlc.semantic.ir;

import com.prqlc.pl.Span;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code derive}: computes new columns.
 */
public final class DeriveCall extends TransformCall {

    private final List<ColumnDef> computed;

    public DeriveCall(RelationValue input, List<ColumnDef> computed, ApplyContext context, Frame frame, Span span) {
        super(input, context, frame, span);
        this.computed = Collections.unmodifiableList(new ArrayList<>(computed));
    }

    public List<ColumnDef> computed() {
        return computed;
    }

    @Override
    public String transformName() {
        return "derive";
    }
}

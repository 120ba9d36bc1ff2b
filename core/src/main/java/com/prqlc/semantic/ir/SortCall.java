package com.prqlc.semantic.ir;

import com.prqlc.pl.Span;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class SortCall extends TransformCall {

    private final List<SortItem> items;

    public SortCall(RelationValue input, List<SortItem> items, ApplyContext context, Span span) {
        super(input, context, input.frame(), span);
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public List<SortItem> items() {
        return items;
    }

    @Override
    public String transformName() {
        return "sort";
    }
}

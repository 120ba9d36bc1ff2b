package com.prqlc.semantic.ir;

import com.prqlc.pl.Span;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A relation given as raw SQL, as in {@code from s"SELECT * FROM t"}.
 */
public final class SStringRelation extends RelationValue {

    private final List<SStringExpr.Item> items;

    public SStringRelation(List<SStringExpr.Item> items, Frame frame, Span span) {
        super(frame, span);
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public List<SStringExpr.Item> items() {
        return items;
    }

    @Override
    public String toString() {
        return "SStringRelation" + items;
    }
}

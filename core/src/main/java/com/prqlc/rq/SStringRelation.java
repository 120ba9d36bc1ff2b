package com.prqlc.rq;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A relation given as raw SQL. Only appears as the body of a table declaration.
 */
public final class SStringRelation extends Relation {

    private final List<RawSplice.Item> items;

    public SStringRelation(List<RawSplice.Item> items) {
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public List<RawSplice.Item> items() {
        return items;
    }

    @Override
    public Relation input() {
        return null;
    }

    @Override
    public String kind() {
        return "SString";
    }

    @Override
    public String toString() {
        return "SStringRelation" + items;
    }
}

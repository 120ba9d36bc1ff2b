package com.prqlc.rq;

import java.util.Objects;

public final class From extends Relation {

    private final TableRef table;

    public From(TableRef table) {
        this.table = Objects.requireNonNull(table, "table must not be null");
    }

    public TableRef table() {
        return table;
    }

    @Override
    public Relation input() {
        return null;
    }

    @Override
    public String kind() {
        return "From";
    }

    @Override
    public String toString() {
        return "From(" + table + ")";
    }
}

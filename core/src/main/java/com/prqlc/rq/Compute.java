package com.prqlc.rq;

import java.util.Objects;

/**
 * Adds one computed column to the relation.
 */
public final class Compute extends Transform {

    private final ColumnDef column;

    public Compute(Relation input, ColumnDef column) {
        super(input);
        this.column = Objects.requireNonNull(column, "column must not be null");
    }

    public ColumnDef column() {
        return column;
    }

    public boolean isWindowed() {
        return column.window() != null;
    }

    @Override
    public String kind() {
        return "Compute";
    }

    @Override
    public String toString() {
        return "Compute(" + column + ", " + input() + ")";
    }
}

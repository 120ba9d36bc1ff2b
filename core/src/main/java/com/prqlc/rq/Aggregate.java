package com.prqlc.rq;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reduces each partition to one row holding the partition columns and the
 * computed aggregates.
 */
public final class Aggregate extends Transform {

    private final List<CId> partition;
    private final List<ColumnDef> computes;

    public Aggregate(Relation input, List<CId> partition, List<ColumnDef> computes) {
        super(input);
        this.partition = Collections.unmodifiableList(new ArrayList<>(partition));
        this.computes = Collections.unmodifiableList(new ArrayList<>(computes));
    }

    public List<CId> partition() {
        return partition;
    }

    public List<ColumnDef> computes() {
        return computes;
    }

    @Override
    public String kind() {
        return "Aggregate";
    }

    @Override
    public String toString() {
        return "Aggregate(" + partition + ", " + computes + ", " + input() + ")";
    }
}

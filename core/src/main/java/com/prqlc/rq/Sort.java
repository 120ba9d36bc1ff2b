package com.prqlc.rq;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Sort extends Transform {

    private final List<ColumnSort> columns;

    public Sort(Relation input, List<ColumnSort> columns) {
        super(input);
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    public List<ColumnSort> columns() {
        return columns;
    }

    @Override
    public String kind() {
        return "Sort";
    }

    @Override
    public String toString() {
        return "Sort(" + columns + ", " + input() + ")";
    }
}

package com.prqlc.rq;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Restricts the relation to the given columns, in order.
 */
public final class Select extends Transform {

    private final List<CId> columns;

    public Select(Relation input, List<CId> columns) {
        super(input);
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    public List<CId> columns() {
        return columns;
    }

    @Override
    public String kind() {
        return "Select";
    }

    @Override
    public String toString() {
        return "Select(" + columns + ", " + input() + ")";
    }
}

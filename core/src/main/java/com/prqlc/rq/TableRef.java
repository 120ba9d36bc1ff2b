package com.prqlc.rq;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A reference to a declared table from within a pipeline, together with the
 * ids under which its columns are known in that pipeline.
 */
public final class TableRef {

    private final TId source;
    private final String alias;
    private final List<RelationColumn> columns;

    public TableRef(TId source, String alias, List<RelationColumn> columns) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.alias = alias;
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    public TId source() {
        return source;
    }

    /**
     * Returns the relation alias, or null to use the table name.
     */
    public String alias() {
        return alias;
    }

    public List<RelationColumn> columns() {
        return columns;
    }

    @Override
    public String toString() {
        return "TableRef(" + source + (alias == null ? "" : " as " + alias) + ", " + columns + ")";
    }
}

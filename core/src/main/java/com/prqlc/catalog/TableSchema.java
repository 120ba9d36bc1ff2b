package com.prqlc.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The ordered columns of a known table.
 */
public final class TableSchema {

    private final String name;
    private final List<ColumnSchema> columns;

    public TableSchema(String name, List<ColumnSchema> columns) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    public static TableSchema of(String name, String... columnNames) {
        List<ColumnSchema> columns = new ArrayList<>();
        for (String column : columnNames) {
            columns.add(new ColumnSchema(column, null));
        }
        return new TableSchema(name, columns);
    }

    public String name() {
        return name;
    }

    public List<ColumnSchema> columns() {
        return columns;
    }

    public List<String> columnNames() {
        List<String> names = new ArrayList<>();
        for (ColumnSchema column : columns) {
            names.add(column.name());
        }
        return names;
    }

    public int size() {
        return columns.size();
    }

    @Override
    public String toString() {
        return name + columnNames();
    }
}

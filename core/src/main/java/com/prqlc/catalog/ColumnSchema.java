package com.prqlc.catalog;

import java.util.Objects;

/**
 * A column of a known table.
 *
 * @param name the column name
 * @param type the declared type name, or null if unknown
 */
public record ColumnSchema(String name, String type) {

    public ColumnSchema {
        Objects.requireNonNull(name, "name must not be null");
    }
}

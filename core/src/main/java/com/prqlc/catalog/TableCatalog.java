package com.prqlc.catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Known table schemas, looked up by table name.
 *
 * <p>A table found here contributes its columns to frames by name, so references
 * to columns it does not have are reported instead of being passed through to
 * the database.
 */
public final class TableCatalog {

    private static final TableCatalog EMPTY = new TableCatalog(Map.of());

    private final Map<String, TableSchema> tables;

    private TableCatalog(Map<String, TableSchema> tables) {
        this.tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
    }

    public static TableCatalog empty() {
        return EMPTY;
    }

    public static TableCatalog of(TableSchema... schemas) {
        Map<String, TableSchema> tables = new LinkedHashMap<>();
        for (TableSchema schema : schemas) {
            tables.put(schema.name(), schema);
        }
        return new TableCatalog(tables);
    }

    public static TableCatalog of(Collection<TableSchema> schemas) {
        return of(schemas.toArray(new TableSchema[0]));
    }

    public Optional<TableSchema> table(String name) {
        return Optional.ofNullable(tables.get(name));
    }

    public Collection<TableSchema> tables() {
        return tables.values();
    }

    public boolean isEmpty() {
        return tables.isEmpty();
    }

    @Override
    public String toString() {
        return "TableCatalog" + tables.values();
    }
}

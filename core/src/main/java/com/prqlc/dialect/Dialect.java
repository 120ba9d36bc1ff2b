package com.prqlc.dialect;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * SQL dialects the compiler can target.
 *
 * <p>Each dialect carries the syntax choices that differ between databases.
 * Function rendering differences live in {@link FunctionRegistry}.
 *
 * <p>Output aims at the generic dialect wherever possible; a dialect only
 * deviates where the generic SQL is not supported or behaves differently.
 */
public enum Dialect {

    GENERIC("generic"),
    ANSI("ansi"),
    BIGQUERY("bigquery"),
    CLICKHOUSE("clickhouse"),
    DUCKDB("duckdb"),
    GLAREDB("glaredb"),
    HIVE("hive"),
    MSSQL("mssql"),
    MYSQL("mysql"),
    POSTGRES("postgres"),
    SNOWFLAKE("snowflake"),
    SQLITE("sqlite");

    private final String dialectName;

    Dialect(String dialectName) {
        this.dialectName = dialectName;
    }

    /**
     * Returns the lowercase name used in targets such as {@code sql.postgres}.
     */
    public String dialectName() {
        return dialectName;
    }

    /**
     * Parses a dialect name, ignoring case.
     *
     * @param name the dialect name
     * @return the dialect
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Dialect parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Dialect name must not be null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Dialect dialect : values()) {
            if (dialect.dialectName.equals(normalized)) {
                return dialect;
            }
        }
        throw new IllegalArgumentException(
            "Unknown dialect: " + name + ". Valid dialects: " + String.join(", ", names()));
    }

    public static List<String> names() {
        return Arrays.stream(values()).map(Dialect::dialectName).toList();
    }

    // ==================== Syntax ====================

    /**
     * Returns true if row limits are written {@code SELECT TOP (n)}.
     */
    public boolean useTop() {
        return this == MSSQL;
    }

    public char identQuote() {
        return switch (this) {
            case MYSQL, BIGQUERY, CLICKHOUSE, HIVE -> '`';
            default -> '"';
        };
    }

    /**
     * Returns true if {@code EXCEPT ALL} is supported. Without it {@code remove}
     * renders as {@code EXCEPT}.
     */
    public boolean exceptAll() {
        return switch (this) {
            case SQLITE, MSSQL, DUCKDB -> false;
            default -> true;
        };
    }

    public boolean intersectAll() {
        return exceptAll();
    }

    /**
     * Returns true if the {@code CONCAT} function exists. Without it strings
     * are joined with {@code ||}.
     */
    public boolean hasConcatFunction() {
        return this != SQLITE;
    }

    /**
     * Returns true if interval literals are written {@code INTERVAL '1 DAY'}
     * instead of {@code INTERVAL 1 DAY}.
     */
    public boolean requiresQuotedIntervals() {
        return this == POSTGRES || this == GLAREDB;
    }

    @Override
    public String toString() {
        return dialectName;
    }
}

package com.prqlc.rq;

import java.util.Objects;

/**
 * A computed column.
 *
 * @param id the id of the new column
 * @param name the column name, or null if the column is unnamed
 * @param expr the expression computing the column
 * @param window the window the expression is evaluated over, or null
 */
public record ColumnDef(CId id, String name, RqExpr expr, Window window) {

    public ColumnDef {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(expr, "expr must not be null");
    }
}

package com.prqlc.semantic.ir;

import java.util.Objects;

/**
 * A column computed by a transform.
 */
public record ColumnDef(FrameColumn.Single column, ResolvedExpr expr) {

    public ColumnDef {
        Objects.requireNonNull(column, "column must not be null");
        Objects.requireNonNull(expr, "expr must not be null");
    }
}

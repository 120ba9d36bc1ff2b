package com.prqlc.semantic.ir;

import com.prqlc.pl.Span;
import java.util.Objects;

/**
 * A reference to a column of the current frame. References to a whole input
 * ({@code e.*}) point at a {@link FrameColumn.All}.
 */
public final class ColumnRef extends ResolvedExpr {

    private final FrameColumn column;

    public ColumnRef(FrameColumn column, Span span) {
        super(span);
        this.column = Objects.requireNonNull(column, "column must not be null");
    }

    public FrameColumn column() {
        return column;
    }

    @Override
    public String toString() {
        return column.toString();
    }
}

package com.prqlc.semantic.ir;

import com.prqlc.pl.Span;
import java.util.Objects;

/**
 * A relation read by a table function such as {@code read_parquet "data.parquet"}.
 */
public final class TableFunction extends RelationValue {

    private final String function;
    private final ResolvedExpr argument;

    public TableFunction(String function, ResolvedExpr argument, Frame frame, Span span) {
        super(frame, span);
        this.function = Objects.requireNonNull(function, "function must not be null");
        this.argument = Objects.requireNonNull(argument, "argument must not be null");
    }

    public String function() {
        return function;
    }

    public ResolvedExpr argument() {
        return argument;
    }

    @Override
    public String toString() {
        return function + "(" + argument + ")";
    }
}

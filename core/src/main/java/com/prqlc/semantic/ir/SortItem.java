package com.prqlc.semantic.ir;

import java.util.Objects;

public record SortItem(ResolvedExpr expr, boolean descending) {

    public SortItem {
        Objects.requireNonNull(expr, "expr must not be null");
    }
}

package com.prqlc.rq;

import java.util.Objects;

public record ColumnSort(CId column, boolean descending) {

    public ColumnSort {
        Objects.requireNonNull(column, "column must not be null");
    }
}

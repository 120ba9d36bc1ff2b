package com.prqlc.rq;

/**
 * Identity of a column in RQ. Column ids never change once assigned, so they
 * reference the same data however the column is renamed or re-scoped.
 */
public record CId(int value) {

    @Override
    public String toString() {
        return "column-" + value;
    }
}

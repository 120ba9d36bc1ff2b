package com.prqlc.rq;

/**
 * Identity of a table declaration in RQ.
 */
public record TId(int value) {

    @Override
    public String toString() {
        return "table-" + value;
    }
}

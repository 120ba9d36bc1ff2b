package com.prqlc.rq;

/**
 * Keeps one row of each group of equal rows. Rows are compared on the columns
 * of the input's final projection.
 */
public final class Distinct extends Transform {

    public Distinct(Relation input) {
        super(input);
    }

    @Override
    public String kind() {
        return "Distinct";
    }

    @Override
    public String toString() {
        return "Distinct(" + input() + ")";
    }
}

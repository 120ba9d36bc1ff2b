package com.prqlc.rq;

import com.prqlc.pl.Literal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Inline rows. Only appears as the body of a table declaration.
 */
public final class LiteralRelation extends Relation {

    private final List<String> columns;
    private final List<List<Literal>> rows;

    public LiteralRelation(List<String> columns, List<List<Literal>> rows) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        List<List<Literal>> copy = new ArrayList<>();
        for (List<Literal> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public List<String> columns() {
        return columns;
    }

    public List<List<Literal>> rows() {
        return rows;
    }

    @Override
    public Relation input() {
        return null;
    }

    @Override
    public String kind() {
        return "Literal";
    }

    @Override
    public String toString() {
        return "LiteralRelation(" + columns + ", " + rows + ")";
    }
}

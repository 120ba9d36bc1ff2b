package com.prqlc.semantic.ir;

import com.prqlc.pl.Literal;
import com.prqlc.pl.Span;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A relation given inline as an array of tuples of literals.
 */
public final class LiteralRelation extends RelationValue {

    private final List<String> columnNames;
    private final List<List<Literal>> rows;

    public LiteralRelation(List<String> columnNames, List<List<Literal>> rows, Frame frame, Span span) {
        super(frame, span);
        this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
        List<List<Literal>> copy = new ArrayList<>();
        for (List<Literal> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public List<String> columnNames() {
        return columnNames;
    }

    public List<List<Literal>> rows() {
        return rows;
    }

    @Override
    public String toString() {
        return "LiteralRelation(" + columnNames + ", " + rows.size() + " rows)";
    }
}

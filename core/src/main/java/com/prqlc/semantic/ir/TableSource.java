package com.prqlc.semantic.ir;

import com.prqlc.pl.Span;
import java.util.Objects;

/**
 * A relation instance read by name: a database table, a relation declared with
 * {@code let}, or an unnamed relation used where a table is required (the right
 * side of a join, the argument of a set operation). A {@code RECURSIVE} instance
 * stands for the previous iteration inside the step of a {@code loop}.
 *
 * <p>Each instance has its own {@link FrameInput}, so using the same table twice
 * yields independent columns.
 */
public final class TableSource extends RelationValue {

    public enum Kind {
        EXTERN,
        DECLARED,
        ANONYMOUS,
        RECURSIVE
    }

    private final Kind kind;
    private final String table;
    private final RelationValue source;
    private final FrameInput input;

    /**
     * @param kind the kind of table
     * @param table the table name; null for anonymous relations
     * @param source the relation defining the table; null for extern tables
     * @param input the input this instance contributes to frames
     * @param frame the frame of this instance
     */
    public TableSource(Kind kind, String table, RelationValue source, FrameInput input, Frame frame, Span span) {
        super(frame, span);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.table = table;
        this.source = source;
        this.input = Objects.requireNonNull(input, "input must not be null");
    }

    public Kind kind() {
        return kind;
    }

    public String table() {
        return table;
    }

    public RelationValue source() {
        return source;
    }

    public FrameInput input() {
        return input;
    }

    @Override
    public String toString() {
        return "TableSource(" + kind + ", " + table + " as " + input.name() + ")";
    }
}

package com.prqlc.semantic.ir;

import com.prqlc.pl.Span;
import java.util.Locale;
import java.util.Objects;

/**
 * {@code append}, {@code remove} and {@code intersect}. The result keeps the
 * frame of the input relation; the other relation is matched by position.
 */
public final class SetOpCall extends TransformCall {

    public enum Kind {
        APPEND,
        REMOVE,
        INTERSECT
    }

    private final Kind kind;
    private final TableSource other;

    public SetOpCall(Kind kind, RelationValue input, TableSource other, Span span) {
        super(input, ApplyContext.NONE, input.frame(), span);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.other = Objects.requireNonNull(other, "other must not be null");
    }

    public Kind kind() {
        return kind;
    }

    public TableSource other() {
        return other;
    }

    @Override
    public String transformName() {
        return kind.name().toLowerCase(Locale.ROOT);
    }
}

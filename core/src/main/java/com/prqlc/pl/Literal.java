package com.prqlc.pl;

import java.util.Objects;

/**
 * A literal constant.
 *
 * <p>The value is kept in its canonical text form: integers without digit separators
 * and in decimal, strings with escapes already processed, dates in ISO form.
 * Interval literals such as {@code 5days} keep their unit separately.
 */
public final class Literal extends Expr {

    /**
     * Literal kinds.
     */
    public enum Kind {
        NULL,
        BOOLEAN,
        INTEGER,
        FLOAT,
        STRING,
        DATE,
        TIME,
        TIMESTAMP,
        VALUE_AND_UNIT
    }

    private final Kind kind;
    private final String value;
    private final String unit;

    public Literal(Kind kind, String value, String unit, Span span, String alias) {
        super(span, alias);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.value = value;
        this.unit = unit;
    }

    public Literal(Kind kind, String value, Span span) {
        this(kind, value, null, span, null);
    }

    // ==================== Factory Methods ====================

    public static Literal nullValue(Span span) {
        return new Literal(Kind.NULL, null, span);
    }

    public static Literal bool(boolean value, Span span) {
        return new Literal(Kind.BOOLEAN, Boolean.toString(value), span);
    }

    public static Literal integer(long value, Span span) {
        return new Literal(Kind.INTEGER, Long.toString(value), span);
    }

    public static Literal string(String value, Span span) {
        return new Literal(Kind.STRING, value, span);
    }

    // ==================== Accessors ====================

    public Kind kind() {
        return kind;
    }

    public String value() {
        return value;
    }

    public String unit() {
        return unit;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    /**
     * Returns the value of an integer literal.
     *
     * @throws IllegalStateException if this is not an integer literal
     */
    public long asLong() {
        if (kind != Kind.INTEGER) {
            throw new IllegalStateException("Not an integer literal: " + this);
        }
        return Long.parseLong(value);
    }

    public boolean asBoolean() {
        if (kind != Kind.BOOLEAN) {
            throw new IllegalStateException("Not a boolean literal: " + this);
        }
        return Boolean.parseBoolean(value);
    }

    @Override
    public Literal withAlias(String alias) {
        return new Literal(kind, value, unit, span, alias);
    }

    @Override
    public String toString() {
        String text = switch (kind) {
            case NULL -> "null";
            case STRING -> '"' + value + '"';
            case DATE, TIME, TIMESTAMP -> "@" + value;
            case VALUE_AND_UNIT -> value + unit;
            default -> value;
        };
        return aliasPrefix() + text;
    }
}

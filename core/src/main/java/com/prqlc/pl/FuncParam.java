package com.prqlc.pl;

import java.util.Objects;

/**
 * A declared function parameter.
 *
 * <p>A parameter with a default value is a named parameter and can only be bound
 * with {@code name:value}.
 */
public final class FuncParam {

    private final String name;
    private final Ty type;
    private final Expr defaultValue;

    public FuncParam(String name, Ty type, Expr defaultValue) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.type = type;
        this.defaultValue = defaultValue;
    }

    public String name() {
        return name;
    }

    public Ty type() {
        return type;
    }

    public Expr defaultValue() {
        return defaultValue;
    }

    /**
     * Returns true when the declared type says this parameter receives a relation.
     */
    public boolean isRelation() {
        return type != null && type.mentions(Ty.RELATION);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name);
        if (type != null) {
            sb.append(" <").append(type).append('>');
        }
        if (defaultValue != null) {
            sb.append(':').append(defaultValue);
        }
        return sb.toString();
    }
}

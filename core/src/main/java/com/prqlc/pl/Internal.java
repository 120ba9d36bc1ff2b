package com.prqlc.pl;

import java.util.Objects;

/**
 * The body marker {@code internal name} of a built-in function. The resolver and
 * lowering implement such functions directly.
 */
public final class Internal extends Expr {

    private final String name;

    public Internal(String name, Span span, String alias) {
        super(span, alias);
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public String name() {
        return name;
    }

    @Override
    public Internal withAlias(String alias) {
        return new Internal(name, span, alias);
    }

    @Override
    public String toString() {
        return aliasPrefix() + "internal " + name;
    }
}

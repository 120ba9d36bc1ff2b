package com.prqlc.semantic.ir;

import com.prqlc.pl.Span;

/**
 * A type used as a value, as in {@code value | as int}.
 */
public final class TypeName extends ResolvedExpr {

    private final String name;

    public TypeName(String name, Span span) {
        super(span);
        this.name = name;
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "<" + name + ">";
    }
}

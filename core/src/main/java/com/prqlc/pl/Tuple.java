package com.prqlc.pl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A tuple {@code {a, b = c + 1}}. Field names are the aliases of the field expressions.
 */
public final class Tuple extends Expr {

    private final List<Expr> fields;

    public Tuple(List<Expr> fields, Span span, String alias) {
        super(span, alias);
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public List<Expr> fields() {
        return fields;
    }

    @Override
    public Tuple withAlias(String alias) {
        return new Tuple(fields, span, alias);
    }

    @Override
    public String toString() {
        return aliasPrefix() + fields.stream().map(Object::toString)
            .collect(Collectors.joining(", ", "{", "}"));
    }
}

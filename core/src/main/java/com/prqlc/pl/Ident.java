package com.prqlc.pl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A possibly dotted identifier such as {@code salary}, {@code e.salary} or {@code e.*}.
 */
public final class Ident extends Expr {

    public static final String STAR = "*";

    private final List<String> parts;

    public Ident(List<String> parts, Span span, String alias) {
        super(span, alias);
        Objects.requireNonNull(parts, "parts must not be null");
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("parts must not be empty");
        }
        this.parts = Collections.unmodifiableList(new ArrayList<>(parts));
    }

    public Ident(List<String> parts, Span span) {
        this(parts, span, null);
    }

    public static Ident of(String... parts) {
        return new Ident(List.of(parts), null);
    }

    public List<String> parts() {
        return parts;
    }

    /**
     * Returns the last part.
     */
    public String name() {
        return parts.get(parts.size() - 1);
    }

    /**
     * Returns all parts except the last one.
     */
    public List<String> path() {
        return parts.subList(0, parts.size() - 1);
    }

    public boolean isStar() {
        return STAR.equals(name());
    }

    /**
     * Returns a new identifier with {@code part} appended.
     */
    public Ident append(String part, Span partSpan) {
        List<String> extended = new ArrayList<>(parts);
        extended.add(part);
        return new Ident(extended, Span.merge(span, partSpan), alias);
    }

    @Override
    public Ident withAlias(String alias) {
        return new Ident(parts, span, alias);
    }

    @Override
    public String toString() {
        return aliasPrefix() + String.join(".", parts);
    }
}

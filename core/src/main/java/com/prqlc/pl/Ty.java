package com.prqlc.pl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A type annotation as written in source, such as {@code <relation>},
 * {@code <int || text>} or the table shape {@code <[{id = int, name = text}]>}.
 *
 * <p>Types are only used for the shape tracking the compiler needs: recognising
 * relation parameters and reading declared table columns.
 */
public final class Ty {

    public static final String RELATION = "relation";

    /**
     * Type constructors.
     */
    public enum Kind {
        NAMED,
        ARRAY,
        TUPLE,
        UNION
    }

    /**
     * A tuple field: an optional name and its type.
     */
    public record Field(String name, Ty type) {
    }

    private final Kind kind;
    private final String name;
    private final List<Ty> variants;
    private final List<Field> fields;

    private Ty(Kind kind, String name, List<Ty> variants, List<Field> fields) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.name = name;
        this.variants = Collections.unmodifiableList(new ArrayList<>(variants));
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    // ==================== Factory Methods ====================

    public static Ty named(String name) {
        return new Ty(Kind.NAMED, Objects.requireNonNull(name, "name must not be null"), List.of(), List.of());
    }

    public static Ty array(Ty item) {
        return new Ty(Kind.ARRAY, null, List.of(item), List.of());
    }

    public static Ty tuple(List<Field> fields) {
        return new Ty(Kind.TUPLE, null, List.of(), fields);
    }

    public static Ty union(List<Ty> variants) {
        if (variants.size() == 1) {
            return variants.get(0);
        }
        return new Ty(Kind.UNION, null, variants, List.of());
    }

    // ==================== Accessors ====================

    public Kind kind() {
        return kind;
    }

    public String name() {
        return name;
    }

    public List<Ty> variants() {
        return variants;
    }

    public List<Field> fields() {
        return fields;
    }

    /**
     * Returns true if this type, or one of its union variants, is the named type.
     */
    public boolean mentions(String typeName) {
        return switch (kind) {
            case NAMED -> typeName.equals(name);
            case UNION -> variants.stream().anyMatch(v -> v.mentions(typeName));
            default -> false;
        };
    }

    /**
     * Returns true for the table shape {@code [{...}]}, an array of tuples.
     */
    public boolean isRelationShape() {
        return kind == Kind.ARRAY && variants.get(0).kind == Kind.TUPLE;
    }

    /**
     * Returns the column names of a relation shape in declaration order.
     */
    public List<String> columnNames() {
        if (!isRelationShape()) {
            throw new IllegalStateException("Not a relation type: " + this);
        }
        List<String> names = new ArrayList<>();
        for (Field field : variants.get(0).fields) {
            if (field.name() != null) {
                names.add(field.name());
            } else if (field.type().kind == Kind.NAMED) {
                names.add(field.type().name);
            }
        }
        return names;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NAMED -> name;
            case ARRAY -> "[" + variants.get(0) + "]";
            case TUPLE -> fields.stream()
                .map(f -> f.name() == null ? f.type().toString() : f.name() + " = " + f.type())
                .collect(Collectors.joining(", ", "{", "}"));
            case UNION -> variants.stream().map(Ty::toString).collect(Collectors.joining(" || "));
        };
    }
}

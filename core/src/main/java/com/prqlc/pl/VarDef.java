package com.prqlc.pl;

import java.util.Objects;

/**
 * A variable declaration.
 *
 * <ul>
 *   <li>{@link Kind#LET}: {@code let name = value}; the value may be absent for a
 *       table declaration such as {@code let t <[{a = int}]>}</li>
 *   <li>{@link Kind#INTO}: a pipeline followed by {@code into name}</li>
 *   <li>{@link Kind#MAIN}: the main pipeline of the query</li>
 * </ul>
 */
public final class VarDef extends Stmt {

    public static final String MAIN = "main";

    /**
     * Declaration forms.
     */
    public enum Kind {
        LET,
        INTO,
        MAIN
    }

    private final Kind kind;
    private final String name;
    private final Expr value;
    private final Ty type;

    public VarDef(Kind kind, String name, Expr value, Ty type, Span span) {
        super(span);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.value = value;
        this.type = type;
        if (value == null && type == null) {
            throw new IllegalArgumentException("Declaration of '" + name + "' has neither value nor type");
        }
    }

    public Kind kind() {
        return kind;
    }

    public String name() {
        return name;
    }

    public Expr value() {
        return value;
    }

    public Ty type() {
        return type;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case MAIN -> String.valueOf(value);
            case INTO -> value + " into " + name;
            case LET -> "let " + name + (type == null ? "" : " <" + type + ">")
                + (value == null ? "" : " = " + value);
        };
    }
}

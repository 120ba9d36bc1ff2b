package com.prqlc.semantic;

import com.prqlc.pl.Expr;
import com.prqlc.pl.Func;
import com.prqlc.pl.Span;
import com.prqlc.pl.Ty;
import com.prqlc.semantic.ir.ResolvedExpr;

import java.util.List;
import java.util.Objects;

/**
 * A named entry of a {@link Module}.
 *
 * <p>Values are resolved lazily, on first reference. Resolution state is
 * tracked so that a declaration referring to itself is reported instead of
 * recursing forever.
 */
public final class Decl {

    public enum Kind {
        MODULE,
        VALUE,
        TABLE
    }

    enum State {
        UNRESOLVED,
        RESOLVING,
        RESOLVED
    }

    private final Kind kind;
    private final String fullName;
    private final Module owner;
    private final Module module;
    private final Expr value;
    private final Ty type;
    private final Span span;

    private State state = State.UNRESOLVED;
    private ResolvedExpr resolved;

    private Decl(Kind kind, String fullName, Module owner, Module module, Expr value, Ty type, Span span) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.fullName = Objects.requireNonNull(fullName, "fullName must not be null");
        this.owner = owner;
        this.module = module;
        this.value = value;
        this.type = type;
        this.span = span;
    }

    public static Decl module(Module module) {
        return new Decl(Kind.MODULE, module.path(), module.parent(), module, null, null, null);
    }

    public static Decl value(String fullName, Module owner, Expr value, Ty type, Span span) {
        return new Decl(Kind.VALUE, fullName, owner, null, Objects.requireNonNull(value, "value must not be null"),
            type, span);
    }

    /**
     * Declares a table by its type only, as in {@code let employees <[{id, name}]>}.
     */
    public static Decl table(String fullName, Module owner, Ty type, Span span) {
        return new Decl(Kind.TABLE, fullName, owner, null, null, Objects.requireNonNull(type, "type must not be null"),
            span);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Returns the dotted path of this declaration, for example {@code std.math.abs}.
     */
    public String fullName() {
        return fullName;
    }

    /**
     * Returns the module the declaration is made in.
     */
    public Module owner() {
        return owner;
    }

    public Module module() {
        return module;
    }

    public Expr value() {
        return value;
    }

    public Ty type() {
        return type;
    }

    public Span span() {
        return span;
    }

    public boolean isFunction() {
        return value instanceof Func;
    }

    /**
     * Returns the declared column names of a table declaration.
     */
    public List<String> tableColumns() {
        if (kind != Kind.TABLE) {
            throw new IllegalStateException("Not a table declaration: " + fullName);
        }
        return type.isRelationShape() ? type.columnNames() : List.of();
    }

    State state() {
        return state;
    }

    ResolvedExpr resolved() {
        return resolved;
    }

    void markResolving() {
        state = State.RESOLVING;
    }

    void markResolved(ResolvedExpr value) {
        this.resolved = value;
        this.state = State.RESOLVED;
    }

    void reset() {
        state = State.UNRESOLVED;
    }

    @Override
    public String toString() {
        return kind + " " + fullName;
    }
}

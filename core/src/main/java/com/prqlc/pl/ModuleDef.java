package com.prqlc.pl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A module declaration {@code module name { statements }}.
 */
public final class ModuleDef extends Stmt {

    private final String name;
    private final List<Stmt> stmts;

    public ModuleDef(String name, List<Stmt> stmts, Span span) {
        super(span);
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.stmts = Collections.unmodifiableList(new ArrayList<>(stmts));
    }

    public String name() {
        return name;
    }

    public List<Stmt> stmts() {
        return stmts;
    }

    @Override
    public String toString() {
        return "module " + name + " " + stmts;
    }
}

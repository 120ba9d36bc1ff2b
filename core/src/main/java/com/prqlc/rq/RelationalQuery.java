package com.prqlc.rq;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The complete lowered query: declared tables plus the main relation.
 *
 * <p>Tables are ordered so that every table only references tables before it.
 */
public final class RelationalQuery {

    private final String target;
    private final String version;
    private final List<TableDecl> tables;
    private final Relation main;

    /**
     * @param target the target declared by the query header, or null
     * @param version the version requirement declared by the query header, or null
     * @param tables table declarations in dependency order
     * @param main the main relation
     */
    public RelationalQuery(String target, String version, List<TableDecl> tables, Relation main) {
        this.target = target;
        this.version = version;
        this.tables = Collections.unmodifiableList(new ArrayList<>(tables));
        this.main = Objects.requireNonNull(main, "main must not be null");
    }

    public String target() {
        return target;
    }

    public String version() {
        return version;
    }

    public List<TableDecl> tables() {
        return tables;
    }

    public Relation main() {
        return main;
    }

    public Optional<TableDecl> table(TId id) {
        return tables.stream().filter(t -> t.id().equals(id)).findFirst();
    }

    @Override
    public String toString() {
        return "RelationalQuery(tables=" + tables + ", main=" + main + ")";
    }
}

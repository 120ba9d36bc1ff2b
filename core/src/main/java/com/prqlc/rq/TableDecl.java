package com.prqlc.rq;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A table known to the query.
 *
 * <p>An extern table ({@code relation == null}) exists in the database under its
 * name. Any other table is defined by a relation and is rendered as a CTE; its
 * {@code columns} list the output names of that relation in order. A declaration
 * without a name gets a generated one at SQL generation time.
 */
public final class TableDecl {

    private final TId id;
    private final String name;
    private final Relation relation;
    private final List<RelationColumn> columns;

    public TableDecl(TId id, String name, Relation relation, List<RelationColumn> columns) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = name;
        this.relation = relation;
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        if (relation == null && name == null) {
            throw new IllegalArgumentException("An extern table needs a name");
        }
    }

    public static TableDecl extern(TId id, String name) {
        return new TableDecl(id, name, null, List.of());
    }

    public TId id() {
        return id;
    }

    public String name() {
        return name;
    }

    public Relation relation() {
        return relation;
    }

    public List<RelationColumn> columns() {
        return columns;
    }

    public boolean isExtern() {
        return relation == null;
    }

    @Override
    public String toString() {
        return "TableDecl(" + id + ", " + name + (isExtern() ? ", extern" : ", " + relation) + ")";
    }
}

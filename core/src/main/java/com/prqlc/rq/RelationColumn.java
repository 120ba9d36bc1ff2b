package com.prqlc.rq;

import java.util.Objects;

/**
 * A column exposed by a table: either a named column or the wildcard
 * standing for all columns not listed by name.
 *
 * @param name the column name, null for the wildcard
 * @param id the id the column is referenced by
 */
public record RelationColumn(String name, CId id) {

    public RelationColumn {
        Objects.requireNonNull(id, "id must not be null");
    }

    public static RelationColumn wildcard(CId id) {
        return new RelationColumn(null, id);
    }

    public boolean isWildcard() {
        return name == null;
    }

    @Override
    public String toString() {
        return (isWildcard() ? "*" : name) + "=" + id;
    }
}

package com.prqlc.semantic;

import com.prqlc.pl.QueryDef;
import com.prqlc.semantic.ir.RelationValue;

import java.util.Objects;

/**
 * The result of resolution: the query header, if any, and the main relation.
 * Declared relations are reachable from the main relation through the table
 * sources that use them.
 *
 * @param header the query header, or null
 * @param main the main relation
 * @param nextColumnId the first column id not used by the resolved tree
 */
public record ResolvedQuery(QueryDef header, RelationValue main, int nextColumnId) {

    public ResolvedQuery {
        Objects.requireNonNull(main, "main must not be null");
    }
}

package com.prqlc.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A rendered SELECT statement, held clause by clause so that it can be printed
 * either on one line or one clause per line.
 *
 * <p>Clause contents are already-rendered SQL. A query may also be a raw SQL
 * body (from an s-string) with no clauses at all.
 */
final class SqlQuery {

    /**
     * A common table expression.
     */
    record Cte(String name, SqlQuery query) {
    }

    /**
     * A set operation joining this query with another.
     */
    record SetPart(String operator, SqlQuery query) {
    }

    /**
     * One {@code keyword value} pagination clause, such as {@code LIMIT 10}.
     */
    record Pagination(String keyword, String value) {
    }

    private final List<Cte> with = new ArrayList<>();
    private final List<String> projection = new ArrayList<>();
    private final List<String> joins = new ArrayList<>();
    private final List<String> groupBy = new ArrayList<>();
    private final List<String> orderBy = new ArrayList<>();
    private final List<Pagination> pagination = new ArrayList<>();
    private final List<SetPart> setParts = new ArrayList<>();
    private boolean recursive;
    private boolean distinct;
    private String top;
    private String from;
    private String where;
    private String having;
    private String raw;

    static SqlQuery raw(String sql) {
        SqlQuery query = new SqlQuery();
        query.raw = Objects.requireNonNull(sql, "sql must not be null");
        return query;
    }

    // ==================== Builders ====================

    SqlQuery with(List<Cte> ctes) {
        with.addAll(ctes);
        return this;
    }

    /**
     * Marks the WITH clause as recursive, for CTEs that read themselves.
     */
    SqlQuery recursive(boolean value) {
        recursive = value;
        return this;
    }

    SqlQuery distinct() {
        distinct = true;
        return this;
    }

    SqlQuery select(List<String> items) {
        projection.addAll(items);
        return this;
    }

    SqlQuery top(String value) {
        top = value;
        return this;
    }

    SqlQuery from(String table) {
        from = table;
        return this;
    }

    SqlQuery join(String join) {
        joins.add(join);
        return this;
    }

    SqlQuery where(String condition) {
        where = condition;
        return this;
    }

    SqlQuery groupBy(List<String> items) {
        groupBy.addAll(items);
        return this;
    }

    SqlQuery having(String condition) {
        having = condition;
        return this;
    }

    SqlQuery orderBy(List<String> items) {
        orderBy.addAll(items);
        return this;
    }

    SqlQuery paginate(String keyword, String value) {
        pagination.add(new Pagination(keyword, value));
        return this;
    }

    SqlQuery setOperation(String operator, SqlQuery other) {
        setParts.add(new SetPart(operator, other));
        return this;
    }

    boolean hasOrderBy() {
        return !orderBy.isEmpty();
    }

    // ==================== Rendering ====================

    /**
     * Renders the query.
     *
     * @param pretty one clause keyword per line with indented contents, or a single line
     */
    String render(boolean pretty) {
        List<String> parts = new ArrayList<>();
        if (!with.isEmpty()) {
            parts.add(renderWith(pretty));
        }
        parts.add(renderBody(pretty));
        return String.join(pretty ? "\n" : " ", parts);
    }

    private String renderWith(boolean pretty) {
        List<String> ctes = new ArrayList<>();
        for (Cte cte : with) {
            String body = cte.query().render(pretty);
            ctes.add(pretty
                ? cte.name() + " AS (\n" + indent(body) + "\n)"
                : cte.name() + " AS (" + body + ")");
        }
        return (recursive ? "WITH RECURSIVE " : "WITH ") + String.join(pretty ? ",\n" : ", ", ctes);
    }

    private String renderBody(boolean pretty) {
        if (raw != null) {
            return raw;
        }
        List<String> clauses = new ArrayList<>();
        List<String> select = new ArrayList<>(projection);
        if (top != null && !select.isEmpty()) {
            select.set(0, top + " " + select.get(0));
        }
        if (distinct && !select.isEmpty()) {
            select.set(0, "DISTINCT " + select.get(0));
        }
        clauses.add(clause("SELECT", select, pretty));
        if (from != null) {
            String fromClause = clause("FROM", List.of(from), pretty);
            if (!joins.isEmpty()) {
                fromClause += (pretty ? "\n" : " ") + joins.stream()
                    .map(join -> pretty ? indent(join) : join)
                    .collect(Collectors.joining(pretty ? "\n" : " "));
            }
            clauses.add(fromClause);
        }
        if (where != null) {
            clauses.add(clause("WHERE", List.of(where), pretty));
        }
        if (!groupBy.isEmpty()) {
            clauses.add(clause("GROUP BY", groupBy, pretty));
        }
        if (having != null) {
            clauses.add(clause("HAVING", List.of(having), pretty));
        }
        if (!orderBy.isEmpty()) {
            clauses.add(clause("ORDER BY", orderBy, pretty));
        }
        for (Pagination page : pagination) {
            clauses.add(clause(page.keyword(), List.of(page.value()), pretty));
        }
        for (SetPart part : setParts) {
            clauses.add(part.operator());
            clauses.add(part.query().renderBody(pretty));
        }
        return String.join(pretty ? "\n" : " ", clauses);
    }

    private static String clause(String keyword, List<String> items, boolean pretty) {
        if (!pretty) {
            return keyword + " " + String.join(", ", items);
        }
        return keyword + "\n" + items.stream().map(SqlQuery::indent).collect(Collectors.joining(",\n"));
    }

    private static String indent(String text) {
        return text.lines().map(line -> "  " + line).collect(Collectors.joining("\n"));
    }

    @Override
    public String toString() {
        return render(false);
    }
}

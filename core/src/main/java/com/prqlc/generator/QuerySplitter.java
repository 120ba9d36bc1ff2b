package com.prqlc.generator;

import com.prqlc.dialect.Dialect;
import com.prqlc.dialect.DialectHandler;
import com.prqlc.dialect.SqlFragment;
import com.prqlc.exception.GenerationException;
import com.prqlc.pl.Literal;
import com.prqlc.rq.Aggregate;
import com.prqlc.rq.CId;
import com.prqlc.rq.ColumnDef;
import com.prqlc.rq.ColumnSort;
import com.prqlc.rq.Compute;
import com.prqlc.rq.Constant;
import com.prqlc.rq.From;
import com.prqlc.rq.Join;
import com.prqlc.rq.LiteralRelation;
import com.prqlc.rq.Loop;
import com.prqlc.rq.RawSplice;
import com.prqlc.rq.Relation;
import com.prqlc.rq.RelationColumn;
import com.prqlc.rq.RelationalQuery;
import com.prqlc.rq.RqExpr;
import com.prqlc.rq.SStringRelation;
import com.prqlc.rq.SetOperation;
import com.prqlc.rq.TId;
import com.prqlc.rq.TableDecl;
import com.prqlc.rq.TableRef;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits RQ relations into SELECT statements and renders them.
 *
 * <p>Each relation chain is walked from its source forward. Operators are
 * accumulated into a {@link Segment} until one conflicts with the clauses
 * already claimed; the segment is then closed into a CTE named {@code table_N}
 * and accumulation continues from that CTE. Declared tables become CTEs under
 * their own names. All CTEs end up in a single {@code WITH} clause, in the
 * order they were created, which is also their dependency order. A loop
 * becomes a recursive CTE that unions its initial rows with its step.
 *
 * <p>An instance is used for one query only.
 */
final class QuerySplitter {

    private static final Logger logger = LoggerFactory.getLogger(QuerySplitter.class);

    /**
     * How a column id is rendered at the current point of the pipeline.
     */
    private interface Binding {
    }

    /**
     * A column of a table in FROM or JOIN. A null name stands for all its columns.
     */
    private record TableColumn(String qualifier, String name) implements Binding {
    }

    /**
     * A column computed in the current segment, rendered by inlining its expression.
     */
    private record Computed(ColumnDef def) implements Binding {
    }

    private final DialectHandler handler;
    private final Map<CId, Binding> env = new HashMap<>();
    private final Map<CId, List<CId>> wildcardSiblings = new HashMap<>();
    private final Map<TId, String> tableNames = new HashMap<>();
    private final List<SqlQuery.Cte> ctes = new ArrayList<>();
    private final Set<String> usedNames = new HashSet<>();
    private boolean recursive;
    private int tableCounter;
    private int exprCounter;

    QuerySplitter(DialectHandler handler) {
        this.handler = handler;
    }

    /**
     * Renders a query into its main SELECT, with all CTEs attached.
     */
    SqlQuery split(RelationalQuery query) {
        for (TableDecl decl : query.tables()) {
            if (!decl.isExtern() && decl.name() != null) {
                usedNames.add(decl.name());
            }
        }

        for (TableDecl decl : query.tables()) {
            if (decl.isExtern()) {
                tableNames.put(decl.id(), handler.tableName(decl.name()));
                continue;
            }
            SqlQuery body = relation(decl.relation(), decl.columns());
            String name = decl.name() != null ? handler.identifier(decl.name()) : nextTableName();
            ctes.add(new SqlQuery.Cte(name, body));
            tableNames.put(decl.id(), name);
        }

        SqlQuery main = relation(query.main(), null);
        logger.debug("Rendered query with {} CTE(s)", ctes.size());
        // SQL Server recurses without the keyword.
        return main.with(ctes).recursive(recursive && handler.dialect() != Dialect.MSSQL);
    }

    // ==================== Relations ====================

    /**
     * Renders one relation chain. Any CTEs it needs are added to {@link #ctes}.
     *
     * @param relation the last operator of the chain
     * @param outputs the output names of a declared table, or null for the main query
     */
    private SqlQuery relation(Relation relation, List<RelationColumn> outputs) {
        if (relation instanceof SStringRelation sstring) {
            return SqlQuery.raw(rawText(sstring.items()));
        }
        if (relation instanceof LiteralRelation literal) {
            return literal(literal);
        }

        List<Relation> ops = linearize(relation);
        if (!(ops.get(0) instanceof From from)) {
            throw new GenerationException("a relation must start from a table", ops.get(0).kind(), null);
        }
        Segment segment = start(from.table());
        for (Relation op : ops.subList(1, ops.size())) {
            String reason = segment.conflict(op);
            if (reason != null) {
                segment = close(segment, reason);
            }
            if (op instanceof Loop loop) {
                segment = loop(segment, loop);
                continue;
            }
            apply(segment, op);
        }
        return render(segment, segment.frame(), outputs, outputs != null, new HashMap<>());
    }

    private static List<Relation> linearize(Relation relation) {
        LinkedList<Relation> ops = new LinkedList<>();
        for (Relation current = relation; current != null; current = current.input()) {
            ops.addFirst(current);
        }
        return ops;
    }

    private Segment start(TableRef ref) {
        String table = table(ref.source());
        String alias = ref.alias() == null ? null : handler.identifier(ref.alias());
        Segment.Source source = new Segment.Source(table, alias);
        bind(ref, source.qualifier());
        return new Segment(source, frameOf(ref));
    }

    private void apply(Segment segment, Relation op) {
        if (op instanceof Join join) {
            String table = table(join.with().source());
            String base = join.with().alias() == null ? table : handler.identifier(join.with().alias());
            String qualifier = segment.uniqueQualifier(base);
            bind(join.with(), qualifier);
            segment.addJoin(join.side(), new Segment.Source(table, qualifier), join.condition(),
                frameOf(join.with()));
        } else if (op instanceof SetOperation set) {
            segment.addSetOperation(set.kind(), table(set.other().source()));
        } else {
            if (op instanceof Compute compute) {
                env.put(compute.column().id(), new Computed(compute.column()));
            } else if (op instanceof Aggregate aggregate) {
                aggregate.computes().forEach(def -> env.put(def.id(), new Computed(def)));
            }
            segment.add(op);
        }
    }

    private String table(TId id) {
        String name = tableNames.get(id);
        if (name == null) {
            throw new GenerationException("table " + id + " is referenced before it is declared", "TableRef", null);
        }
        return name;
    }

    private void bind(TableRef ref, String qualifier) {
        List<CId> siblings = new ArrayList<>();
        CId wildcard = null;
        for (RelationColumn column : ref.columns()) {
            env.put(column.id(), new TableColumn(qualifier, column.name()));
            if (column.isWildcard()) {
                wildcard = column.id();
            } else {
                siblings.add(column.id());
            }
        }
        if (wildcard != null) {
            wildcardSiblings.put(wildcard, siblings);
        }
    }

    /**
     * Returns the columns a table contributes to the frame. A wildcard covers
     * all named columns of the same table.
     */
    private static List<CId> frameOf(TableRef ref) {
        List<CId> named = new ArrayList<>();
        for (RelationColumn column : ref.columns()) {
            if (column.isWildcard()) {
                return List.of(column.id());
            }
            named.add(column.id());
        }
        return named;
    }

    // ==================== CTEs ====================

    /**
     * Closes a segment into a CTE and starts a new segment reading from it.
     */
    private Segment close(Segment segment, String reason) {
        String name = nextTableName();
        logger.debug("Splitting into CTE {}: {}", name, reason);

        List<CId> columns = new ArrayList<>(segment.frame());
        List<ColumnSort> sort = segment.sort();
        if (sort != null) {
            // Sort columns are carried along so the order can be applied downstream.
            for (ColumnSort column : sort) {
                if (!isCovered(column.column(), columns)) {
                    columns.add(column.column());
                }
            }
        }

        Map<CId, String> names = new HashMap<>();
        ctes.add(new SqlQuery.Cte(name, render(segment, columns, null, true, names)));
        rebind(name, columns, names);

        Segment next = new Segment(new Segment.Source(name, null), segment.frame());
        if (sort != null) {
            next.inheritSort(sort);
        }
        return next;
    }

    /**
     * Renders a loop as a recursive CTE: the segment so far gives the initial
     * rows, the step the rows of each further iteration.
     */
    private Segment loop(Segment segment, Loop loop) {
        String name = nextTableName();
        logger.debug("Rendering loop into recursive CTE {}", name);

        List<CId> columns = segment.frame();
        Map<CId, String> names = new HashMap<>();
        SqlQuery initial = render(segment, columns, loop.columns(), true, names);
        tableNames.put(loop.table(), name);
        initial.setOperation("UNION ALL", relation(loop.step(), null));
        ctes.add(new SqlQuery.Cte(name, initial));
        recursive = true;

        rebind(name, columns, names);
        return new Segment(new Segment.Source(name, null), columns);
    }

    /**
     * Points the given columns to the CTE they were rendered into.
     */
    private void rebind(String name, List<CId> columns, Map<CId, String> names) {
        for (CId id : columns) {
            if (env.get(id) instanceof TableColumn column && column.name() == null) {
                env.put(id, new TableColumn(name, null));
                for (CId sibling : wildcardSiblings.getOrDefault(id, List.of())) {
                    if (!columns.contains(sibling) && env.get(sibling) instanceof TableColumn named) {
                        env.put(sibling, new TableColumn(name, named.name()));
                    }
                }
            } else {
                env.put(id, new TableColumn(name, names.get(id)));
            }
        }
        // The wildcard of the CTE now also covers the columns computed into it.
        for (CId id : columns) {
            if (isWildcard(id)) {
                List<CId> covered = new ArrayList<>(wildcardSiblings.getOrDefault(id, List.of()));
                for (CId other : columns) {
                    if (!isWildcard(other) && !covered.contains(other)) {
                        covered.add(other);
                    }
                }
                wildcardSiblings.put(id, covered);
            }
        }
    }

    private boolean isWildcard(CId id) {
        return env.get(id) instanceof TableColumn column && column.name() == null;
    }

    /**
     * Returns true if a projected wildcard of the same table already yields the column.
     */
    private boolean isProjectedByWildcard(CId id, List<CId> columns) {
        if (!(env.get(id) instanceof TableColumn column) || column.name() == null) {
            return false;
        }
        for (CId other : columns) {
            if (env.get(other) instanceof TableColumn wildcard && wildcard.name() == null
                && wildcard.qualifier().equals(column.qualifier())
                && wildcardSiblings.getOrDefault(other, List.of()).contains(id)) {
                return true;
            }
        }
        return false;
    }

    private boolean isCovered(CId id, List<CId> columns) {
        if (columns.contains(id)) {
            return true;
        }
        for (CId column : columns) {
            if (wildcardSiblings.getOrDefault(column, List.of()).contains(id)) {
                return true;
            }
        }
        return false;
    }

    private String nextTableName() {
        String name;
        do {
            name = "table_" + tableCounter++;
        } while (usedNames.contains(name));
        usedNames.add(name);
        return name;
    }

    // ==================== Rendering ====================

    /**
     * Renders a segment.
     *
     * @param segment the segment
     * @param columns the columns to project
     * @param outputs output names overriding the natural ones, or null
     * @param cte whether the result is read by name, which requires unique names for all columns
     * @param names receives the output name of each projected column
     */
    private SqlQuery render(Segment segment, List<CId> columns, List<RelationColumn> outputs, boolean cte,
                            Map<CId, String> names) {
        ExprRenderer renderer = new ExprRenderer(handler, id -> column(segment, id));
        SqlQuery query = new SqlQuery();

        Map<CId, String> overrides = new HashMap<>();
        if (outputs != null) {
            for (RelationColumn output : outputs) {
                if (!output.isWildcard()) {
                    overrides.put(output.id(), output.name());
                }
            }
        }

        Set<String> taken = new HashSet<>();
        List<String> items = new ArrayList<>();
        for (CId id : columns) {
            Binding binding = binding(id);
            if (binding instanceof TableColumn column && column.name() == null) {
                String sql = column(segment, id).sql();
                if (!items.contains(sql)) {
                    items.add(sql);
                }
                continue;
            }
            String natural = binding instanceof TableColumn column
                ? column.name()
                : ((Computed) binding).def().name();
            String name = overrides.getOrDefault(id, natural);
            if (isProjectedByWildcard(id, columns) && natural.equals(name) && taken.add(name)) {
                names.put(id, name);
                continue;
            }
            if (name == null && cte) {
                name = "_expr_" + exprCounter++;
            }
            if (name != null && cte) {
                name = unique(name, taken);
            }
            names.put(id, name);
            items.add(aliased(column(segment, id).sql(), name));
        }
        if (items.isEmpty()) {
            items.add("NULL");
        }
        query.select(items);
        if (segment.isDistinct()) {
            query.distinct();
        }

        query.from(segment.source().render());
        for (Segment.JoinPart join : segment.joins()) {
            query.join(join(join, renderer));
        }
        if (!segment.where().isEmpty()) {
            query.where(conjunction(segment.where(), renderer));
        }
        if (segment.aggregate() != null && !segment.aggregate().partition().isEmpty()) {
            List<String> groupBy = new ArrayList<>();
            for (CId id : segment.aggregate().partition()) {
                groupBy.add(column(segment, id).sql());
            }
            query.groupBy(groupBy);
        }
        if (!segment.having().isEmpty()) {
            query.having(conjunction(segment.having(), renderer));
        }
        // Inside a CTE the order only matters for picking the rows to take.
        if (segment.sort() != null && !segment.sort().isEmpty() && (!cte || segment.hasTake())) {
            List<String> orderBy = new ArrayList<>();
            for (ColumnSort sort : segment.sort()) {
                orderBy.add(column(segment, sort.column()).sql() + (sort.descending() ? " DESC" : ""));
            }
            query.orderBy(orderBy);
        }
        paginate(query, segment);
        for (Segment.SetPart part : segment.setParts()) {
            query.setOperation(setOperator(part.kind()), new SqlQuery().select(List.of("*")).from(part.table()));
        }
        return query;
    }

    private Binding binding(CId id) {
        Binding binding = env.get(id);
        if (binding == null) {
            throw new GenerationException("column " + id + " is not available in this query", "ColumnRef", null);
        }
        return binding;
    }

    private SqlFragment column(Segment segment, CId id) {
        Binding binding = binding(id);
        if (binding instanceof TableColumn column) {
            String prefix = segment.isQualified() ? column.qualifier() + "." : "";
            return SqlFragment.atomic(prefix + (column.name() == null ? "*" : handler.identifier(column.name())));
        }
        ColumnDef def = ((Computed) binding).def();
        return new ExprRenderer(handler, ref -> column(segment, ref)).render(def.expr(), def.window());
    }

    private String aliased(String sql, String name) {
        if (name == null) {
            return sql;
        }
        String identifier = handler.identifier(name);
        if (sql.equals(identifier) || sql.endsWith("." + identifier)) {
            return sql;
        }
        return sql + " AS " + identifier;
    }

    private static String unique(String name, Set<String> taken) {
        String candidate = name;
        int n = 1;
        while (!taken.add(candidate)) {
            candidate = name + "_" + n++;
        }
        return candidate;
    }

    private String join(Segment.JoinPart join, ExprRenderer renderer) {
        if (join.side() == Join.Side.INNER && isTrue(join.condition())) {
            return "CROSS JOIN " + join.source().render();
        }
        String keyword = switch (join.side()) {
            case INNER -> "JOIN";
            case LEFT -> "LEFT JOIN";
            case RIGHT -> "RIGHT JOIN";
            case FULL -> "FULL JOIN";
        };
        return keyword + " " + join.source().render() + " ON " + renderer.render(join.condition()).sql();
    }

    private static boolean isTrue(RqExpr expr) {
        return expr instanceof Constant constant
            && constant.literal().kind() == Literal.Kind.BOOLEAN
            && constant.literal().asBoolean();
    }

    private static String conjunction(List<RqExpr> conditions, ExprRenderer renderer) {
        if (conditions.size() == 1) {
            return renderer.render(conditions.get(0)).sql();
        }
        List<String> parts = new ArrayList<>();
        for (RqExpr condition : conditions) {
            parts.add(renderer.render(condition).wrap(SqlFragment.AND));
        }
        return String.join(" AND ", parts);
    }

    private void paginate(SqlQuery query, Segment segment) {
        if (!segment.hasTake()) {
            return;
        }
        long offset = segment.offset();
        Long limit = segment.limit();
        Dialect dialect = handler.dialect();

        if (dialect.useTop()) {
            if (offset == 0) {
                if (limit != null) {
                    query.top("TOP (" + limit + ")");
                }
                return;
            }
            if (!query.hasOrderBy()) {
                query.orderBy(List.of("(SELECT NULL)"));
            }
            query.paginate("OFFSET", offset + " ROWS");
            if (limit != null) {
                query.paginate("FETCH FIRST", limit + " ROWS ONLY");
            }
            return;
        }

        if (limit != null) {
            query.paginate("LIMIT", Long.toString(limit));
        } else if (offset > 0) {
            // These dialects accept OFFSET only after a LIMIT.
            if (dialect == Dialect.SQLITE) {
                query.paginate("LIMIT", "-1");
            } else if (dialect == Dialect.MYSQL) {
                query.paginate("LIMIT", "18446744073709551615");
            }
        }
        if (offset > 0) {
            query.paginate("OFFSET", Long.toString(offset));
        }
    }

    private String setOperator(String kind) {
        Dialect dialect = handler.dialect();
        return switch (kind) {
            case "Append" -> "UNION ALL";
            case "Remove" -> dialect.exceptAll() ? "EXCEPT ALL" : "EXCEPT";
            case "Intersect" -> dialect.intersectAll() ? "INTERSECT ALL" : "INTERSECT";
            default -> throw new GenerationException("unknown set operation " + kind, kind, null);
        };
    }

    // ==================== Table Sources ====================

    private String rawText(List<RawSplice.Item> items) {
        ExprRenderer renderer = new ExprRenderer(handler, id -> {
            throw new GenerationException("a table s-string cannot reference column " + id, "SString", null);
        });
        StringBuilder sb = new StringBuilder();
        for (RawSplice.Item item : items) {
            sb.append(item.isText() ? item.text() : renderer.render(item.expr()).sql());
        }
        return sb.toString();
    }

    private SqlQuery literal(LiteralRelation relation) {
        List<String> columns = relation.columns();
        if (relation.rows().isEmpty()) {
            List<String> items = new ArrayList<>();
            for (String column : columns) {
                items.add("NULL AS " + handler.identifier(column));
            }
            return new SqlQuery().select(items).where("1 = 0");
        }

        SqlQuery first = null;
        for (List<Literal> row : relation.rows()) {
            List<String> items = new ArrayList<>();
            for (int i = 0; i < columns.size(); i++) {
                items.add(handler.literal(row.get(i)) + " AS " + handler.identifier(columns.get(i)));
            }
            SqlQuery query = new SqlQuery().select(items);
            if (first == null) {
                first = query;
            } else {
                first.setOperation("UNION ALL", query);
            }
        }
        return first;
    }
}

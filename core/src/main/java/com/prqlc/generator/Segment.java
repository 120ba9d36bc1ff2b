package com.prqlc.generator;

import com.prqlc.rq.Aggregate;
import com.prqlc.rq.ArrayExpr;
import com.prqlc.rq.CId;
import com.prqlc.rq.Case;
import com.prqlc.rq.ColumnDef;
import com.prqlc.rq.ColumnRef;
import com.prqlc.rq.ColumnSort;
import com.prqlc.rq.Compute;
import com.prqlc.rq.Distinct;
import com.prqlc.rq.Filter;
import com.prqlc.rq.Join;
import com.prqlc.rq.Loop;
import com.prqlc.rq.Operator;
import com.prqlc.rq.RawSplice;
import com.prqlc.rq.Relation;
import com.prqlc.rq.RqExpr;
import com.prqlc.rq.Select;
import com.prqlc.rq.SetOperation;
import com.prqlc.rq.Sort;
import com.prqlc.rq.Take;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The relational operators accumulated into one SELECT.
 *
 * <p>Operators are added in pipeline order. Before adding one, the caller asks
 * {@link #conflict(Relation)} whether it can still share this SELECT; if not, the
 * segment is closed into a CTE and a new segment starts from it.
 *
 * <p>Clause order within a SELECT is fixed (joins, WHERE, GROUP BY, HAVING,
 * window functions, DISTINCT, ORDER BY, LIMIT), so an operator conflicts whenever SQL
 * would evaluate it before an operator that precedes it in the pipeline.
 */
final class Segment {

    /**
     * A table in the FROM or JOIN clause.
     *
     * @param table the rendered table name
     * @param alias the rendered alias, or null to use the table name
     */
    record Source(String table, String alias) {

        String qualifier() {
            return alias != null ? alias : table;
        }

        String render() {
            return alias == null || alias.equals(table) ? table : table + " AS " + alias;
        }
    }

    record JoinPart(Join.Side side, Source source, RqExpr condition) {
    }

    record SetPart(String kind, String table) {
    }

    private final Source source;
    private final Set<String> qualifiers = new HashSet<>();
    private final List<JoinPart> joins = new ArrayList<>();
    private final List<RqExpr> where = new ArrayList<>();
    private final List<RqExpr> having = new ArrayList<>();
    private final List<SetPart> setParts = new ArrayList<>();
    // Columns computed by raw SQL, which may hide a window function or an aggregate.
    private final Set<CId> rawComputed = new HashSet<>();
    private List<CId> frame;
    private Aggregate aggregate;
    private boolean windowed;
    private boolean distinct;
    private List<ColumnSort> sort;
    private boolean hasTake;
    private long offset;
    private Long limit;

    /**
     * @param source the FROM table
     * @param frame the columns the source provides
     */
    Segment(Source source, List<CId> frame) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.frame = new ArrayList<>(frame);
        qualifiers.add(source.qualifier());
    }

    // ==================== Accumulation ====================

    /**
     * Returns why the operator cannot be added to this SELECT, or null if it can.
     */
    String conflict(Relation op) {
        if (op instanceof Join join) {
            if (distinct) {
                return "join after distinct";
            }
            if (aggregate != null) {
                return "join after aggregate";
            }
            if (windowed) {
                return "join after window function";
            }
            if (hasTake) {
                return "join after take";
            }
            if (!setParts.isEmpty()) {
                return "join after set operation";
            }
            boolean outer = join.side() == Join.Side.RIGHT || join.side() == Join.Side.FULL;
            if (outer && !where.isEmpty()) {
                return "outer join after filter";
            }
            return null;
        }
        if (op instanceof Filter filter) {
            if (distinct) {
                return "filter after distinct";
            }
            if (references(filter.condition(), rawComputed)) {
                return "filter on a column computed by raw SQL";
            }
            if (hasTake) {
                return "filter after take";
            }
            if (windowed) {
                return "filter after window function";
            }
            if (!setParts.isEmpty()) {
                return "filter after set operation";
            }
            return null;
        }
        if (op instanceof Aggregate agg) {
            if (distinct) {
                return "aggregate after distinct";
            }
            if (aggregate != null) {
                return "second aggregate";
            }
            if (usesRawComputed(agg)) {
                return "aggregate over a column computed by raw SQL";
            }
            if (hasTake) {
                return "aggregate after take";
            }
            if (windowed) {
                return "aggregate after window function";
            }
            if (!setParts.isEmpty()) {
                return "aggregate after set operation";
            }
            return null;
        }
        if (op instanceof Compute compute) {
            if (distinct) {
                return "compute after distinct";
            }
            if (aggregate != null) {
                return "compute after aggregate";
            }
            if (!setParts.isEmpty()) {
                return "compute after set operation";
            }
            if (compute.isWindowed() && hasTake) {
                return "window function after take";
            }
            return null;
        }
        if (op instanceof Sort) {
            if (hasTake) {
                return "sort after take";
            }
            if (!setParts.isEmpty()) {
                return "sort after set operation";
            }
            return null;
        }
        if (op instanceof Take) {
            return setParts.isEmpty() ? null : "take after set operation";
        }
        if (op instanceof SetOperation set) {
            if (hasTake) {
                return "set operation after take";
            }
            if (!setParts.isEmpty() && !setParts.get(0).kind().equals(set.kind())) {
                return "mixed set operations";
            }
            return null;
        }
        if (op instanceof Select select) {
            if (select.columns().equals(frame)) {
                return null;
            }
            if (!setParts.isEmpty()) {
                return "select after set operation";
            }
            return distinct ? "select after distinct" : null;
        }
        if (op instanceof Distinct) {
            if (hasTake) {
                return "distinct after take";
            }
            return setParts.isEmpty() ? null : "distinct after set operation";
        }
        if (op instanceof Loop) {
            if (hasTake) {
                return "loop after take";
            }
            return setParts.isEmpty() ? null : "loop after set operation";
        }
        return "unsupported operator " + op.kind();
    }

    /**
     * Adds an operator. The caller has checked it does not conflict.
     */
    void add(Relation op) {
        if (op instanceof Filter filter) {
            (aggregate != null ? having : where).add(filter.condition());
        } else if (op instanceof Compute compute) {
            frame.add(compute.column().id());
            windowed |= compute.isWindowed();
            RqExpr expr = compute.column().expr();
            if (containsRaw(expr) || references(expr, rawComputed)) {
                rawComputed.add(compute.column().id());
            }
        } else if (op instanceof Aggregate agg) {
            aggregate = agg;
            // Row order does not survive grouping.
            sort = null;
            frame = new ArrayList<>(agg.partition());
            agg.computes().forEach(def -> frame.add(def.id()));
        } else if (op instanceof Sort s) {
            sort = s.columns();
        } else if (op instanceof Take take) {
            addTake(take);
        } else if (op instanceof Select select) {
            frame = new ArrayList<>(select.columns());
        } else if (op instanceof Distinct) {
            distinct = true;
        } else if (op instanceof SetOperation) {
            throw new IllegalStateException("set operations are added with addSetOperation");
        } else if (op instanceof Join) {
            throw new IllegalStateException("joins are added with addJoin");
        } else if (op instanceof Loop) {
            throw new IllegalStateException("loops are rendered as a recursive CTE");
        }
    }

    void addJoin(Join.Side side, Source with, RqExpr condition, List<CId> columns) {
        joins.add(new JoinPart(side, with, condition));
        qualifiers.add(with.qualifier());
        frame.addAll(columns);
    }

    void addSetOperation(String kind, String table) {
        setParts.add(new SetPart(kind, table));
        // The order of the combined rows is undefined.
        sort = null;
    }

    private void addTake(Take take) {
        if (!hasTake) {
            hasTake = true;
            offset = take.offset();
            limit = take.limit();
            return;
        }
        // Taking from an already limited relation narrows the window further.
        Long narrowed = limit == null ? null : Math.max(0, limit - take.offset());
        if (take.limit() != null) {
            narrowed = narrowed == null ? take.limit() : Math.min(narrowed, take.limit());
        }
        offset += take.offset();
        limit = narrowed;
    }

    private boolean usesRawComputed(Aggregate agg) {
        for (CId id : agg.partition()) {
            if (rawComputed.contains(id)) {
                return true;
            }
        }
        for (ColumnDef def : agg.computes()) {
            if (references(def.expr(), rawComputed)) {
                return true;
            }
        }
        return false;
    }

    private static boolean references(RqExpr expr, Set<CId> ids) {
        if (ids.isEmpty() || expr == null) {
            return false;
        }
        if (expr instanceof ColumnRef ref) {
            return ids.contains(ref.id());
        }
        return children(expr).stream().anyMatch(child -> references(child, ids));
    }

    private static boolean containsRaw(RqExpr expr) {
        return expr instanceof RawSplice || children(expr).stream().anyMatch(Segment::containsRaw);
    }

    private static List<RqExpr> children(RqExpr expr) {
        List<RqExpr> children = new ArrayList<>();
        if (expr instanceof Operator operator) {
            children.addAll(operator.args());
        } else if (expr instanceof Case caseExpr) {
            for (Case.Arm arm : caseExpr.arms()) {
                children.add(arm.condition());
                children.add(arm.value());
            }
        } else if (expr instanceof ArrayExpr array) {
            children.addAll(array.items());
        } else if (expr instanceof RawSplice splice) {
            for (RawSplice.Item item : splice.items()) {
                if (!item.isText()) {
                    children.add(item.expr());
                }
            }
        }
        return children;
    }

    /**
     * Starts with a sort inherited from the segment this one reads from.
     */
    void inheritSort(List<ColumnSort> inherited) {
        sort = inherited;
    }

    /**
     * Returns a qualifier not yet used in this segment, based on the given one.
     */
    String uniqueQualifier(String qualifier) {
        if (!qualifiers.contains(qualifier)) {
            return qualifier;
        }
        int n = 1;
        while (qualifiers.contains(qualifier + "_" + n)) {
            n++;
        }
        return qualifier + "_" + n;
    }

    // ==================== Accessors ====================

    Source source() {
        return source;
    }

    List<JoinPart> joins() {
        return joins;
    }

    /**
     * Returns true if column names must be prefixed by their table.
     */
    boolean isQualified() {
        return !joins.isEmpty();
    }

    List<RqExpr> where() {
        return where;
    }

    Aggregate aggregate() {
        return aggregate;
    }

    List<RqExpr> having() {
        return having;
    }

    List<CId> frame() {
        return frame;
    }

    boolean isDistinct() {
        return distinct;
    }

    List<ColumnSort> sort() {
        return sort;
    }

    boolean hasTake() {
        return hasTake;
    }

    long offset() {
        return offset;
    }

    Long limit() {
        return limit;
    }

    List<SetPart> setParts() {
        return setParts;
    }
}

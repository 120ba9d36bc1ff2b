package com.prqlc.semantic;

import com.prqlc.dialect.FunctionRegistry;
import com.prqlc.exception.LowerException;
import com.prqlc.exception.ResolveException;
import com.prqlc.exception.UnsupportedVersionException;
import com.prqlc.pl.Literal;
import com.prqlc.pl.QueryDef;
import com.prqlc.pl.Span;
import com.prqlc.rq.Aggregate;
import com.prqlc.rq.Append;
import com.prqlc.rq.ArrayExpr;
import com.prqlc.rq.CId;
import com.prqlc.rq.Case;
import com.prqlc.rq.ColumnSort;
import com.prqlc.rq.Compute;
import com.prqlc.rq.Distinct;
import com.prqlc.rq.Filter;
import com.prqlc.rq.From;
import com.prqlc.rq.Intersect;
import com.prqlc.rq.Join;
import com.prqlc.rq.Loop;
import com.prqlc.rq.Operator;
import com.prqlc.rq.RawSplice;
import com.prqlc.rq.Relation;
import com.prqlc.rq.RelationColumn;
import com.prqlc.rq.RelationalQuery;
import com.prqlc.rq.Remove;
import com.prqlc.rq.RqExpr;
import com.prqlc.rq.Select;
import com.prqlc.rq.Sort;
import com.prqlc.rq.TId;
import com.prqlc.rq.TableDecl;
import com.prqlc.rq.TableRef;
import com.prqlc.rq.Take;
import com.prqlc.rq.Transform;
import com.prqlc.rq.Window;
import com.prqlc.semantic.ir.AggregateCall;
import com.prqlc.semantic.ir.ApplyContext;
import com.prqlc.semantic.ir.ArrayValue;
import com.prqlc.semantic.ir.BuiltinCall;
import com.prqlc.semantic.ir.CaseExpr;
import com.prqlc.semantic.ir.ColumnDef;
import com.prqlc.semantic.ir.ColumnRef;
import com.prqlc.semantic.ir.Constant;
import com.prqlc.semantic.ir.DeriveCall;
import com.prqlc.semantic.ir.FilterCall;
import com.prqlc.semantic.ir.Frame;
import com.prqlc.semantic.ir.FrameColumn;
import com.prqlc.semantic.ir.FrameInput;
import com.prqlc.semantic.ir.JoinCall;
import com.prqlc.semantic.ir.LiteralRelation;
import com.prqlc.semantic.ir.LoopCall;
import com.prqlc.semantic.ir.RangeValue;
import com.prqlc.semantic.ir.RelationValue;
import com.prqlc.semantic.ir.ResolvedExpr;
import com.prqlc.semantic.ir.SStringExpr;
import com.prqlc.semantic.ir.SStringRelation;
import com.prqlc.semantic.ir.SelectCall;
import com.prqlc.semantic.ir.SetOpCall;
import com.prqlc.semantic.ir.SortCall;
import com.prqlc.semantic.ir.SortItem;
import com.prqlc.semantic.ir.TableFunction;
import com.prqlc.semantic.ir.TableSource;
import com.prqlc.semantic.ir.TakeCall;
import com.prqlc.semantic.ir.TupleValue;
import com.prqlc.semantic.ir.TypeName;
import com.prqlc.semantic.ir.WindowFrame;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lowers a resolved query into RQ.
 *
 * <p>Every transform call becomes one or a few relational operators over column
 * ids. Each relation ends with a {@link Select} listing its frame, so the
 * columns a relation exposes are always explicit.
 *
 * <p>Tables are declared once: a database table by its name, a declared
 * relation by its declaration, and every other relation used as a table (an
 * s-string, inline rows, a relation given directly to {@code join}) once per
 * use. Table declarations are emitted in dependency order. The table a loop
 * step reads its previous iteration from is not declared; the {@link Loop}
 * defines it.
 *
 * <p>A lowering instance holds the state of one compilation and must not be
 * reused.
 */
public final class Lowering {

    private static final Logger logger = LoggerFactory.getLogger(Lowering.class);

    private static final Pattern VERSION = Pattern.compile("^\\s*(?:>=|\\^|~|=)?\\s*(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?\\s*$");

    private final List<TableDecl> tables = new ArrayList<>();
    private final Map<String, TId> externTables = new HashMap<>();
    private final Map<String, TId> declaredTables = new HashMap<>();
    private final Set<String> declaredNames = new HashSet<>();
    private final Map<TableSource, TId> loopTables = new IdentityHashMap<>();
    private int nextTableId;
    private int nextColumnId;

    /**
     * Lowers a resolved query.
     *
     * @param query the resolved query
     * @return the relational query
     * @throws LowerException if the query has a shape RQ cannot represent
     */
    public RelationalQuery lower(ResolvedQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        nextColumnId = query.nextColumnId();

        Relation main = lowerRelation(query.main());
        QueryDef header = query.header();
        RelationalQuery rq = new RelationalQuery(header == null ? null : header.target(),
            header == null ? null : header.version(), tables, main);
        logger.debug("Lowered query into {} table(s)", tables.size());
        return rq;
    }

    // ==================== Version ====================

    /**
     * Checks that a query header does not require a newer compiler.
     *
     * <p>Only the major version is compared. While the major version is 0 the
     * minor version takes its place, so {@code 0.14} is newer than {@code 0.13.5}
     * while {@code 0.13.9} is not.
     *
     * @param header the query header, may be null
     * @param compilerVersion the version of this compiler
     * @throws UnsupportedVersionException if the requirement is newer
     */
    public static void checkVersion(QueryDef header, String compilerVersion) {
        if (header == null || header.version() == null) {
            return;
        }
        int[] required = parseVersion(header.version(), header.span());
        int[] actual = parseVersion(compilerVersion, null);

        boolean newer = required[0] > actual[0]
            || (required[0] == 0 && actual[0] == 0 && required[1] > actual[1]);
        if (newer) {
            throw new UnsupportedVersionException(header.version(), compilerVersion, header.span());
        }
    }

    private static int[] parseVersion(String version, Span span) {
        Matcher matcher = VERSION.matcher(version);
        if (!matcher.matches()) {
            throw ResolveException.invalidArgument("`" + version + "` is not a valid version requirement", span);
        }
        int major = Integer.parseInt(matcher.group(1));
        int minor = matcher.group(2) == null ? 0 : Integer.parseInt(matcher.group(2));
        return new int[] {major, minor};
    }

    // ==================== Relations ====================

    /**
     * Lowers a relation and appends the select of its output columns.
     */
    private Relation lowerRelation(RelationValue relation) {
        Relation lowered = lowerPipeline(relation);
        List<CId> columns = columnIds(relation.frame());
        if (lowered instanceof Select select && select.columns().equals(columns)) {
            return select;
        }
        return new Select(lowered, columns);
    }

    private Relation lowerPipeline(RelationValue relation) {
        if (relation instanceof TableSource source) {
            return new From(tableRef(source));
        }
        if (relation instanceof SelectCall call) {
            Relation input = computes(lowerPipeline(call.input()), call.computed(), call.context(), call.span());
            return new Select(input, columnIds(call.frame()));
        }
        if (relation instanceof DeriveCall call) {
            return computes(lowerPipeline(call.input()), call.computed(), call.context(), call.span());
        }
        if (relation instanceof FilterCall call) {
            return new Filter(lowerPipeline(call.input()), lowerExpr(call.condition()));
        }
        if (relation instanceof AggregateCall call) {
            return aggregate(call);
        }
        if (relation instanceof SortCall call) {
            return sort(call);
        }
        if (relation instanceof TakeCall call) {
            return take(call);
        }
        if (relation instanceof JoinCall call) {
            Relation input = lowerPipeline(call.input());
            Join.Side side = Join.Side.valueOf(call.side().name());
            return new Join(input, side, tableRef(call.with()), lowerExpr(call.condition()));
        }
        if (relation instanceof SetOpCall call) {
            return setOperation(call);
        }
        if (relation instanceof LoopCall call) {
            return loop(call);
        }
        // A relation used directly, without an instance.
        TId id = anonymousTable(relation);
        List<RelationColumn> columns = new ArrayList<>();
        List<FrameColumn> frameColumns = relation.frame().columns();
        for (int i = 0; i < frameColumns.size(); i++) {
            FrameColumn column = frameColumns.get(i);
            columns.add(column instanceof FrameColumn.Single single
                ? new RelationColumn(Frame.outputName(single, i), new CId(single.id()))
                : RelationColumn.wildcard(new CId(column.id())));
        }
        return new From(new TableRef(id, null, columns));
    }

    private Relation computes(Relation input, List<ColumnDef> computed, ApplyContext context, Span span) {
        Relation current = input;
        for (ColumnDef def : computed) {
            RqExpr expr = lowerExpr(def.expr());
            Window window = isWindowed(def.expr()) ? window(context, current) : null;
            current = new Compute(current, new com.prqlc.rq.ColumnDef(new CId(def.column().id()),
                def.column().name(), expr, window));
        }
        return current;
    }

    private Relation aggregate(AggregateCall call) {
        Relation input = lowerPipeline(call.input());
        List<com.prqlc.rq.ColumnDef> computes = new ArrayList<>();
        for (ColumnDef def : call.aggregates()) {
            computes.add(new com.prqlc.rq.ColumnDef(new CId(def.column().id()), def.column().name(),
                lowerExpr(def.expr()), null));
        }
        List<CId> partition = new ArrayList<>();
        for (FrameColumn.Single column : call.context().partition()) {
            partition.add(new CId(column.id()));
        }
        return new Aggregate(input, partition, computes);
    }

    private Relation sort(SortCall call) {
        Relation input = lowerPipeline(call.input());
        ApplyContext context = call.context();
        if (context.isGrouped() || context.window() != null) {
            // Sorts inside group and window only order the window functions.
            return input;
        }
        List<ColumnSort> columns = new ArrayList<>();
        Relation current = input;
        for (SortItem item : call.items()) {
            CId column;
            if (item.expr() instanceof ColumnRef ref) {
                column = new CId(ref.column().id());
            } else {
                column = new CId(nextColumnId++);
                current = new Compute(current, new com.prqlc.rq.ColumnDef(column, null, lowerExpr(item.expr()),
                    null));
            }
            columns.add(new ColumnSort(column, item.descending()));
        }
        Relation sorted = new Sort(current, columns);
        if (current != input) {
            sorted = new Select(sorted, columnIds(call.frame()));
        }
        return sorted;
    }

    private Relation take(TakeCall call) {
        Relation input = lowerPipeline(call.input());
        long start = call.start();
        Long end = call.end();
        if (!call.context().isGrouped()) {
            long offset = start - 1;
            Long limit = end == null ? null : Math.max(0, end - start + 1);
            return new Take(input, offset, limit);
        }

        if (start == 1 && end != null && end == 1 && isDistinct(call)) {
            return new Distinct(new Select(input, columnIds(call.frame())));
        }

        // Within a group, number the rows of each partition and keep those in range.
        CId rowNumber = new CId(nextColumnId++);
        List<CId> partition = new ArrayList<>();
        for (FrameColumn.Single column : call.context().partition()) {
            partition.add(new CId(column.id()));
        }
        Window window = new Window(null, null, null, partition, sortColumns(call.context().sort()));
        Relation numbered = new Compute(input, new com.prqlc.rq.ColumnDef(rowNumber, null,
            new Operator("std.row_number", List.of(), call.span()), window));

        RqExpr ref = new com.prqlc.rq.ColumnRef(rowNumber, call.span());
        RqExpr condition = null;
        if (start > 1) {
            condition = new Operator("std.gte", List.of(ref, integer(start, call.span())), call.span());
        }
        if (end != null) {
            RqExpr upper = new Operator("std.lte", List.of(ref, integer(end, call.span())), call.span());
            condition = condition == null ? upper : new Operator("std.and", List.of(condition, upper), call.span());
        }
        Relation filtered = condition == null ? numbered : new Filter(numbered, condition);
        return new Select(filtered, columnIds(call.frame()));
    }

    /**
     * Returns true if the first row of each group is just the distinct values
     * of the group keys: the frame holds exactly the keys and no order applies.
     */
    private static boolean isDistinct(TakeCall call) {
        Frame frame = call.frame();
        if (frame.hasWildcard() || !call.context().sort().isEmpty()) {
            return false;
        }
        Set<Integer> keys = new HashSet<>();
        for (FrameColumn.Single column : call.context().partition()) {
            keys.add(column.id());
        }
        Set<Integer> columns = new HashSet<>();
        for (FrameColumn column : frame.columns()) {
            columns.add(column.id());
        }
        return keys.equals(columns);
    }

    private static RqExpr integer(long value, Span span) {
        return new com.prqlc.rq.Constant(Literal.integer(value, span));
    }

    private Relation setOperation(SetOpCall call) {
        RelationValue left = call.input();
        TableSource right = call.other();
        List<FrameColumn> leftColumns = left.frame().columns();
        List<FrameColumn> rightColumns = right.frame().columns();
        boolean known = !left.frame().hasWildcard() && !right.frame().hasWildcard();
        if (known && leftColumns.size() != rightColumns.size()) {
            throw new LowerException(String.format("cannot %s relations with %d and %d columns",
                call.transformName(), leftColumns.size(), rightColumns.size()), call.span(),
                List.of("both relations of a set operation need the same number of columns"));
        }

        Relation input = lowerRelation(left);
        TableRef other = tableRef(right);
        return switch (call.kind()) {
            case APPEND -> new Append(input, other);
            case REMOVE -> new Remove(input, other);
            case INTERSECT -> new Intersect(input, other);
        };
    }

    // ==================== Windows ====================

    private static boolean isWindowed(ResolvedExpr expr) {
        if (expr instanceof BuiltinCall call) {
            if (FunctionRegistry.isAggregate(call.name()) || FunctionRegistry.isWindowFunction(call.name())) {
                return true;
            }
            return call.args().stream().anyMatch(Lowering::isWindowed);
        }
        if (expr instanceof SStringExpr sstring) {
            return sstring.items().stream().anyMatch(item -> !item.isText() && isWindowed(item.expr()));
        }
        if (expr instanceof CaseExpr caseExpr) {
            return caseExpr.arms().stream()
                .anyMatch(arm -> isWindowed(arm.condition()) || isWindowed(arm.value()));
        }
        return false;
    }

    private Window window(ApplyContext context, Relation input) {
        List<CId> partition = new ArrayList<>();
        for (FrameColumn.Single column : context.partition()) {
            partition.add(new CId(column.id()));
        }
        List<ColumnSort> sort = context.sort().isEmpty() ? currentSort(input) : sortColumns(context.sort());
        WindowFrame frame = context.window();
        if (frame == null) {
            return new Window(null, null, null, partition, sort);
        }
        Window.Kind kind = frame.kind() == WindowFrame.Kind.ROWS ? Window.Kind.ROWS : Window.Kind.RANGE;
        return new Window(kind, frame.start(), frame.end(), partition, sort);
    }

    /**
     * Returns the order the relation is sorted in, if a sort still applies to it.
     */
    private static List<ColumnSort> currentSort(Relation relation) {
        Relation current = relation;
        while (current instanceof Transform transform) {
            if (transform instanceof Sort sort) {
                return sort.columns();
            }
            if (transform instanceof Aggregate || transform instanceof Join || transform instanceof Loop) {
                break;
            }
            current = transform.input();
        }
        return List.of();
    }

    private List<ColumnSort> sortColumns(List<SortItem> items) {
        List<ColumnSort> columns = new ArrayList<>();
        for (SortItem item : items) {
            if (!(item.expr() instanceof ColumnRef ref)) {
                throw new LowerException("window functions can only be sorted by columns", item.expr().span(),
                    List.of("derive the sort expression as a column first"));
            }
            columns.add(new ColumnSort(new CId(ref.column().id()), item.descending()));
        }
        return columns;
    }

    // ==================== Tables ====================

    private TableRef tableRef(TableSource source) {
        FrameInput input = source.input();
        TId id = switch (source.kind()) {
            case EXTERN -> externTable(source.table());
            case DECLARED -> declaredTable(source);
            case ANONYMOUS -> anonymousTable(source.source());
            case RECURSIVE -> loopTables.get(source);
        };
        List<RelationColumn> columns = new ArrayList<>();
        for (Map.Entry<String, Integer> observed : input.observed().entrySet()) {
            columns.add(new RelationColumn(observed.getKey(), new CId(observed.getValue())));
        }
        if (input.hasWildcard()) {
            columns.add(RelationColumn.wildcard(new CId(input.wildcardId())));
        }
        return new TableRef(id, input.name(), columns);
    }

    private TId externTable(String name) {
        TId existing = externTables.get(name);
        if (existing != null) {
            return existing;
        }
        TId id = new TId(nextTableId++);
        tables.add(TableDecl.extern(id, name));
        externTables.put(name, id);
        declaredNames.add(name);
        return id;
    }

    private TId declaredTable(TableSource source) {
        TId existing = declaredTables.get(source.table());
        if (existing != null) {
            return existing;
        }
        Relation relation = lowerRelation(source.source());
        TId id = new TId(nextTableId++);
        String name = tableName(source.table());
        tables.add(new TableDecl(id, name, relation, outputColumns(source.source().frame())));
        declaredTables.put(source.table(), id);
        logger.trace("Declared table {} for {}", name, source.table());
        return id;
    }

    private String tableName(String fullName) {
        String name = fullName.substring(fullName.lastIndexOf('.') + 1);
        if (!declaredNames.add(name)) {
            name = fullName.replace('.', '_');
            declaredNames.add(name);
        }
        return name;
    }

    private TId anonymousTable(RelationValue source) {
        Relation relation;
        if (source instanceof SStringRelation sstring) {
            relation = new com.prqlc.rq.SStringRelation(spliceItems(sstring.items()));
        } else if (source instanceof LiteralRelation rows) {
            relation = new com.prqlc.rq.LiteralRelation(rows.columnNames(), rows.rows());
        } else if (source instanceof TableFunction function) {
            relation = new com.prqlc.rq.SStringRelation(List.of(
                RawSplice.Item.text("SELECT * FROM " + function.function() + "("),
                RawSplice.Item.expr(lowerExpr(function.argument())),
                RawSplice.Item.text(")")));
        } else {
            relation = lowerRelation(source);
        }
        TId id = new TId(nextTableId++);
        tables.add(new TableDecl(id, null, relation, outputColumns(source.frame())));
        return id;
    }

    private Relation loop(LoopCall call) {
        Relation initial = lowerRelation(call.input());
        TId id = new TId(nextTableId++);
        loopTables.put(call.previous(), id);
        Relation step = lowerRelation(call.step());
        logger.trace("Lowered loop over {}", id);
        return new Loop(initial, id, outputColumns(call.input().frame()), step);
    }

    private static List<RelationColumn> outputColumns(Frame frame) {
        List<RelationColumn> columns = new ArrayList<>();
        List<FrameColumn> frameColumns = frame.columns();
        for (int i = 0; i < frameColumns.size(); i++) {
            FrameColumn column = frameColumns.get(i);
            if (column instanceof FrameColumn.Single single) {
                columns.add(new RelationColumn(Frame.outputName(single, i), new CId(single.id())));
            } else {
                columns.add(RelationColumn.wildcard(new CId(column.id())));
            }
        }
        return columns;
    }

    private static List<CId> columnIds(Frame frame) {
        List<CId> ids = new ArrayList<>();
        for (FrameColumn column : frame.columns()) {
            ids.add(new CId(column.id()));
        }
        return ids;
    }

    // ==================== Expressions ====================

    private RqExpr lowerExpr(ResolvedExpr expr) {
        if (expr instanceof ColumnRef ref) {
            return new com.prqlc.rq.ColumnRef(new CId(ref.column().id()), ref.span());
        }
        if (expr instanceof Constant constant) {
            return new com.prqlc.rq.Constant(constant.literal());
        }
        if (expr instanceof BuiltinCall call) {
            return lowerCall(call);
        }
        if (expr instanceof SStringExpr sstring) {
            return new RawSplice(spliceItems(sstring.items()), sstring.span());
        }
        if (expr instanceof CaseExpr caseExpr) {
            List<Case.Arm> arms = new ArrayList<>();
            for (CaseExpr.Arm arm : caseExpr.arms()) {
                arms.add(new Case.Arm(lowerExpr(arm.condition()), lowerExpr(arm.value())));
            }
            return new Case(arms, caseExpr.span());
        }
        if (expr instanceof ArrayValue array) {
            return new ArrayExpr(lowerAll(array.items()), array.span());
        }
        if (expr instanceof TypeName typeName) {
            return RawSplice.text(typeName.name(), typeName.span());
        }
        if (expr instanceof TupleValue) {
            throw new LowerException("a tuple cannot be used as a single value", expr.span(),
                List.of("list the columns separately"));
        }
        if (expr instanceof RangeValue) {
            throw new LowerException("a range can only be used with `take`, `in` or window bounds", expr.span());
        }
        if (expr instanceof RelationValue) {
            throw new LowerException("a relation cannot be used as a column value", expr.span());
        }
        if (expr instanceof FunctionValue function) {
            throw new LowerException("function `" + function.name() + "` is missing " + function.missing()
                + " argument(s)", expr.span());
        }
        throw new IllegalStateException("Unknown resolved expression: " + expr);
    }

    private RqExpr lowerCall(BuiltinCall call) {
        Span span = call.span();
        switch (call.name()) {
            case "std.in" -> {
                RqExpr value = lowerExpr(call.args().get(0));
                ResolvedExpr pattern = call.args().get(1);
                if (pattern instanceof RangeValue range) {
                    if (range.start() != null && range.end() != null) {
                        return new Operator("std.between",
                            List.of(value, lowerExpr(range.start()), lowerExpr(range.end())), span);
                    }
                    if (range.start() != null) {
                        return new Operator("std.gte", List.of(value, lowerExpr(range.start())), span);
                    }
                    if (range.end() != null) {
                        return new Operator("std.lte", List.of(value, lowerExpr(range.end())), span);
                    }
                    return new com.prqlc.rq.Constant(Literal.bool(true, span));
                }
                List<RqExpr> args = new ArrayList<>();
                args.add(value);
                args.addAll(lowerAll(((ArrayValue) pattern).items()));
                return new Operator("std.in_list", args, span);
            }
            default -> {
                return new Operator(call.name(), lowerAll(call.args()), span);
            }
        }
    }

    private List<RqExpr> lowerAll(List<ResolvedExpr> exprs) {
        List<RqExpr> lowered = new ArrayList<>();
        for (ResolvedExpr expr : exprs) {
            lowered.add(lowerExpr(expr));
        }
        return lowered;
    }

    private List<RawSplice.Item> spliceItems(List<SStringExpr.Item> items) {
        List<RawSplice.Item> lowered = new ArrayList<>();
        for (SStringExpr.Item item : items) {
            lowered.add(item.isText() ? RawSplice.Item.text(item.text()) : RawSplice.Item.expr(lowerExpr(item.expr())));
        }
        return lowered;
    }
}

package com.prqlc.semantic;

import com.prqlc.exception.ResolveException;
import com.prqlc.pl.Expr;
import com.prqlc.pl.Ident;
import com.prqlc.pl.Literal;
import com.prqlc.pl.Pipeline;
import com.prqlc.pl.Range;
import com.prqlc.pl.Span;
import com.prqlc.pl.Tuple;
import com.prqlc.pl.UnOp;
import com.prqlc.pl.UnaryExpr;
import com.prqlc.semantic.ir.AggregateCall;
import com.prqlc.semantic.ir.ApplyContext;
import com.prqlc.semantic.ir.BuiltinCall;
import com.prqlc.semantic.ir.ColumnDef;
import com.prqlc.semantic.ir.ColumnRef;
import com.prqlc.semantic.ir.Constant;
import com.prqlc.semantic.ir.DeriveCall;
import com.prqlc.semantic.ir.FilterCall;
import com.prqlc.semantic.ir.Frame;
import com.prqlc.semantic.ir.FrameColumn;
import com.prqlc.semantic.ir.FrameInput;
import com.prqlc.semantic.ir.JoinCall;
import com.prqlc.semantic.ir.LoopCall;
import com.prqlc.semantic.ir.RangeValue;
import com.prqlc.semantic.ir.RelationValue;
import com.prqlc.semantic.ir.ResolvedExpr;
import com.prqlc.semantic.ir.SelectCall;
import com.prqlc.semantic.ir.SetOpCall;
import com.prqlc.semantic.ir.SortCall;
import com.prqlc.semantic.ir.SortItem;
import com.prqlc.semantic.ir.TableSource;
import com.prqlc.semantic.ir.TakeCall;
import com.prqlc.semantic.ir.TupleValue;
import com.prqlc.semantic.ir.WindowFrame;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolves calls of the standard library transforms and computes the frame
 * each transform produces.
 *
 * <p>The relation argument of a transform is resolved first; all other
 * arguments are resolved in the frame of that relation.
 *
 * <p>{@code group} and {@code window} apply their pipeline to the input with an
 * {@link ApplyContext}. The context travels with the relations produced inside
 * the pipeline, so it also reaches transforms called through user functions.
 */
final class TransformResolver {

    private static final Logger logger = LoggerFactory.getLogger(TransformResolver.class);

    private static final Set<String> TRANSFORMS = Set.of(
        "from", "select", "filter", "derive", "aggregate", "sort", "take", "join", "group", "window",
        "append", "remove", "intersect", "loop");

    private final Resolver resolver;
    private final Map<RelationValue, ApplyContext> contexts = new IdentityHashMap<>();

    TransformResolver(Resolver resolver) {
        this.resolver = resolver;
    }

    boolean handles(String name) {
        return TRANSFORMS.contains(name);
    }

    /**
     * Applies a transform to its fully bound arguments.
     *
     * @param name the transform name
     * @param function the function being applied, for error messages
     * @param args the arguments by parameter name, including defaults
     * @param span the span of the call
     * @return the resulting relation
     */
    RelationValue apply(String name, FunctionValue function, Map<String, PendingArg> args, Span span) {
        if ("from".equals(name)) {
            return relationArg(args.get("source"), "source");
        }

        RelationValue rel = switch (name) {
            case "append" -> relationArg(args.get("top"), "top");
            case "remove", "intersect" -> relationArg(args.get("base"), "base");
            default -> relationArg(args.get("rel"), "rel");
        };
        ApplyContext context = contexts.getOrDefault(rel, ApplyContext.NONE);
        logger.trace("Applying {} to a relation with frame {}", name, rel.frame());

        return switch (name) {
            case "select" -> select(rel, args.get("columns"), context, span);
            case "derive" -> derive(rel, args.get("columns"), context, span);
            case "filter" -> filter(rel, args.get("condition"), context, span);
            case "aggregate" -> aggregate(rel, args.get("columns"), context, span);
            case "sort" -> sort(rel, args.get("by"), context, span);
            case "take" -> take(rel, args.get("expr"), context, span);
            case "join" -> join(rel, args, span);
            case "group" -> group(rel, args.get("by"), args.get("pipeline"), context, span);
            case "window" -> window(rel, args, context, span);
            case "append" -> setOp(SetOpCall.Kind.APPEND, rel, args.get("bottom"), span);
            case "remove" -> setOp(SetOpCall.Kind.REMOVE, rel, args.get("other"), span);
            case "intersect" -> setOp(SetOpCall.Kind.INTERSECT, rel, args.get("other"), span);
            case "loop" -> loop(rel, args.get("pipeline"), context, span);
            default -> throw new IllegalStateException("Not a transform: " + function.name());
        };
    }

    private RelationValue relationArg(PendingArg arg, String param) {
        if (arg.isResolved()) {
            return resolver.asRelation(arg.value(), null, arg.span());
        }
        RelationValue relation = resolver.resolveRelation(arg.expr(), arg.scope(), arg.frame());
        logger.trace("Resolved relation argument {} to {}", param, relation);
        return relation;
    }

    // ==================== Column lists ====================

    /**
     * A field of a column list, resolved in the frame of the relation.
     */
    private record Field(String alias, Expr expr, ResolvedExpr value) {
    }

    private List<Field> fields(PendingArg arg, Frame frame) {
        List<Field> fields = new ArrayList<>();
        if (arg.isResolved()) {
            ResolvedExpr value = arg.value();
            if (value instanceof TupleValue tuple) {
                for (ResolvedExpr item : tuple.fields()) {
                    fields.add(new Field(null, null, item));
                }
            } else {
                fields.add(new Field(null, null, value));
            }
            return fields;
        }
        List<Expr> exprs = arg.expr() instanceof Tuple tuple ? tuple.fields() : List.of(arg.expr());
        for (Expr expr : exprs) {
            fields.add(new Field(expr.alias(), expr, column(expr, arg.scope(), frame)));
        }
        return fields;
    }

    /**
     * Resolves a column expression. A bare {@code count} counts rows.
     */
    private ResolvedExpr column(Expr expr, Scope scope, Frame frame) {
        ResolvedExpr value = resolver.resolveExpr(expr, scope, frame);
        if (value instanceof FunctionValue function && "std.count".equals(function.internalName())
            && function.args().isEmpty()) {
            return new BuiltinCall("std.count", List.of(), expr.span());
        }
        if (value instanceof RelationValue) {
            throw new ResolveException(ResolveException.Kind.TYPE_MISMATCH,
                "expected a column expression, but found a relation", expr.span());
        }
        return resolver.scalar(value, expr.span());
    }

    private static String inferName(Field field) {
        if (field.alias() != null) {
            return field.alias();
        }
        if (field.expr() instanceof Ident ident && !ident.isStar()) {
            return ident.name();
        }
        return null;
    }

    private FrameColumn.Single newColumn(String name) {
        return new FrameColumn.Single(resolver.nextColumnId(), name, null);
    }

    // ==================== Transforms ====================

    private RelationValue select(RelationValue rel, PendingArg columns, ApplyContext context, Span span) {
        List<FrameColumn> output = new ArrayList<>();
        List<ColumnDef> computed = new ArrayList<>();
        for (Field field : fields(columns, rel.frame())) {
            ResolvedExpr value = field.value();
            if (field.alias() == null && value instanceof ColumnRef ref) {
                output.add(ref.column());
            } else if (field.alias() == null && value instanceof TupleValue tuple) {
                for (ResolvedExpr item : tuple.fields()) {
                    if (!(item instanceof ColumnRef ref)) {
                        throw new ResolveException(ResolveException.Kind.TYPE_MISMATCH,
                            "nested tuples in `select` may only contain columns", item.span());
                    }
                    output.add(ref.column());
                }
            } else {
                FrameColumn.Single column = newColumn(inferName(field));
                computed.add(new ColumnDef(column, value));
                output.add(column);
            }
        }
        Frame frame = rel.frame().withColumns(output);
        return propagate(context, new SelectCall(rel, computed, context, frame, span));
    }

    private RelationValue derive(RelationValue rel, PendingArg columns, ApplyContext context, Span span) {
        Frame frame = rel.frame();
        List<ColumnDef> computed = new ArrayList<>();
        List<Expr> exprs = columns.isResolved() ? null
            : columns.expr() instanceof Tuple tuple ? tuple.fields() : List.of(columns.expr());
        if (exprs == null) {
            for (Field field : fields(columns, frame)) {
                FrameColumn.Single column = newColumn(null);
                computed.add(new ColumnDef(column, field.value()));
                frame = upsert(frame, column);
            }
        } else {
            // Later columns may refer to earlier ones of the same derive.
            for (Expr expr : exprs) {
                Field field = new Field(expr.alias(), expr, column(expr, columns.scope(), frame));
                if (field.alias() == null && field.value() instanceof ColumnRef) {
                    continue;
                }
                FrameColumn.Single column = newColumn(inferName(field));
                computed.add(new ColumnDef(column, field.value()));
                frame = upsert(frame, column);
            }
        }
        return propagate(context, new DeriveCall(rel, computed, context, frame, span));
    }

    private static Frame upsert(Frame frame, FrameColumn.Single column) {
        List<FrameColumn> columns = new ArrayList<>();
        boolean replaced = false;
        for (FrameColumn existing : frame.columns()) {
            if (column.name() != null && existing instanceof FrameColumn.Single single
                && column.name().equals(single.name())) {
                if (!replaced) {
                    columns.add(column);
                    replaced = true;
                }
            } else {
                columns.add(existing);
            }
        }
        if (!replaced) {
            columns.add(column);
        }
        return frame.withColumns(columns);
    }

    private RelationValue filter(RelationValue rel, PendingArg condition, ApplyContext context, Span span) {
        ResolvedExpr value = condition.isResolved()
            ? condition.value()
            : column(condition.expr(), condition.scope(), rel.frame());
        if (value instanceof TupleValue || value instanceof RangeValue) {
            throw new ResolveException(ResolveException.Kind.TYPE_MISMATCH,
                "`filter` expects a condition, but found `" + value + "`", condition.span());
        }
        return propagate(context, new FilterCall(rel, value, context, span));
    }

    private RelationValue aggregate(RelationValue rel, PendingArg columns, ApplyContext context, Span span) {
        List<FrameColumn> output = new ArrayList<>(context.partition());
        List<ColumnDef> aggregates = new ArrayList<>();
        for (Field field : fields(columns, rel.frame())) {
            FrameColumn.Single column = newColumn(field.alias());
            aggregates.add(new ColumnDef(column, field.value()));
            output.add(column);
        }
        Frame frame = rel.frame().withColumns(output);
        return propagate(context, new AggregateCall(rel, aggregates, context, frame, span));
    }

    private RelationValue sort(RelationValue rel, PendingArg by, ApplyContext context, Span span) {
        List<SortItem> items = new ArrayList<>();
        if (by.isResolved()) {
            for (Field field : fields(by, rel.frame())) {
                items.add(new SortItem(field.value(), false));
            }
        } else {
            List<Expr> exprs = by.expr() instanceof Tuple tuple ? tuple.fields() : List.of(by.expr());
            for (Expr expr : exprs) {
                boolean descending = false;
                Expr target = expr;
                if (expr instanceof UnaryExpr unary && (unary.op() == UnOp.NEG || unary.op() == UnOp.PLUS)) {
                    descending = unary.op() == UnOp.NEG;
                    target = unary.operand();
                }
                items.add(new SortItem(column(target, by.scope(), rel.frame()), descending));
            }
        }
        SortCall sort = new SortCall(rel, items, context, span);
        if (context.isGrouped() || context.window() != null) {
            contexts.put(sort, context.withSort(items));
            return sort;
        }
        return propagate(context, sort);
    }

    private RelationValue take(RelationValue rel, PendingArg expr, ApplyContext context, Span span) {
        ResolvedExpr value = expr.isResolved() ? expr.value() : resolver.resolveExpr(expr.expr(), expr.scope(), rel.frame());
        Long start;
        Long end;
        if (value instanceof RangeValue range) {
            start = takeBound(range.start(), expr.span());
            end = takeBound(range.end(), expr.span());
        } else {
            start = 1L;
            end = takeBound(value, expr.span());
            if (end == null) {
                throw takeMismatch(value, expr.span());
            }
        }
        if (start == null) {
            start = 1L;
        }
        if (start < 1 || (end != null && end < 0)) {
            throw ResolveException.invalidArgument("`take` bounds must be positive, but found " + value, expr.span());
        }
        return propagate(context, new TakeCall(rel, start, end, context, span));
    }

    private static Long takeBound(ResolvedExpr bound, Span span) {
        if (bound == null) {
            return null;
        }
        if (bound instanceof Constant constant && constant.literal().kind() == Literal.Kind.INTEGER) {
            return constant.literal().asLong();
        }
        throw takeMismatch(bound, span);
    }

    private static ResolveException takeMismatch(ResolvedExpr value, Span span) {
        return new ResolveException(ResolveException.Kind.TYPE_MISMATCH,
            "`take` expects an integer or a range of integers, but found `" + value + "`", span);
    }

    private RelationValue join(RelationValue rel, Map<String, PendingArg> args, Span span) {
        PendingArg withArg = args.get("with");
        RelationValue withRelation = relationArg(withArg, "with");
        String alias = withArg.isResolved() ? null : withArg.expr().alias();
        TableSource with = resolver.asTableSource(withRelation, alias, withArg.span());
        JoinCall.Side side = joinSide(args.get("side"));

        Frame left = rel.frame();
        Frame joinFrame = Frame.forJoin(left, with.frame());
        PendingArg conditionArg = args.get("condition");

        List<String> using = new ArrayList<>();
        ResolvedExpr condition;
        if (conditionArg.isResolved()) {
            condition = conditionArg.value();
        } else {
            List<Expr> exprs = conditionArg.expr() instanceof Tuple tuple
                ? tuple.fields()
                : List.of(conditionArg.expr());
            List<ResolvedExpr> parts = new ArrayList<>();
            for (Expr expr : exprs) {
                if (expr instanceof UnaryExpr unary && unary.op() == UnOp.EQ_SELF
                    && unary.operand() instanceof Ident ident) {
                    using.add(ident.name());
                }
                parts.add(resolver.scalar(resolver.resolveExpr(expr, conditionArg.scope(), joinFrame), expr.span()));
            }
            if (parts.isEmpty()) {
                throw ResolveException.invalidArgument("`join` needs a condition", conditionArg.span());
            }
            condition = parts.get(0);
            for (int i = 1; i < parts.size(); i++) {
                condition = new BuiltinCall("std.and", List.of(condition, parts.get(i)), conditionArg.span());
            }
        }

        Map<String, FrameColumn.Single> pinned = new LinkedHashMap<>();
        for (String name : using) {
            ResolvedExpr leftColumn = resolver.resolveIdent(new Ident(List.of("this", name), span), Scope.of(Module.root()),
                joinFrame);
            if (leftColumn instanceof ColumnRef ref && ref.column() instanceof FrameColumn.Single single) {
                pinned.put(name, single);
            }
        }

        List<FrameColumn> columns = new ArrayList<>(left.columns());
        for (FrameColumn column : with.frame().columns()) {
            if (column instanceof FrameColumn.Single single && using.contains(single.name())) {
                continue;
            }
            columns.add(column);
        }
        List<FrameInput> inputs = new ArrayList<>(left.inputs());
        inputs.addAll(with.frame().inputs());
        Map<String, FrameColumn.Single> allPinned = new LinkedHashMap<>(left.pinnedColumns());
        allPinned.putAll(pinned);
        Frame frame = new Frame(columns, inputs).withPinned(allPinned);
        return new JoinCall(rel, side, with, condition, frame, span);
    }

    private static JoinCall.Side joinSide(PendingArg arg) {
        if (!arg.isResolved() && arg.expr() instanceof Ident ident && ident.parts().size() == 1) {
            switch (ident.name().toLowerCase(Locale.ROOT)) {
                case "inner" -> {
                    return JoinCall.Side.INNER;
                }
                case "left" -> {
                    return JoinCall.Side.LEFT;
                }
                case "right" -> {
                    return JoinCall.Side.RIGHT;
                }
                case "full" -> {
                    return JoinCall.Side.FULL;
                }
                default -> {
                }
            }
        }
        throw new ResolveException(ResolveException.Kind.INVALID_ARGUMENT,
            "`side` expects inner, left, right or full, but found `" + arg + "`", arg.span());
    }

    private RelationValue group(RelationValue rel, PendingArg by, PendingArg pipeline, ApplyContext context,
                                Span span) {
        List<FrameColumn.Single> partition = new ArrayList<>();
        List<ColumnDef> keys = new ArrayList<>();
        Frame frame = rel.frame();
        for (Field field : fields(by, rel.frame())) {
            ResolvedExpr value = field.value();
            if (field.alias() == null && value instanceof ColumnRef ref && ref.column() instanceof FrameColumn.Single s) {
                partition.add(s);
            } else if (field.alias() == null && value instanceof TupleValue tuple) {
                for (ResolvedExpr item : tuple.fields()) {
                    if (item instanceof ColumnRef ref && ref.column() instanceof FrameColumn.Single s) {
                        partition.add(s);
                    } else {
                        throw ResolveException.invalidArgument("cannot group by all columns of a relation",
                            item.span());
                    }
                }
            } else {
                // Computed keys are derived first and grouped by.
                FrameColumn.Single column = newColumn(inferName(field));
                keys.add(new ColumnDef(column, value));
                frame = upsert(frame, column);
                partition.add(column);
            }
        }
        RelationValue input = rel;
        if (!keys.isEmpty()) {
            input = new DeriveCall(rel, keys, context, frame, by.span());
        }

        ApplyContext grouped = new ApplyContext(partition, null, List.of());
        RelationValue result = applyPipeline(pipeline, input, grouped);
        contexts.remove(result);
        logger.debug("Grouped by {} into frame {}", partition, result.frame());
        return propagate(context, result);
    }

    private RelationValue window(RelationValue rel, Map<String, PendingArg> args, ApplyContext context, Span span) {
        Range rows = rangeArg(args.get("rows"), "rows");
        Range range = rangeArg(args.get("range"), "range");
        boolean expanding = booleanArg(args.get("expanding"), "expanding");
        long rolling = integerArg(args.get("rolling"), "rolling");

        WindowFrame frame = null;
        if (rows != null) {
            frame = new WindowFrame(WindowFrame.Kind.ROWS, bound(rows.start()), bound(rows.end()));
        } else if (range != null) {
            frame = new WindowFrame(WindowFrame.Kind.RANGE, bound(range.start()), bound(range.end()));
        } else if (expanding) {
            frame = new WindowFrame(WindowFrame.Kind.ROWS, null, 0L);
        } else if (rolling > 0) {
            frame = new WindowFrame(WindowFrame.Kind.ROWS, -(rolling - 1), 0L);
        }

        ApplyContext windowed = context.withWindow(frame);
        RelationValue result = applyPipeline(args.get("pipeline"), rel, windowed);
        contexts.remove(result);
        return propagate(context, result);
    }

    private static Range rangeArg(PendingArg arg, String name) {
        Expr expr = arg.expr();
        if (expr == null || expr instanceof Literal literal && literal.isNull()) {
            return null;
        }
        if (expr instanceof Range range) {
            return range;
        }
        throw ResolveException.invalidArgument("`" + name + "` expects a range such as -2..0, but found `" + arg + "`",
            arg.span());
    }

    private static Long bound(Expr expr) {
        if (expr == null) {
            return null;
        }
        if (expr instanceof Literal literal && literal.kind() == Literal.Kind.INTEGER) {
            return literal.asLong();
        }
        throw ResolveException.invalidArgument("window bounds must be integer literals, but found `" + expr + "`",
            expr.span());
    }

    private static boolean booleanArg(PendingArg arg, String name) {
        if (arg.expr() instanceof Literal literal && literal.kind() == Literal.Kind.BOOLEAN) {
            return literal.asBoolean();
        }
        throw ResolveException.invalidArgument("`" + name + "` expects true or false, but found `" + arg + "`",
            arg.span());
    }

    private static long integerArg(PendingArg arg, String name) {
        if (arg.expr() instanceof Literal literal && literal.kind() == Literal.Kind.INTEGER) {
            return literal.asLong();
        }
        throw ResolveException.invalidArgument("`" + name + "` expects an integer, but found `" + arg + "`",
            arg.span());
    }

    private RelationValue setOp(SetOpCall.Kind kind, RelationValue rel, PendingArg otherArg, Span span) {
        RelationValue other = relationArg(otherArg, kind.name().toLowerCase(Locale.ROOT));
        String alias = otherArg.isResolved() ? null : otherArg.expr().alias();
        TableSource source = resolver.asTableSource(other, alias, otherArg.span());
        return new SetOpCall(kind, rel, source, span);
    }

    private RelationValue loop(RelationValue rel, PendingArg pipeline, ApplyContext context, Span span) {
        if (!context.isNone()) {
            throw ResolveException.invalidArgument("`loop` cannot be used inside `group` or `window`", span);
        }
        TableSource previous = resolver.instantiate(TableSource.Kind.RECURSIVE, null, rel, null, span);
        RelationValue step = applyPipeline(pipeline, previous, ApplyContext.NONE);
        contexts.remove(previous);
        contexts.remove(step);

        Frame initial = rel.frame();
        Frame iterated = step.frame();
        if (!initial.hasWildcard() && !iterated.hasWildcard()
            && initial.columns().size() != iterated.columns().size()) {
            throw ResolveException.invalidArgument(String.format(
                "the step of `loop` yields %d columns, but its input has %d",
                iterated.columns().size(), initial.columns().size()), pipeline.span());
        }
        logger.debug("Loop step yields frame {}", iterated);
        return new LoopCall(rel, previous, step, context, span);
    }

    // ==================== Nested pipelines ====================

    /**
     * Applies the pipeline argument of {@code group} or {@code window} to a
     * relation. Each step is a function that is given the relation as its last
     * argument.
     */
    private RelationValue applyPipeline(PendingArg pipeline, RelationValue input, ApplyContext context) {
        contexts.put(input, context);
        if (pipeline.isResolved()) {
            if (pipeline.value() instanceof FunctionValue function) {
                return resolver.asRelation(resolver.apply(function, List.of(PendingArg.resolved(input)), Map.of(),
                    pipeline.span(), input.frame()), null, pipeline.span());
            }
            throw new ResolveException(ResolveException.Kind.TYPE_MISMATCH,
                "expected a pipeline of transforms, but found `" + pipeline + "`", pipeline.span());
        }
        List<Expr> steps = pipeline.expr() instanceof Pipeline nested ? nested.exprs() : List.of(pipeline.expr());
        RelationValue current = input;
        for (Expr step : steps) {
            ResolvedExpr value = resolver.applyStep(step, PendingArg.resolved(current), pipeline.scope(),
                current.frame());
            current = resolver.asRelation(value, null, step.span());
        }
        return current;
    }

    private RelationValue propagate(ApplyContext context, RelationValue result) {
        if (!context.isNone()) {
            contexts.put(result, context);
        }
        return result;
    }
}

package com.prqlc.semantic;

import com.prqlc.catalog.TableCatalog;
import com.prqlc.catalog.TableSchema;
import com.prqlc.exception.ResolveException;
import com.prqlc.pl.Array;
import com.prqlc.pl.BinaryExpr;
import com.prqlc.pl.Case;
import com.prqlc.pl.Expr;
import com.prqlc.pl.Func;
import com.prqlc.pl.FuncCall;
import com.prqlc.pl.FuncParam;
import com.prqlc.pl.Ident;
import com.prqlc.pl.Internal;
import com.prqlc.pl.InterpolateItem;
import com.prqlc.pl.Interpolation;
import com.prqlc.pl.Literal;
import com.prqlc.pl.Pipeline;
import com.prqlc.pl.QueryDef;
import com.prqlc.pl.Range;
import com.prqlc.pl.Span;
import com.prqlc.pl.Stmt;
import com.prqlc.pl.Tuple;
import com.prqlc.pl.UnOp;
import com.prqlc.pl.UnaryExpr;
import com.prqlc.pl.VarDef;
import com.prqlc.semantic.ir.ArrayValue;
import com.prqlc.semantic.ir.BuiltinCall;
import com.prqlc.semantic.ir.CaseExpr;
import com.prqlc.semantic.ir.ColumnRef;
import com.prqlc.semantic.ir.Constant;
import com.prqlc.semantic.ir.Frame;
import com.prqlc.semantic.ir.FrameColumn;
import com.prqlc.semantic.ir.FrameInput;
import com.prqlc.semantic.ir.LiteralRelation;
import com.prqlc.semantic.ir.RangeValue;
import com.prqlc.semantic.ir.RelationValue;
import com.prqlc.semantic.ir.ResolvedExpr;
import com.prqlc.semantic.ir.SStringExpr;
import com.prqlc.semantic.ir.SStringRelation;
import com.prqlc.semantic.ir.TableFunction;
import com.prqlc.semantic.ir.TableSource;
import com.prqlc.semantic.ir.TupleValue;
import com.prqlc.semantic.ir.TypeName;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves a parsed query: binds every name to a declaration, a function
 * parameter or a frame column, applies functions and tracks the frame of every
 * relation.
 *
 * <p>Names in value position are looked up in this order:
 * <ol>
 *   <li>parameters of the enclosing functions</li>
 *   <li>columns of the current frame, including namespaced references such as
 *       {@code e.name}, {@code this.name} and {@code that.name}</li>
 *   <li>declarations of the query and its modules</li>
 *   <li>functions of the standard library</li>
 *   <li>the wildcard of an input with unknown columns, which absorbs the name</li>
 *   <li>other declarations of the standard library</li>
 * </ol>
 *
 * <p>Names in function position skip the frame: parameters, declarations, then
 * the standard library. Names in relation position that are not declared are
 * database tables.
 *
 * <p>A resolver holds the state of one compilation and must not be reused.
 */
public final class Resolver {

    private static final Logger logger = LoggerFactory.getLogger(Resolver.class);

    static final String DEFAULT_DB = "default_db";
    private static final String THIS = "this";
    private static final String THAT = "that";
    private static final int MAX_CALL_DEPTH = 256;
    private static final Set<String> RANKING = Set.of("std.row_number", "std.rank", "std.rank_dense");

    private final Module root;
    private final Module std;
    private final TableCatalog catalog;
    private final TransformResolver transforms;

    private int nextColumnId;
    private int nextInputId;
    private int callDepth;

    public Resolver(TableCatalog catalog) {
        this(StdLib.module(), catalog);
    }

    Resolver(Module std, TableCatalog catalog) {
        this.root = Module.root();
        this.std = Objects.requireNonNull(std, "std must not be null");
        this.catalog = catalog == null ? TableCatalog.empty() : catalog;
        this.transforms = new TransformResolver(this);
    }

    /**
     * Resolves a query.
     *
     * @param stmts the parsed statements
     * @return the header and the resolved main relation
     * @throws ResolveException if a name, call or type cannot be resolved
     */
    public ResolvedQuery resolve(List<Stmt> stmts) {
        QueryDef header = null;
        VarDef main = null;
        for (Stmt stmt : stmts) {
            if (stmt instanceof QueryDef queryDef && header == null && main == null && root.decls().isEmpty()) {
                header = queryDef;
            } else if (stmt instanceof VarDef varDef && varDef.kind() == VarDef.Kind.MAIN) {
                if (main != null) {
                    throw new ResolveException(ResolveException.Kind.INVALID_ARGUMENT,
                        "a query can only have one main pipeline", varDef.span(),
                        List.of("bind the other pipelines to a name with `let`"));
                }
                main = varDef;
            } else {
                ModuleBuilder.declare(root, stmt);
            }
        }

        Scope scope = Scope.of(root);
        RelationValue relation;
        if (main != null) {
            relation = resolveRelation(main.value(), scope, Frame.empty());
        } else {
            relation = lastInto(stmts);
        }
        logger.debug("Resolved main relation with frame {}", relation.frame());
        return new ResolvedQuery(header, relation, nextColumnId);
    }

    private RelationValue lastInto(List<Stmt> stmts) {
        for (int i = stmts.size() - 1; i >= 0; i--) {
            if (stmts.get(i) instanceof VarDef varDef && varDef.kind() == VarDef.Kind.INTO) {
                return resolveRelation(new Ident(List.of(varDef.name()), varDef.span()), Scope.of(root), Frame.empty());
            }
        }
        throw new ResolveException(ResolveException.Kind.INVALID_ARGUMENT, "Missing main pipeline", null,
            List.of("a query needs a pipeline that is not bound by `let`, such as `from employees`"));
    }

    // ==================== Ids ====================

    int nextColumnId() {
        return nextColumnId++;
    }

    int nextInputId() {
        return nextInputId++;
    }

    TransformResolver transforms() {
        return transforms;
    }

    // ==================== Expressions ====================

    /**
     * Resolves an expression in value position.
     */
    public ResolvedExpr resolveExpr(Expr expr, Scope scope, Frame frame) {
        if (expr instanceof Literal literal) {
            return new Constant(literal);
        }
        if (expr instanceof Ident ident) {
            return resolveIdent(ident, scope, frame);
        }
        if (expr instanceof BinaryExpr binary) {
            Ident op = new Ident(List.of(StdLib.MODULE_NAME, binary.op().stdName()), binary.span());
            FuncCall call = new FuncCall(op, List.of(binary.left(), binary.right()), binary.span());
            return resolveCall(call, scope, frame);
        }
        if (expr instanceof UnaryExpr unary) {
            return resolveUnary(unary, scope, frame);
        }
        if (expr instanceof FuncCall call) {
            return resolveCall(call, scope, frame);
        }
        if (expr instanceof Pipeline pipeline) {
            return resolvePipeline(pipeline, scope, frame);
        }
        if (expr instanceof Tuple tuple) {
            List<ResolvedExpr> fields = new ArrayList<>();
            for (Expr field : tuple.fields()) {
                fields.add(resolveExpr(field, scope, frame));
            }
            return new TupleValue(fields, tuple.span());
        }
        if (expr instanceof Array array) {
            List<ResolvedExpr> items = new ArrayList<>();
            for (Expr item : array.items()) {
                items.add(resolveExpr(item, scope, frame));
            }
            return new ArrayValue(items, array.span());
        }
        if (expr instanceof Range range) {
            ResolvedExpr start = range.start() == null ? null : resolveExpr(range.start(), scope, frame);
            ResolvedExpr end = range.end() == null ? null : resolveExpr(range.end(), scope, frame);
            return new RangeValue(start, end, range.span());
        }
        if (expr instanceof Interpolation interpolation) {
            return resolveInterpolation(interpolation, scope, frame);
        }
        if (expr instanceof Case caseExpr) {
            List<CaseExpr.Arm> arms = new ArrayList<>();
            for (Case.Arm arm : caseExpr.arms()) {
                arms.add(new CaseExpr.Arm(resolveExpr(arm.condition(), scope, frame),
                    resolveExpr(arm.value(), scope, frame)));
            }
            return new CaseExpr(arms, caseExpr.span());
        }
        if (expr instanceof Func func) {
            return new FunctionValue("anonymous function", func, scope, func.span());
        }
        if (expr instanceof Internal internal) {
            throw ResolveException.invalidArgument("`internal " + internal.name()
                + "` can only be used as the body of a standard library function", internal.span());
        }
        throw new IllegalStateException("Unknown expression: " + expr);
    }

    private ResolvedExpr resolveUnary(UnaryExpr unary, Scope scope, Frame frame) {
        if (unary.op() == UnOp.PLUS) {
            return resolveExpr(unary.operand(), scope, frame);
        }
        if (unary.op() == UnOp.EQ_SELF) {
            if (!frame.hasThat() || !(unary.operand() instanceof Ident ident) || ident.parts().size() != 1) {
                throw ResolveException.invalidArgument(
                    "`==column` can only be used in a join condition, with a bare column name", unary.span());
            }
            ResolvedExpr left = resolveIdent(new Ident(List.of(THIS, ident.name()), ident.span()), scope, frame);
            ResolvedExpr right = resolveIdent(new Ident(List.of(THAT, ident.name()), ident.span()), scope, frame);
            return new BuiltinCall("std.eq", List.of(left, right), unary.span());
        }
        String name = unary.op() == UnOp.NEG ? "neg" : "not";
        FuncCall call = new FuncCall(new Ident(List.of(StdLib.MODULE_NAME, name), unary.span()),
            List.of(unary.operand()), unary.span());
        return resolveCall(call, scope, frame);
    }

    private ResolvedExpr resolveInterpolation(Interpolation interpolation, Scope scope, Frame frame) {
        if (interpolation.kind() == Interpolation.Kind.S_STRING) {
            List<SStringExpr.Item> items = new ArrayList<>();
            for (InterpolateItem item : interpolation.items()) {
                items.add(item.isText()
                    ? SStringExpr.Item.text(item.text())
                    : SStringExpr.Item.expr(resolveExpr(item.expr(), scope, frame)));
            }
            return new SStringExpr(items, interpolation.span());
        }
        List<ResolvedExpr> parts = new ArrayList<>();
        for (InterpolateItem item : interpolation.items()) {
            if (item.isText()) {
                parts.add(new Constant(Literal.string(item.text(), interpolation.span())));
            } else {
                parts.add(resolveExpr(item.expr(), scope, frame));
            }
        }
        return new BuiltinCall("std.concat", parts, interpolation.span());
    }

    // ==================== Names ====================

    ResolvedExpr resolveIdent(Ident ident, Scope scope, Frame frame) {
        List<String> parts = ident.parts();
        if (parts.size() == 1 && THIS.equals(parts.get(0))) {
            return allColumns(frame, ident.span());
        }
        if (parts.size() == 1) {
            PendingArg param = scope.param(parts.get(0));
            if (param != null) {
                return paramValue(param, frame);
            }
        }

        ResolvedExpr column = lookupColumn(ident, scope, frame);
        if (column != null) {
            return column;
        }

        Decl decl = lookupUserDecl(scope, parts);
        if (decl != null) {
            return declValue(decl, ident, frame);
        }

        // Standard library functions shadow the columns a wildcard could absorb.
        decl = lookupStdDecl(parts);
        if (decl != null && decl.isFunction()) {
            return declValue(decl, ident, frame);
        }

        column = absorb(ident, frame);
        if (column != null) {
            return column;
        }

        if (decl != null) {
            return declValue(decl, ident, frame);
        }
        throw unknownName(ident, scope, frame);
    }

    private ResolvedExpr paramValue(PendingArg param, Frame frame) {
        if (param.isResolved()) {
            return param.value();
        }
        // Defaults of named parameters are bound late, in the frame they are used in.
        Frame useFrame = frame.isEmpty() && param.frame() != null ? param.frame() : frame;
        return resolveExpr(param.expr(), param.scope(), useFrame);
    }

    private ResolvedExpr allColumns(Frame frame, Span span) {
        List<ResolvedExpr> columns = new ArrayList<>();
        for (FrameColumn column : frame.columns()) {
            columns.add(new ColumnRef(column, span));
        }
        return new TupleValue(columns, span);
    }

    /**
     * Looks up a name among the explicit columns and namespaces of the frame.
     *
     * @return the column, or null if the name does not refer to the frame
     */
    private ResolvedExpr lookupColumn(Ident ident, Scope scope, Frame frame) {
        List<String> parts = ident.parts();
        if (parts.size() == 1) {
            String name = parts.get(0);
            FrameColumn.Single pinned = frame.pinned(name);
            if (pinned != null) {
                return new ColumnRef(pinned, ident.span());
            }
            return uniqueSingle(frame.singles(name, null), name, ident.span());
        }
        if (parts.size() != 2) {
            return null;
        }

        String namespace = parts.get(0);
        String name = parts.get(1);
        if (THIS.equals(namespace) || THAT.equals(namespace)) {
            return lookupSide(ident, THAT.equals(namespace), scope, frame);
        }
        FrameInput input = frame.input(namespace);
        if (input == null) {
            return null;
        }
        if (Ident.STAR.equals(name)) {
            return inputStar(input, frame, ident.span());
        }
        List<FrameColumn.Single> singles = frame.singles(name, namespace);
        if (!singles.isEmpty()) {
            return new ColumnRef(singles.get(0), ident.span());
        }
        if (frame.wildcardInputs().contains(input)) {
            return observe(input, name, ident.span());
        }
        throw unknownName(ident, scope, frame);
    }

    private ResolvedExpr lookupSide(Ident ident, boolean that, Scope scope, Frame frame) {
        if (that && !frame.hasThat()) {
            throw ResolveException.invalidArgument("`that` can only be used in a join condition", ident.span());
        }
        String name = ident.name();
        Set<String> sideNamespaces = new LinkedHashSet<>();
        List<FrameInput> sideWildcards = new ArrayList<>();
        for (FrameInput input : frame.inputs()) {
            if (frame.isThat(input) == that && input.name() != null) {
                sideNamespaces.add(input.name());
            }
        }
        for (FrameInput input : frame.wildcardInputs()) {
            if (frame.isThat(input) == that) {
                sideWildcards.add(input);
            }
        }

        List<FrameColumn> sideColumns = new ArrayList<>();
        List<FrameColumn.Single> matches = new ArrayList<>();
        for (FrameColumn column : frame.columns()) {
            boolean onSide = column instanceof FrameColumn.All all
                ? frame.isThat(all.input()) == that
                : isOnSide((FrameColumn.Single) column, sideNamespaces, that);
            if (!onSide) {
                continue;
            }
            sideColumns.add(column);
            if (column instanceof FrameColumn.Single single && name.equals(single.name())) {
                matches.add(single);
            }
        }

        if (Ident.STAR.equals(name)) {
            List<ResolvedExpr> refs = new ArrayList<>();
            for (FrameColumn column : sideColumns) {
                refs.add(new ColumnRef(column, ident.span()));
            }
            return new TupleValue(refs, ident.span());
        }
        ResolvedExpr single = uniqueSingle(matches, name, ident.span());
        if (single != null) {
            return single;
        }
        if (sideWildcards.size() == 1) {
            return observe(sideWildcards.get(0), name, ident.span());
        }
        if (sideWildcards.size() > 1) {
            throw ambiguous(name, sideWildcards, ident.span());
        }
        throw unknownName(ident, scope, frame);
    }

    private static boolean isOnSide(FrameColumn.Single column, Set<String> sideNamespaces, boolean that) {
        if (column.namespace() == null) {
            return !that;
        }
        return sideNamespaces.contains(column.namespace());
    }

    private ResolvedExpr inputStar(FrameInput input, Frame frame, Span span) {
        List<ResolvedExpr> refs = new ArrayList<>();
        for (FrameColumn column : frame.columns()) {
            if (column instanceof FrameColumn.All all && all.input() == input) {
                refs.add(new ColumnRef(column, span));
            } else if (column instanceof FrameColumn.Single single && input.name().equals(single.namespace())) {
                refs.add(new ColumnRef(column, span));
            }
        }
        return new TupleValue(refs, span);
    }

    private ResolvedExpr uniqueSingle(List<FrameColumn.Single> matches, String name, Span span) {
        if (matches.isEmpty()) {
            return null;
        }
        FrameColumn.Single first = matches.get(0);
        for (FrameColumn.Single other : matches) {
            if (other.id() != first.id()) {
                List<String> hints = new ArrayList<>();
                for (FrameColumn.Single match : matches) {
                    if (match.namespace() != null) {
                        hints.add("could be `" + match.namespace() + "." + name + "`");
                    }
                }
                throw new ResolveException(ResolveException.Kind.AMBIGUOUS_NAME,
                    "Ambiguous name `" + name + "`", span, hints);
            }
        }
        return new ColumnRef(first, span);
    }

    /**
     * Lets the single wildcard of the frame absorb an unmatched bare name.
     */
    private ResolvedExpr absorb(Ident ident, Frame frame) {
        if (ident.parts().size() != 1) {
            return null;
        }
        String name = ident.name();
        List<FrameInput> wildcards = frame.wildcardInputs();
        if (wildcards.size() == 1) {
            return observe(wildcards.get(0), name, ident.span());
        }
        if (wildcards.size() > 1) {
            throw ambiguous(name, wildcards, ident.span());
        }
        return null;
    }

    private ColumnRef observe(FrameInput input, String name, Span span) {
        int id = input.observe(name, this::nextColumnId);
        return new ColumnRef(new FrameColumn.Single(id, name, input.name()), span);
    }

    private ResolveException ambiguous(String name, List<FrameInput> inputs, Span span) {
        List<String> hints = new ArrayList<>();
        for (FrameInput input : inputs) {
            hints.add("could be `" + (input.name() == null ? "_" : input.name()) + "." + name + "`");
        }
        return new ResolveException(ResolveException.Kind.AMBIGUOUS_NAME, "Ambiguous name `" + name + "`", span,
            hints);
    }

    Decl lookupUserDecl(Scope scope, List<String> parts) {
        for (Module module = scope.module(); module != null; module = module.parent()) {
            if (module == std || module.path().startsWith(StdLib.MODULE_NAME + ".")) {
                continue;
            }
            Decl decl = module.lookup(parts);
            if (decl != null) {
                return decl;
            }
        }
        return null;
    }

    Decl lookupStdDecl(List<String> parts) {
        if (parts.size() > 1 && StdLib.MODULE_NAME.equals(parts.get(0))) {
            return std.lookup(parts.subList(1, parts.size()));
        }
        return std.lookup(parts);
    }

    private Decl lookupStdRelative(Scope scope, List<String> parts) {
        // Inside a standard library submodule, its siblings are visible by their short names.
        Module module = scope.module();
        if (module != std && module.path().startsWith(StdLib.MODULE_NAME + ".")) {
            Decl decl = module.lookup(parts);
            if (decl != null) {
                return decl;
            }
        }
        return lookupStdDecl(parts);
    }

    private ResolvedExpr declValue(Decl decl, Ident ident, Frame frame) {
        switch (decl.kind()) {
            case MODULE -> throw new ResolveException(ResolveException.Kind.TYPE_MISMATCH,
                "`" + decl.fullName() + "` is a module, not a value", ident.span());
            case TABLE -> {
                return declaredTable(decl, ident);
            }
            default -> {
                ResolvedExpr value = resolveDecl(decl);
                if (value instanceof FunctionValue function && function.missing() == 0 && function.args().isEmpty()) {
                    return apply(function, List.of(), Map.of(), ident.span(), frame);
                }
                if (value instanceof RelationValue relation) {
                    return instantiate(TableSource.Kind.DECLARED, decl.fullName(), relation,
                        aliasOf(ident), ident.span());
                }
                return value;
            }
        }
    }

    /**
     * Resolves the value of a declaration, once.
     */
    ResolvedExpr resolveDecl(Decl decl) {
        if (decl.isFunction()) {
            return new FunctionValue(decl.fullName(), (Func) decl.value(), Scope.of(decl.owner()), decl.span());
        }
        switch (decl.state()) {
            case RESOLVED -> {
                return decl.resolved();
            }
            case RESOLVING -> throw new ResolveException(ResolveException.Kind.CYCLIC_DECLARATION,
                "`" + decl.fullName() + "` is defined in terms of itself", decl.span());
            default -> {
                decl.markResolving();
                Scope scope = Scope.of(decl.owner());
                ResolvedExpr value;
                try {
                    value = isLiteralRelation(decl.value())
                        ? literalRelation((Array) decl.value(), decl.fullName(), decl.value().span())
                        : resolveExpr(decl.value(), scope, Frame.empty());
                } catch (RuntimeException e) {
                    decl.reset();
                    throw e;
                }
                logger.debug("Resolved declaration {}", decl.fullName());
                decl.markResolved(value);
                return value;
            }
        }
    }

    private ResolveException unknownName(Ident ident, Scope scope, Frame frame) {
        String name = String.join(".", ident.parts());
        Set<String> candidates = new LinkedHashSet<>(frame.columnNames());
        for (FrameColumn column : frame.columns()) {
            if (column instanceof FrameColumn.Single single && single.name() != null) {
                candidates.add(single.name());
            }
        }
        for (Module module = scope.module(); module != null; module = module.parent()) {
            candidates.addAll(module.allNames());
        }
        candidates.addAll(std.allNames());

        List<String> hints = new ArrayList<>();
        String suggestion = NameSuggestions.closest(name, candidates);
        if (suggestion != null) {
            hints.add("did you mean `" + suggestion + "`?");
        }
        List<String> available = frame.columnNames();
        if (!available.isEmpty()) {
            hints.add("available columns: " + String.join(", ", available));
        }
        return ResolveException.unknownName(name, ident.span(), hints);
    }

    // ==================== Relations ====================

    /**
     * Resolves an expression in relation position: undeclared names are tables,
     * s-strings are SQL queries and arrays of tuples are inline rows.
     */
    public RelationValue resolveRelation(Expr expr, Scope scope, Frame frame) {
        if (expr instanceof Ident ident) {
            return resolveRelationIdent(ident, scope, frame);
        }
        if (expr instanceof Interpolation interpolation && interpolation.kind() == Interpolation.Kind.S_STRING) {
            SStringExpr sql = (SStringExpr) resolveInterpolation(interpolation, scope, frame);
            return instantiate(TableSource.Kind.ANONYMOUS, null, sstringRelation(sql), expr.alias(), expr.span());
        }
        if (isLiteralRelation(expr)) {
            LiteralRelation rows = literalRelation((Array) expr, null, expr.span());
            return instantiate(TableSource.Kind.ANONYMOUS, null, rows, expr.alias(), expr.span());
        }
        return asRelation(resolveExpr(expr, scope, frame), expr.alias(), expr.span());
    }

    private RelationValue resolveRelationIdent(Ident ident, Scope scope, Frame frame) {
        List<String> parts = ident.parts();
        if (parts.size() == 1) {
            PendingArg param = scope.param(parts.get(0));
            if (param != null) {
                ResolvedExpr value = param.isResolved() ? param.value()
                    : resolveRelation(param.expr(), param.scope(), param.frame());
                return asRelation(value, null, ident.span());
            }
        }

        Decl decl = lookupUserDecl(scope, parts);
        if (decl == null && !DEFAULT_DB.equals(parts.get(0))) {
            List<String> qualified = new ArrayList<>();
            qualified.add(DEFAULT_DB);
            qualified.addAll(parts);
            decl = lookupUserDecl(scope, qualified);
        }
        if (decl != null) {
            return switch (decl.kind()) {
                case TABLE -> declaredTable(decl, ident);
                case VALUE -> {
                    ResolvedExpr value = resolveDecl(decl);
                    if (value instanceof RelationValue relation) {
                        yield instantiate(TableSource.Kind.DECLARED, decl.fullName(), relation, aliasOf(ident),
                            ident.span());
                    }
                    yield asRelation(value, aliasOf(ident), ident.span());
                }
                case MODULE -> throw new ResolveException(ResolveException.Kind.TYPE_MISMATCH,
                    "`" + decl.fullName() + "` is a module, not a relation", ident.span());
            };
        }

        List<String> tableParts = DEFAULT_DB.equals(parts.get(0)) && parts.size() > 1
            ? parts.subList(1, parts.size())
            : parts;
        String table = String.join(".", tableParts);
        List<String> known = catalog.table(table).map(TableSchema::columnNames).orElse(null);
        return externTable(table, known, aliasOf(ident), ident.span());
    }

    private TableSource declaredTable(Decl decl, Ident ident) {
        String table = decl.fullName().startsWith(DEFAULT_DB + ".")
            ? decl.fullName().substring(DEFAULT_DB.length() + 1)
            : decl.fullName();
        List<String> columns = decl.tableColumns();
        return externTable(table, columns.isEmpty() ? null : columns, aliasOf(ident), ident.span());
    }

    private static String aliasOf(Ident ident) {
        return ident.alias() != null ? ident.alias() : ident.name();
    }

    /**
     * Converts a value to a relation, or reports that it is not one.
     */
    RelationValue asRelation(ResolvedExpr value, String alias, Span span) {
        if (value instanceof RelationValue relation) {
            return relation;
        }
        if (value instanceof SStringExpr sql) {
            return instantiate(TableSource.Kind.ANONYMOUS, null, sstringRelation(sql), alias, span);
        }
        if (value instanceof FunctionValue function) {
            throw new ResolveException(ResolveException.Kind.TYPE_MISMATCH,
                "expected a relation, but found " + function + " which is missing "
                    + function.missing() + " argument(s)", span);
        }
        throw new ResolveException(ResolveException.Kind.TYPE_MISMATCH,
            "expected a relation, but found `" + value + "`", span);
    }

    /**
     * Creates an instance of a database table. Columns are explicit when the
     * table schema is known; otherwise the instance has a wildcard.
     */
    TableSource externTable(String table, List<String> knownColumns, String alias, Span span) {
        FrameInput input = new FrameInput(nextInputId(), alias, knownColumns == null, nextColumnId());
        List<FrameColumn> columns = new ArrayList<>();
        if (knownColumns == null) {
            columns.add(new FrameColumn.All(input));
        } else {
            for (String column : knownColumns) {
                columns.add(new FrameColumn.Single(input.observe(column, this::nextColumnId), column, alias));
            }
        }
        Frame frame = new Frame(columns, List.of(input));
        return new TableSource(TableSource.Kind.EXTERN, table, null, input, frame, span);
    }

    /**
     * Creates an instance of a relation that is used like a table. The instance
     * gets fresh column ids that refer to the relation's output columns by name.
     */
    TableSource instantiate(TableSource.Kind kind, String table, RelationValue source, String alias, Span span) {
        Frame sourceFrame = source.frame();
        FrameInput input = new FrameInput(nextInputId(), alias, sourceFrame.hasWildcard(), nextColumnId());
        List<FrameColumn> columns = new ArrayList<>();
        boolean wildcardAdded = false;
        List<FrameColumn> sourceColumns = sourceFrame.columns();
        for (int i = 0; i < sourceColumns.size(); i++) {
            FrameColumn column = sourceColumns.get(i);
            if (column instanceof FrameColumn.Single single) {
                String name = Frame.outputName(single, i);
                columns.add(new FrameColumn.Single(input.observe(name, this::nextColumnId), name, alias));
            } else if (!wildcardAdded) {
                columns.add(new FrameColumn.All(input));
                wildcardAdded = true;
            }
        }
        Frame frame = new Frame(columns, List.of(input));
        return new TableSource(kind, table, source, input, frame, span);
    }

    /**
     * Makes any relation usable as a table: table sources are kept, other
     * relations become anonymous table instances.
     */
    TableSource asTableSource(RelationValue relation, String alias, Span span) {
        if (relation instanceof TableSource source) {
            return source;
        }
        return instantiate(TableSource.Kind.ANONYMOUS, null, relation, alias, span);
    }

    private SStringRelation sstringRelation(SStringExpr sql) {
        FrameInput input = new FrameInput(nextInputId(), null, true, nextColumnId());
        Frame frame = new Frame(List.of(new FrameColumn.All(input)), List.of(input));
        return new SStringRelation(sql.items(), frame, sql.span());
    }

    TableFunction tableFunction(String function, ResolvedExpr argument, Span span) {
        FrameInput input = new FrameInput(nextInputId(), null, true, nextColumnId());
        Frame frame = new Frame(List.of(new FrameColumn.All(input)), List.of(input));
        return new TableFunction(function, argument, frame, span);
    }

    private static boolean isLiteralRelation(Expr expr) {
        if (!(expr instanceof Array array) || array.items().isEmpty()) {
            return false;
        }
        return array.items().stream().allMatch(item -> item instanceof Tuple);
    }

    private LiteralRelation literalRelation(Array array, String name, Span span) {
        List<String> columnNames = new ArrayList<>();
        List<List<Literal>> rows = new ArrayList<>();
        for (int r = 0; r < array.items().size(); r++) {
            Tuple tuple = (Tuple) array.items().get(r);
            List<Literal> row = new ArrayList<>();
            for (int c = 0; c < tuple.fields().size(); c++) {
                Expr field = tuple.fields().get(c);
                if (!(field instanceof Literal literal)) {
                    throw new ResolveException(ResolveException.Kind.TYPE_MISMATCH,
                        "inline rows may only contain literals, but found `" + field + "`", field.span());
                }
                if (r == 0) {
                    columnNames.add(field.alias() != null ? field.alias() : "_expr_" + c);
                }
                row.add(literal);
            }
            if (row.size() != columnNames.size()) {
                throw new ResolveException(ResolveException.Kind.TYPE_MISMATCH,
                    "every row of " + (name == null ? "an inline relation" : "`" + name + "`")
                        + " needs " + columnNames.size() + " values", tuple.span());
            }
            rows.add(row);
        }
        FrameInput input = new FrameInput(nextInputId(), null, false, nextColumnId());
        List<FrameColumn> columns = new ArrayList<>();
        for (String column : columnNames) {
            columns.add(new FrameColumn.Single(input.observe(column, this::nextColumnId), column, null));
        }
        return new LiteralRelation(columnNames, rows, new Frame(columns, List.of(input)), span);
    }

    // ==================== Function application ====================

    /**
     * Resolves a call: the callee, then the application of the arguments.
     */
    ResolvedExpr resolveCall(FuncCall call, Scope scope, Frame frame) {
        FunctionValue function = resolveCallee(call.name(), scope, frame);
        List<PendingArg> args = new ArrayList<>();
        for (Expr arg : call.args()) {
            args.add(PendingArg.of(arg, scope, frame));
        }
        return apply(function, args, pendingNamed(call.namedArgs(), scope, frame), call.span(), frame);
    }

    private static Map<String, PendingArg> pendingNamed(Map<String, Expr> namedArgs, Scope scope, Frame frame) {
        Map<String, PendingArg> named = new LinkedHashMap<>();
        for (Map.Entry<String, Expr> entry : namedArgs.entrySet()) {
            named.put(entry.getKey(), PendingArg.of(entry.getValue(), scope, frame));
        }
        return named;
    }

    /**
     * Resolves an expression in function position.
     */
    FunctionValue resolveCallee(Expr callee, Scope scope, Frame frame) {
        ResolvedExpr value;
        if (callee instanceof Ident ident) {
            PendingArg param = ident.parts().size() == 1 ? scope.param(ident.name()) : null;
            if (param != null) {
                value = paramValue(param, frame);
            } else {
                Decl decl = lookupUserDecl(scope, ident.parts());
                if (decl == null) {
                    decl = lookupStdRelative(scope, ident.parts());
                }
                if (decl == null) {
                    throw unknownName(ident, scope, Frame.empty());
                }
                if (decl.kind() != Decl.Kind.VALUE) {
                    throw new ResolveException(ResolveException.Kind.TYPE_MISMATCH,
                        "`" + decl.fullName() + "` is not a function", ident.span());
                }
                value = resolveDecl(decl);
            }
        } else {
            value = resolveExpr(callee, scope, frame);
        }
        if (value instanceof FunctionValue function) {
            return function;
        }
        throw new ResolveException(ResolveException.Kind.TYPE_MISMATCH,
            "`" + callee + "` is not a function and cannot be called", callee.span());
    }

    /**
     * Resolves a pipeline: the value of each step becomes the last argument of
     * the next step.
     */
    ResolvedExpr resolvePipeline(Pipeline pipeline, Scope scope, Frame frame) {
        List<Expr> steps = pipeline.exprs();
        ResolvedExpr value = resolveExpr(steps.get(0), scope, frame);
        for (int i = 1; i < steps.size(); i++) {
            Frame stepFrame = value instanceof RelationValue relation ? relation.frame() : frame;
            value = applyStep(steps.get(i), PendingArg.resolved(value), scope, stepFrame);
        }
        return value;
    }

    /**
     * Applies one pipeline step to a value; {@code a | f b} is {@code f b a}.
     */
    ResolvedExpr applyStep(Expr step, PendingArg value, Scope scope, Frame frame) {
        if (step instanceof FuncCall call) {
            FunctionValue function = resolveCallee(call.name(), scope, frame);
            List<PendingArg> args = new ArrayList<>();
            for (Expr arg : call.args()) {
                args.add(PendingArg.of(arg, scope, frame));
            }
            args.add(value);
            return apply(function, args, pendingNamed(call.namedArgs(), scope, frame), call.span(), frame);
        }
        FunctionValue function = step instanceof Ident || step instanceof Func
            ? resolveCallee(step, scope, frame)
            : null;
        if (function == null) {
            throw new ResolveException(ResolveException.Kind.TYPE_MISMATCH,
                "`" + step + "` is not a function and cannot be used as a pipeline step", step.span());
        }
        return apply(function, List.of(value), Map.of(), Span.merge(value.span(), step.span()), frame);
    }

    /**
     * Applies arguments to a function. Too few arguments yield a partially
     * applied function; too many are an error.
     */
    ResolvedExpr apply(FunctionValue function, List<PendingArg> args, Map<String, PendingArg> namedArgs,
                       Span span, Frame frame) {
        Func func = function.func();
        for (Map.Entry<String, PendingArg> named : namedArgs.entrySet()) {
            boolean known = func.namedParams().stream().anyMatch(p -> p.name().equals(named.getKey()));
            if (!known) {
                List<String> hints = func.namedParams().isEmpty()
                    ? List.of()
                    : List.of("named parameters are: " + String.join(", ",
                        func.namedParams().stream().map(FuncParam::name).toList()));
                throw new ResolveException(ResolveException.Kind.INVALID_ARGUMENT,
                    "function `" + function.name() + "` has no parameter `" + named.getKey() + "`",
                    named.getValue().span(), hints);
            }
        }

        List<PendingArg> allArgs = new ArrayList<>(function.args());
        allArgs.addAll(args);
        Map<String, PendingArg> allNamed = new LinkedHashMap<>(function.namedArgs());
        allNamed.putAll(namedArgs);

        int expected = func.params().size();
        if (allArgs.size() > expected) {
            throw new ResolveException(ResolveException.Kind.ARITY_MISMATCH,
                String.format("function `%s` expects %d argument%s, but got %d",
                    function.name(), expected, expected == 1 ? "" : "s", allArgs.size()),
                span);
        }
        if (allArgs.size() < expected) {
            return function.withArgs(allArgs, allNamed, span);
        }

        if (++callDepth > MAX_CALL_DEPTH) {
            throw new ResolveException(ResolveException.Kind.CYCLIC_DECLARATION,
                "function `" + function.name() + "` calls itself without end", span);
        }
        try {
            return evaluate(function, allArgs, allNamed, span, frame);
        } finally {
            callDepth--;
        }
    }

    private ResolvedExpr evaluate(FunctionValue function, List<PendingArg> args, Map<String, PendingArg> namedArgs,
                                  Span span, Frame frame) {
        Func func = function.func();
        Map<String, PendingArg> bound = new LinkedHashMap<>();
        for (int i = 0; i < func.params().size(); i++) {
            bound.put(func.params().get(i).name(), args.get(i));
        }
        for (FuncParam param : func.namedParams()) {
            PendingArg arg = namedArgs.get(param.name());
            bound.put(param.name(), arg != null ? arg : PendingArg.of(param.defaultValue(), function.scope(), frame));
        }

        String internal = function.internalName();
        if (internal != null) {
            if (transforms.handles(internal)) {
                return transforms.apply(internal, function, bound, span);
            }
            return evaluateBuiltin(internal, func, bound, span);
        }

        Map<String, PendingArg> params = new LinkedHashMap<>();
        for (FuncParam param : func.params()) {
            PendingArg arg = bound.get(param.name());
            params.put(param.name(), PendingArg.resolved(resolveArg(arg, param)));
        }
        for (FuncParam param : func.namedParams()) {
            PendingArg arg = bound.get(param.name());
            // Explicit named arguments are resolved at the call; defaults stay lazy.
            params.put(param.name(), namedArgs.containsKey(param.name())
                ? PendingArg.resolved(resolveArg(arg, param))
                : arg);
        }
        Scope body = function.scope().withParams(params);
        return resolveExpr(func.body(), body, frame);
    }

    ResolvedExpr resolveArg(PendingArg arg, FuncParam param) {
        if (arg.isResolved()) {
            return arg.value();
        }
        if (param != null && param.isRelation()) {
            return resolveRelation(arg.expr(), arg.scope(), arg.frame());
        }
        return resolveExpr(arg.expr(), arg.scope(), arg.frame());
    }

    private ResolvedExpr evaluateBuiltin(String name, Func func, Map<String, PendingArg> bound, Span span) {
        switch (name) {
            case "std.as" -> {
                PendingArg type = bound.get("type");
                ResolvedExpr value = scalar(resolveArg(bound.get("value"), null), bound.get("value").span());
                return new BuiltinCall(name, List.of(value, typeName(type)), span);
            }
            case "std.in" -> {
                ResolvedExpr pattern = resolveArg(bound.get("pattern"), null);
                ResolvedExpr value = scalar(resolveArg(bound.get("value"), null), bound.get("value").span());
                if (!(pattern instanceof RangeValue) && !(pattern instanceof ArrayValue)) {
                    throw new ResolveException(ResolveException.Kind.TYPE_MISMATCH,
                        "`in` expects a range or an array, but found `" + pattern + "`", bound.get("pattern").span());
                }
                return new BuiltinCall(name, List.of(value, pattern), span);
            }
            case "read_parquet", "read_csv" -> {
                PendingArg source = bound.get("source");
                ResolvedExpr path = resolveArg(source, null);
                return instantiate(TableSource.Kind.ANONYMOUS, null, tableFunction(name, path, span), null, span);
            }
            default -> {
                List<ResolvedExpr> values = new ArrayList<>();
                for (FuncParam param : func.params()) {
                    PendingArg arg = bound.get(param.name());
                    values.add(resolveArg(arg, param));
                }
                if ("std.count".equals(name) && values.size() == 1 && values.get(0) instanceof TupleValue) {
                    return new BuiltinCall(name, List.of(), span);
                }
                if (RANKING.contains(name)) {
                    return new BuiltinCall(name, List.of(), span);
                }
                for (int i = 0; i < values.size(); i++) {
                    values.set(i, scalar(values.get(i), bound.get(func.params().get(i).name()).span()));
                }
                checkComparison(name, values, span);
                return new BuiltinCall(name, values, span);
            }
        }
    }

    private static ResolvedExpr typeName(PendingArg type) {
        if (type.isResolved()) {
            if (type.value() instanceof TypeName typeName) {
                return typeName;
            }
            throw new ResolveException(ResolveException.Kind.TYPE_MISMATCH,
                "expected a type name, but found `" + type.value() + "`", type.span());
        }
        if (type.expr() instanceof Ident ident) {
            return new TypeName(String.join(".", ident.parts()), ident.span());
        }
        throw new ResolveException(ResolveException.Kind.TYPE_MISMATCH,
            "expected a type name, but found `" + type.expr() + "`", type.span());
    }

    /**
     * Checks that an argument of a scalar function is a scalar.
     */
    ResolvedExpr scalar(ResolvedExpr value, Span span) {
        if (value instanceof RelationValue) {
            throw new ResolveException(ResolveException.Kind.TYPE_MISMATCH,
                "expected a scalar, but found a relation", span);
        }
        if (value instanceof FunctionValue function) {
            throw new ResolveException(ResolveException.Kind.TYPE_MISMATCH,
                "function `" + function.name() + "` is missing " + function.missing() + " argument(s)", span,
                List.of("a function used as a value must be applied to all of its arguments"));
        }
        return value;
    }

    private static void checkComparison(String name, List<ResolvedExpr> values, Span span) {
        switch (name) {
            case "std.eq", "std.ne", "std.gt", "std.gte", "std.lt", "std.lte" -> {
                boolean collection = values.stream().anyMatch(
                    v -> v instanceof ArrayValue || v instanceof TupleValue || v instanceof RangeValue);
                boolean plain = values.stream().anyMatch(
                    v -> !(v instanceof ArrayValue || v instanceof TupleValue || v instanceof RangeValue));
                if (collection && plain) {
                    throw new ResolveException(ResolveException.Kind.TYPE_MISMATCH,
                        "cannot compare an array with a scalar", span,
                        List.of("use `in` to test whether a value is in an array or a range"));
                }
            }
            default -> {
            }
        }
    }
}

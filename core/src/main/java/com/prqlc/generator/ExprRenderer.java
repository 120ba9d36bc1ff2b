package com.prqlc.generator;

import com.prqlc.dialect.Dialect;
import com.prqlc.dialect.DialectHandler;
import com.prqlc.dialect.FunctionRegistry;
import com.prqlc.dialect.SqlFragment;
import com.prqlc.exception.GenerationException;
import com.prqlc.pl.Literal;
import com.prqlc.rq.ArrayExpr;
import com.prqlc.rq.CId;
import com.prqlc.rq.Case;
import com.prqlc.rq.ColumnRef;
import com.prqlc.rq.ColumnSort;
import com.prqlc.rq.Constant;
import com.prqlc.rq.Operator;
import com.prqlc.rq.RawSplice;
import com.prqlc.rq.RqExpr;
import com.prqlc.rq.Window;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Renders RQ expressions to SQL.
 *
 * <p>Column references are rendered by a caller-supplied function, which
 * either names the column or inlines the expression that computes it.
 * Parentheses are added only where operator precedence requires them.
 */
final class ExprRenderer {

    private final DialectHandler handler;
    private final Function<CId, SqlFragment> columns;

    ExprRenderer(DialectHandler handler, Function<CId, SqlFragment> columns) {
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
        this.columns = Objects.requireNonNull(columns, "columns must not be null");
    }

    /**
     * Renders an expression evaluated per row.
     */
    SqlFragment render(RqExpr expr) {
        return render(expr, null);
    }

    /**
     * Renders an expression whose aggregate and window functions are evaluated
     * over the given window.
     *
     * @param expr the expression
     * @param window the window, or null to render plain calls
     */
    SqlFragment render(RqExpr expr, Window window) {
        if (expr instanceof ColumnRef ref) {
            return columns.apply(ref.id());
        }
        if (expr instanceof Constant constant) {
            return SqlFragment.atomic(handler.literal(constant.literal()));
        }
        if (expr instanceof Operator operator) {
            return operator(operator, window);
        }
        if (expr instanceof RawSplice splice) {
            return raw(splice, window);
        }
        if (expr instanceof Case caseExpr) {
            return caseExpr(caseExpr, window);
        }
        if (expr instanceof ArrayExpr array) {
            String items = array.items().stream()
                .map(item -> render(item, window).sql())
                .collect(Collectors.joining(", "));
            return SqlFragment.atomic((handler.dialect() == Dialect.POSTGRES ? "ARRAY[" : "[") + items + "]");
        }
        throw new GenerationException("cannot render expression " + expr, expr.getClass().getSimpleName(),
            expr.span());
    }

    private SqlFragment operator(Operator operator, Window window) {
        List<SqlFragment> args = new ArrayList<>();
        for (RqExpr arg : operator.args()) {
            args.add(render(arg, window));
        }
        SqlFragment call = handler.function(operator.name(), args, operator.span());
        boolean windowed = FunctionRegistry.isAggregate(operator.name())
            || FunctionRegistry.isWindowFunction(operator.name());
        if (window != null && windowed) {
            return SqlFragment.atomic(call.sql() + " OVER (" + over(window) + ")");
        }
        return call;
    }

    private SqlFragment raw(RawSplice splice, Window window) {
        StringBuilder sb = new StringBuilder();
        for (RawSplice.Item item : splice.items()) {
            sb.append(item.isText() ? item.text() : render(item.expr(), window).sql());
        }
        String sql = sb.toString();
        // Raw SQL is opaque: parenthesize it as an operand unless it is a single term.
        return isSingleTerm(sql) ? SqlFragment.atomic(sql) : new SqlFragment(sql, 0);
    }

    private static boolean isSingleTerm(String sql) {
        int depth = 0;
        boolean quoted = false;
        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                depth++;
            } else if (!quoted && c == ')') {
                depth--;
            } else if (!quoted && depth == 0 && (Character.isWhitespace(c) || "+-*/%<>=|!".indexOf(c) >= 0)) {
                return false;
            }
        }
        return true;
    }

    private SqlFragment caseExpr(Case caseExpr, Window window) {
        StringBuilder sb = new StringBuilder("CASE");
        String otherwise = null;
        for (Case.Arm arm : caseExpr.arms()) {
            if (isTrue(arm.condition())) {
                otherwise = render(arm.value(), window).sql();
                break;
            }
            sb.append(" WHEN ").append(render(arm.condition(), window).sql())
                .append(" THEN ").append(render(arm.value(), window).sql());
        }
        if (otherwise != null) {
            sb.append(" ELSE ").append(otherwise);
        }
        return SqlFragment.atomic(sb.append(" END").toString());
    }

    private static boolean isTrue(RqExpr expr) {
        return expr instanceof Constant constant
            && constant.literal().kind() == Literal.Kind.BOOLEAN
            && constant.literal().asBoolean();
    }

    // ==================== Windows ====================

    /**
     * Renders the contents of an {@code OVER (...)} clause.
     */
    String over(Window window) {
        List<String> parts = new ArrayList<>();
        if (!window.partition().isEmpty()) {
            parts.add("PARTITION BY " + window.partition().stream()
                .map(id -> columns.apply(id).sql())
                .collect(Collectors.joining(", ")));
        }
        if (!window.sort().isEmpty()) {
            parts.add("ORDER BY " + orderBy(window.sort()));
        }
        if (window.hasFrame()) {
            parts.add(window.kind().name() + " BETWEEN " + bound(window.start(), "PRECEDING")
                + " AND " + bound(window.end(), "FOLLOWING"));
        }
        return String.join(" ", parts);
    }

    private static String bound(Long offset, String unbounded) {
        if (offset == null) {
            return "UNBOUNDED " + unbounded;
        }
        if (offset == 0) {
            return "CURRENT ROW";
        }
        return offset < 0 ? -offset + " PRECEDING" : offset + " FOLLOWING";
    }

    /**
     * Renders sort columns as a comma separated {@code ORDER BY} list.
     */
    String orderBy(List<ColumnSort> sort) {
        return sort.stream()
            .map(s -> columns.apply(s.column()).sql() + (s.descending() ? " DESC" : ""))
            .collect(Collectors.joining(", "));
    }
}

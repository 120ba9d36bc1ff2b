package com.prqlc.semantic;

import com.prqlc.pl.Expr;
import com.prqlc.pl.Span;
import com.prqlc.semantic.ir.Frame;
import com.prqlc.semantic.ir.ResolvedExpr;

/**
 * A function argument: either already resolved, or an expression captured with
 * the scope and frame it has to be resolved in.
 *
 * <p>Arguments stay unresolved until the function is applied with all of its
 * parameters, because transforms resolve their arguments in the frame of their
 * input relation rather than at the call site.
 */
public final class PendingArg {

    private final Expr expr;
    private final Scope scope;
    private final Frame frame;
    private final ResolvedExpr value;

    private PendingArg(Expr expr, Scope scope, Frame frame, ResolvedExpr value) {
        this.expr = expr;
        this.scope = scope;
        this.frame = frame;
        this.value = value;
    }

    public static PendingArg of(Expr expr, Scope scope, Frame frame) {
        return new PendingArg(expr, scope, frame, null);
    }

    public static PendingArg resolved(ResolvedExpr value) {
        return new PendingArg(null, null, null, value);
    }

    public boolean isResolved() {
        return value != null;
    }

    public Expr expr() {
        return expr;
    }

    public Scope scope() {
        return scope;
    }

    public Frame frame() {
        return frame;
    }

    public ResolvedExpr value() {
        return value;
    }

    public Span span() {
        return value != null ? value.span() : expr.span();
    }

    @Override
    public String toString() {
        return value != null ? value.toString() : expr.toString();
    }
}

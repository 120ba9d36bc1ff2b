package com.prqlc.pl;

import java.util.Objects;

/**
 * A binary operation, for example {@code salary * 1.1} or {@code a == b}.
 */
public final class BinaryExpr extends Expr {

    private final Expr left;
    private final BinOp op;
    private final Expr right;

    public BinaryExpr(Expr left, BinOp op, Expr right, Span span, String alias) {
        super(span, alias);
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.op = Objects.requireNonNull(op, "op must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public Expr left() {
        return left;
    }

    public BinOp op() {
        return op;
    }

    public Expr right() {
        return right;
    }

    @Override
    public BinaryExpr withAlias(String alias) {
        return new BinaryExpr(left, op, right, span, alias);
    }

    @Override
    public String toString() {
        return aliasPrefix() + "(" + left + " " + op.symbol() + " " + right + ")";
    }
}

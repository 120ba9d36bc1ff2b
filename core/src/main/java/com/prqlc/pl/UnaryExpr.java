package com.prqlc.pl;

import java.util.Objects;

public final class UnaryExpr extends Expr {

    private final UnOp op;
    private final Expr operand;

    public UnaryExpr(UnOp op, Expr operand, Span span, String alias) {
        super(span, alias);
        this.op = Objects.requireNonNull(op, "op must not be null");
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
    }

    public UnOp op() {
        return op;
    }

    public Expr operand() {
        return operand;
    }

    @Override
    public UnaryExpr withAlias(String alias) {
        return new UnaryExpr(op, operand, span, alias);
    }

    @Override
    public String toString() {
        return aliasPrefix() + op.symbol() + operand;
    }
}

package com.prqlc.pl;

/**
 * One segment of an s-string or f-string: either verbatim text or an embedded expression.
 */
public final class InterpolateItem {

    private final String text;
    private final Expr expr;

    private InterpolateItem(String text, Expr expr) {
        this.text = text;
        this.expr = expr;
    }

    public static InterpolateItem text(String text) {
        return new InterpolateItem(text, null);
    }

    public static InterpolateItem expr(Expr expr) {
        return new InterpolateItem(null, expr);
    }

    public boolean isText() {
        return expr == null;
    }

    public String text() {
        return text;
    }

    public Expr expr() {
        return expr;
    }

    @Override
    public String toString() {
        return isText() ? text : "{" + expr + "}";
    }
}

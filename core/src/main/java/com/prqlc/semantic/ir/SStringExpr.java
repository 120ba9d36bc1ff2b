package com.prqlc.semantic.ir;

import com.prqlc.pl.Span;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw SQL text with resolved expressions spliced in between.
 */
public final class SStringExpr extends ResolvedExpr {

    /**
     * Either a piece of SQL text or an embedded expression.
     */
    public record Item(String text, ResolvedExpr expr) {
        public static Item text(String text) {
            return new Item(text, null);
        }

        public static Item expr(ResolvedExpr expr) {
            return new Item(null, expr);
        }

        public boolean isText() {
            return expr == null;
        }
    }

    private final List<Item> items;

    public SStringExpr(List<Item> items, Span span) {
        super(span);
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public List<Item> items() {
        return items;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("s\"");
        for (Item item : items) {
            sb.append(item.isText() ? item.text() : "{" + item.expr() + "}");
        }
        return sb.append('"').toString();
    }
}

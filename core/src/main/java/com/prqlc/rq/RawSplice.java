package com.prqlc.rq;

import com.prqlc.pl.Span;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw SQL text with embedded expressions, rendered by pasting the SQL of each
 * expression between the text segments.
 */
public final class RawSplice extends RqExpr {

    /**
     * Either a text segment or an embedded expression.
     */
    public record Item(String text, RqExpr expr) {
        public static Item text(String text) {
            return new Item(text, null);
        }

        public static Item expr(RqExpr expr) {
            return new Item(null, expr);
        }

        public boolean isText() {
            return expr == null;
        }
    }

    private final List<Item> items;

    public RawSplice(List<Item> items, Span span) {
        super(span);
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public static RawSplice text(String text, Span span) {
        return new RawSplice(List.of(Item.text(text)), span);
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

package com.prqlc.pl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An interpolated string.
 *
 * <p>An {@code s"..."} string is spliced into SQL verbatim, with each embedded
 * expression rendered in place. An {@code f"..."} string is a concatenation of its
 * text segments and the values of its embedded expressions.
 */
public final class Interpolation extends Expr {

    /**
     * Interpolation flavours.
     */
    public enum Kind {
        S_STRING("s"),
        F_STRING("f");

        private final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }
    }

    private final Kind kind;
    private final List<InterpolateItem> items;

    public Interpolation(Kind kind, List<InterpolateItem> items, Span span, String alias) {
        super(span, alias);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public Kind kind() {
        return kind;
    }

    public List<InterpolateItem> items() {
        return items;
    }

    @Override
    public Interpolation withAlias(String alias) {
        return new Interpolation(kind, items, span, alias);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(aliasPrefix()).append(kind.prefix()).append('"');
        items.forEach(sb::append);
        return sb.append('"').toString();
    }
}

package com.prqlc.pl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A {@code case [cond => value, ...]} expression. Arms are tried in order.
 */
public final class Case extends Expr {

    /**
     * One {@code condition => value} arm.
     */
    public record Arm(Expr condition, Expr value) {
        public Arm {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    private final List<Arm> arms;

    public Case(List<Arm> arms, Span span, String alias) {
        super(span, alias);
        this.arms = Collections.unmodifiableList(new ArrayList<>(arms));
    }

    public List<Arm> arms() {
        return arms;
    }

    @Override
    public Case withAlias(String alias) {
        return new Case(arms, span, alias);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(aliasPrefix()).append("case [");
        for (int i = 0; i < arms.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(arms.get(i).condition()).append(" => ").append(arms.get(i).value());
        }
        return sb.append(']').toString();
    }
}

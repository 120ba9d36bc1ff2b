package com.prqlc.dialect;

import java.util.Objects;

/**
 * A piece of rendered SQL together with the binding strength of its outermost
 * operator, so that callers know when it needs parentheses.
 *
 * @param sql the SQL text
 * @param precedence the binding strength, higher binds tighter
 */
public record SqlFragment(String sql, int precedence) {

    public static final int OR = 1;
    public static final int AND = 2;
    public static final int NOT = 3;
    public static final int COMPARISON = 4;
    public static final int ADDITIVE = 5;
    public static final int MULTIPLICATIVE = 6;
    public static final int UNARY = 7;
    public static final int ATOMIC = 10;

    public SqlFragment {
        Objects.requireNonNull(sql, "sql must not be null");
    }

    public static SqlFragment atomic(String sql) {
        return new SqlFragment(sql, ATOMIC);
    }

    /**
     * Returns the SQL, in parentheses if it binds looser than {@code minPrecedence}.
     */
    public String wrap(int minPrecedence) {
        return precedence < minPrecedence ? "(" + sql + ")" : sql;
    }

    @Override
    public String toString() {
        return sql;
    }
}

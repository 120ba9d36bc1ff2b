package com.prqlc.pl;

/**
 * Unary operators.
 *
 * <p>{@link #EQ_SELF} is the join shorthand {@code ==col}, meaning
 * {@code this.col == that.col}.
 */
public enum UnOp {
    NEG("-"),
    PLUS("+"),
    NOT("!"),
    EQ_SELF("==");

    private final String symbol;

    UnOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static UnOp fromSymbol(String symbol) {
        for (UnOp op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown unary operator: " + symbol);
    }
}

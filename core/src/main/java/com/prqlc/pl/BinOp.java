package com.prqlc.pl;

/**
 * Binary operators, each desugared by the resolver into a call of a {@code std} function.
 */
public enum BinOp {
    MUL("*", "mul"),
    DIV_INT("//", "div_i"),
    DIV_FLOAT("/", "div_f"),
    MOD("%", "mod"),
    POW("**", "pow"),
    ADD("+", "add"),
    SUB("-", "sub"),
    EQ("==", "eq"),
    NE("!=", "ne"),
    GT(">", "gt"),
    LT("<", "lt"),
    GTE(">=", "gte"),
    LTE("<=", "lte"),
    REGEX_SEARCH("~=", "regex_search"),
    AND("&&", "and"),
    OR("||", "or"),
    COALESCE("??", "coalesce");

    private final String symbol;
    private final String stdName;

    BinOp(String symbol, String stdName) {
        this.symbol = symbol;
        this.stdName = stdName;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Returns the name of the {@code std} function implementing this operator.
     */
    public String stdName() {
        return stdName;
    }

    /**
     * Finds the operator for a source symbol.
     *
     * @throws IllegalArgumentException if the symbol is not a binary operator
     */
    public static BinOp fromSymbol(String symbol) {
        for (BinOp op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown binary operator: " + symbol);
    }
}

package com.prqlc.rq;

import com.prqlc.pl.Literal;
import java.util.Objects;

public final class Constant extends RqExpr {

    private final Literal literal;

    public Constant(Literal literal) {
        super(literal.span());
        this.literal = Objects.requireNonNull(literal, "literal must not be null");
    }

    public Literal literal() {
        return literal;
    }

    @Override
    public String toString() {
        return literal.toString();
    }
}

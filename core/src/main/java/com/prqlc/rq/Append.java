package com.prqlc.rq;

public final class Append extends SetOperation {

    public Append(Relation input, TableRef other) {
        super(input, other);
    }

    @Override
    public String kind() {
        return "Append";
    }
}

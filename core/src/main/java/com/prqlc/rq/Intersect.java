package com.prqlc.rq;

public final class Intersect extends SetOperation {

    public Intersect(Relation input, TableRef other) {
        super(input, other);
    }

    @Override
    public String kind() {
        return "Intersect";
    }
}

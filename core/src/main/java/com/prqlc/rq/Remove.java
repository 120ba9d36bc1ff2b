package com.prqlc.rq;

public final class Remove extends SetOperation {

    public Remove(Relation input, TableRef other) {
        super(input, other);
    }

    @Override
    public String kind() {
        return "Remove";
    }
}

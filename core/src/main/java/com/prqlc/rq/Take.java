package com.prqlc.rq;

/**
 * Skips {@code offset} rows and keeps at most {@code limit} of the remaining
 * ones. A null limit keeps all remaining rows.
 */
public final class Take extends Transform {

    private final long offset;
    private final Long limit;

    public Take(Relation input, long offset, Long limit) {
        super(input);
        if (offset < 0 || (limit != null && limit < 0)) {
            throw new IllegalArgumentException("Take bounds must not be negative");
        }
        this.offset = offset;
        this.limit = limit;
    }

    public long offset() {
        return offset;
    }

    public Long limit() {
        return limit;
    }

    @Override
    public String kind() {
        return "Take";
    }

    @Override
    public String toString() {
        return "Take(offset=" + offset + ", limit=" + limit + ", " + input() + ")";
    }
}

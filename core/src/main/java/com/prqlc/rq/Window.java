package com.prqlc.rq;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The window a computed column is evaluated over.
 *
 * @param kind ROWS or RANGE frame, or null for the default frame
 * @param start the frame start relative to the current row, null for unbounded
 * @param end the frame end relative to the current row, null for unbounded
 * @param partition the partition columns
 * @param sort the order within each partition
 */
public record Window(Kind kind, Long start, Long end, List<CId> partition, List<ColumnSort> sort) {

    public enum Kind {
        ROWS,
        RANGE
    }

    public Window {
        partition = Collections.unmodifiableList(new ArrayList<>(partition));
        sort = Collections.unmodifiableList(new ArrayList<>(sort));
    }

    public boolean hasFrame() {
        return kind != null;
    }
}

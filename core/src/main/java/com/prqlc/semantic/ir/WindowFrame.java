package com.prqlc.semantic.ir;

/**
 * Bounds of a window frame, relative to the current row. A null bound is
 * unbounded.
 */
public record WindowFrame(Kind kind, Long start, Long end) {

    public enum Kind {
        ROWS,
        RANGE
    }
}

package com.prqlc.exception;

import com.prqlc.pl.Span;

import java.util.List;

/**
 * Thrown when a resolved query has a shape that cannot be lowered, such as a set
 * operation over relations with different column counts.
 */
public class LowerException extends PrqlException {

    public static final String CODE = "E0200";

    public LowerException(String reason, Span span) {
        super(CODE, reason, span, List.of());
    }

    public LowerException(String reason, Span span, List<String> hints) {
        super(CODE, reason, span, hints);
    }
}

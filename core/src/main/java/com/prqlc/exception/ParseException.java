package com.prqlc.exception;

import com.prqlc.pl.Span;

import java.util.List;

/**
 * Thrown when source text cannot be parsed.
 */
public class ParseException extends PrqlException {

    public static final String UNEXPECTED_TOKEN = "E0001";
    public static final String UNTERMINATED = "E0002";
    public static final String INVALID_NUMBER = "E0003";
    public static final String UNKNOWN_STRING_PREFIX = "E0004";

    public ParseException(String code, String reason, Span span) {
        super(code, reason, span, List.of());
    }

    public ParseException(String code, String reason, Span span, List<String> hints) {
        super(code, reason, span, hints);
    }

    public ParseException(String reason, Span span) {
        this(UNEXPECTED_TOKEN, reason, span);
    }
}

package com.prqlc.exception;

import com.prqlc.pl.Span;

import java.util.List;

/**
 * Thrown when the query header requires a newer compiler than this one.
 */
public class UnsupportedVersionException extends PrqlException {

    public static final String CODE = "E0400";

    private final String required;
    private final String actual;

    public UnsupportedVersionException(String required, String actual, Span span) {
        super(CODE,
            String.format("This query requires compiler version %s, but this is version %s", required, actual),
            span,
            List.of("upgrade the compiler or relax the `version` in the query header"));
        this.required = required;
        this.actual = actual;
    }

    public String getRequired() {
        return required;
    }

    public String getActual() {
        return actual;
    }
}

package com.prqlc.exception;

import com.prqlc.pl.Span;

import java.util.List;

/**
 * Thrown when SQL generation fails, usually because the target dialect cannot
 * express a construct at all.
 *
 * <p>Carries the name of the relational operator or function that failed, for
 * debugging.
 *
 * @see com.prqlc.generator.SQLGenerator
 */
public class GenerationException extends PrqlException {

    public static final String CODE = "E0300";

    private final String failedConstruct;

    /**
     * Creates a SQL generation exception.
     *
     * @param message the error message
     * @param failedConstruct the operator or function being rendered, may be null
     * @param span the source range, may be null
     */
    public GenerationException(String message, String failedConstruct, Span span) {
        super(CODE, message, span, List.of());
        this.failedConstruct = failedConstruct;
    }

    /**
     * Creates a SQL generation exception with a cause.
     */
    public GenerationException(String message, Throwable cause, String failedConstruct) {
        super(CODE, message, null, List.of(), cause);
        this.failedConstruct = failedConstruct;
    }

    /**
     * Returns the operator or function that failed to render.
     *
     * @return the failed construct, or null if not available
     */
    public String getFailedConstruct() {
        return failedConstruct;
    }

    @Override
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder(super.getTechnicalMessage());
        if (failedConstruct != null) {
            sb.append("Failed Construct: ").append(failedConstruct).append("\n");
        }
        return sb.toString();
    }
}

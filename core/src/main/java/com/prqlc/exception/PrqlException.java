package com.prqlc.exception;

import com.prqlc.pl.Span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class of all errors caused by the compiled source.
 *
 * <p>Each stage throws a subclass of this exception for user-input problems. The
 * exception carries everything needed to build the structured {@link ErrorMessage}:
 * a machine-readable code, a human-readable reason, optional hints and the span of
 * the offending source text.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       String sql = Compiler.compile(source, options);
 *   } catch (PrqlException e) {
 *       ErrorMessages messages = ErrorMessages.from(e, source);
 *       System.err.println(messages);
 *   }
 * </pre>
 *
 * @see ErrorMessages
 */
public class PrqlException extends RuntimeException {

    private final String code;
    private final String reason;
    private final List<String> hints;
    private final Span span;

    /**
     * Creates an exception.
     *
     * @param code the error code, for example {@code E0100}
     * @param reason the human-readable reason
     * @param span the offending source range, or null if unknown
     * @param hints suggestions for the user
     */
    public PrqlException(String code, String reason, Span span, List<String> hints) {
        super(reason);
        this.code = code;
        this.reason = reason;
        this.span = span;
        this.hints = Collections.unmodifiableList(new ArrayList<>(hints));
    }

    /**
     * Creates an exception with a cause.
     */
    public PrqlException(String code, String reason, Span span, List<String> hints, Throwable cause) {
        super(reason, cause);
        this.code = code;
        this.reason = reason;
        this.span = span;
        this.hints = Collections.unmodifiableList(new ArrayList<>(hints));
    }

    public String getCode() {
        return code;
    }

    public String getReason() {
        return reason;
    }

    public List<String> getHints() {
        return hints;
    }

    /**
     * Returns the source range this error points at.
     *
     * @return the span, or null if the error has no location
     */
    public Span getSpan() {
        return span;
    }

    /**
     * Returns a user-friendly error message: the reason followed by any hints.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        StringBuilder sb = new StringBuilder(reason);
        for (String hint : hints) {
            sb.append("\n  Hint: ").append(hint);
        }
        return sb.toString();
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName()).append(" [").append(code).append("]\n");
        sb.append("Reason: ").append(reason).append("\n");
        if (span != null) {
            sb.append("Span: ").append(span).append("\n");
        }
        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }
        return sb.toString();
    }
}

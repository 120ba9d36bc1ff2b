package com.prqlc.exception;

import com.prqlc.pl.Span;

import java.util.List;

/**
 * Thrown when names, function calls or types cannot be resolved.
 *
 * <p>The {@link Kind} tells callers which resolution rule failed.
 */
public class ResolveException extends PrqlException {

    /**
     * Resolution failure kinds.
     */
    public enum Kind {
        UNKNOWN_NAME("E0100"),
        AMBIGUOUS_NAME("E0101"),
        ARITY_MISMATCH("E0102"),
        TYPE_MISMATCH("E0103"),
        CYCLIC_DECLARATION("E0104"),
        INVALID_ARGUMENT("E0105");

        private final String code;

        Kind(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }

    private final Kind kind;

    public ResolveException(Kind kind, String reason, Span span) {
        this(kind, reason, span, List.of());
    }

    public ResolveException(Kind kind, String reason, Span span, List<String> hints) {
        super(kind.code(), reason, span, hints);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    // ==================== Factory Methods ====================

    public static ResolveException unknownName(String name, Span span, List<String> hints) {
        return new ResolveException(Kind.UNKNOWN_NAME, "Unknown name `" + name + "`", span, hints);
    }

    public static ResolveException invalidArgument(String reason, Span span) {
        return new ResolveException(Kind.INVALID_ARGUMENT, reason, span);
    }
}

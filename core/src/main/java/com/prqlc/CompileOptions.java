package com.prqlc;

import com.prqlc.catalog.TableCatalog;

import java.util.Locale;
import java.util.Objects;

/**
 * Options of one compilation.
 *
 * <p>Options are immutable. Build them with {@link #builder()}, or start from
 * JVM system properties with {@link #fromSystemProperties()}:
 * <ul>
 *   <li>{@code prqlc.format}: {@code true} or {@code false}</li>
 *   <li>{@code prqlc.target}: a target such as {@code sql.postgres}</li>
 *   <li>{@code prqlc.signatureComment}: {@code true} or {@code false}</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   CompileOptions options = CompileOptions.builder()
 *       .target(Target.parse("sql.mssql"))
 *       .format(false)
 *       .build();
 * </pre>
 */
public final class CompileOptions {

    public static final String PROP_FORMAT = "prqlc.format";
    public static final String PROP_TARGET = "prqlc.target";
    public static final String PROP_SIGNATURE_COMMENT = "prqlc.signatureComment";

    private static final CompileOptions DEFAULTS = builder().build();

    private final boolean format;
    private final Target target;
    private final boolean signatureComment;
    private final TableCatalog catalog;

    private CompileOptions(Builder builder) {
        this.format = builder.format;
        this.target = builder.target;
        this.signatureComment = builder.signatureComment;
        this.catalog = builder.catalog;
    }

    /**
     * Returns the default options: formatted, generic target, with signature comment.
     */
    public static CompileOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the defaults overridden by any {@code prqlc.*} system properties.
     *
     * @throws IllegalArgumentException if a property has an invalid value
     */
    public static CompileOptions fromSystemProperties() {
        Builder builder = builder();
        String format = System.getProperty(PROP_FORMAT);
        if (format != null) {
            builder.format(parseBoolean(PROP_FORMAT, format));
        }
        String target = System.getProperty(PROP_TARGET);
        if (target != null) {
            builder.target(Target.parse(target));
        }
        String signature = System.getProperty(PROP_SIGNATURE_COMMENT);
        if (signature != null) {
            builder.signatureComment(parseBoolean(PROP_SIGNATURE_COMMENT, signature));
        }
        return builder.build();
    }

    private static boolean parseBoolean(String property, String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true" -> true;
            case "false" -> false;
            default -> throw new IllegalArgumentException(
                "Invalid value for " + property + ": " + value + ". Expected true or false");
        };
    }

    // ==================== Accessors ====================

    /**
     * Returns true if SQL is printed one clause per line.
     */
    public boolean format() {
        return format;
    }

    public Target target() {
        return target;
    }

    public boolean signatureComment() {
        return signatureComment;
    }

    /**
     * Returns whether error displays use terminal colors. Always false.
     */
    public boolean colorDisplay() {
        return false;
    }

    public TableCatalog catalog() {
        return catalog;
    }

    /**
     * Returns a builder initialized with these options.
     */
    public Builder toBuilder() {
        return new Builder()
            .format(format)
            .target(target)
            .signatureComment(signatureComment)
            .catalog(catalog);
    }

    @Override
    public String toString() {
        return "CompileOptions(format=" + format + ", target=" + target
            + ", signatureComment=" + signatureComment + ", catalog=" + catalog + ")";
    }

    public static final class Builder {
        private boolean format = true;
        private Target target = Target.GENERIC;
        private boolean signatureComment = true;
        private TableCatalog catalog = TableCatalog.empty();

        private Builder() {
        }

        public Builder format(boolean format) {
            this.format = format;
            return this;
        }

        public Builder target(Target target) {
            this.target = Objects.requireNonNull(target, "target must not be null");
            return this;
        }

        public Builder signatureComment(boolean signatureComment) {
            this.signatureComment = signatureComment;
            return this;
        }

        public Builder catalog(TableCatalog catalog) {
            this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
            return this;
        }

        public CompileOptions build() {
            return new CompileOptions(this);
        }
    }
}

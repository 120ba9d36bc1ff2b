package com.prqlc;

import com.prqlc.dialect.Dialect;

import java.util.Locale;
import java.util.Objects;

/**
 * A compilation target: the SQL dialect to generate.
 *
 * <p>Targets are written {@code sql.<dialect>} in query headers and options;
 * a bare dialect name is accepted as well. {@code sql.any} means the generic
 * dialect.
 *
 * @param dialect the dialect to generate
 */
public record Target(Dialect dialect) {

    private static final String PREFIX = "sql.";
    private static final String ANY = "any";

    public static final Target GENERIC = new Target(Dialect.GENERIC);

    public Target {
        Objects.requireNonNull(dialect, "dialect must not be null");
    }

    public static Target of(Dialect dialect) {
        return new Target(dialect);
    }

    /**
     * Parses a target name such as {@code sql.postgres}, {@code postgres} or {@code sql.any}.
     *
     * @param name the target name
     * @return the target
     * @throws IllegalArgumentException if the name is not a known target
     */
    public static Target parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Target must not be empty");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        String dialect = normalized.startsWith(PREFIX) ? normalized.substring(PREFIX.length()) : normalized;
        if (ANY.equals(dialect)) {
            return GENERIC;
        }
        try {
            return new Target(Dialect.parse(dialect));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown target: " + name + ". Valid targets: sql.any, sql."
                + String.join(", sql.", Dialect.names()), e);
        }
    }

    /**
     * Returns the target name as written in a query header.
     */
    public String name() {
        return PREFIX + dialect.dialectName();
    }

    @Override
    public String toString() {
        return name();
    }
}

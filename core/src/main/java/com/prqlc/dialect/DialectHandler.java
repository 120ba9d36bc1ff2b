package com.prqlc.dialect;

import com.prqlc.exception.GenerationException;
import com.prqlc.generator.SQLQuoting;
import com.prqlc.pl.Literal;
import com.prqlc.pl.Span;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Renders the dialect-dependent leaves of SQL: literals, identifiers and
 * builtin function calls.
 *
 * <p>Instances are immutable and may be shared between compilations.
 */
public final class DialectHandler {

    private static final Map<String, String> INTERVAL_UNITS = Map.of(
        "years", "YEAR",
        "months", "MONTH",
        "weeks", "WEEK",
        "days", "DAY",
        "hours", "HOUR",
        "minutes", "MINUTE",
        "seconds", "SECOND",
        "milliseconds", "MILLISECOND",
        "microseconds", "MICROSECOND");

    private final Dialect dialect;

    public DialectHandler(Dialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
    }

    public Dialect dialect() {
        return dialect;
    }

    /**
     * Renders a literal.
     *
     * @param literal the literal
     * @return the SQL text of the literal
     * @throws GenerationException if the literal has an unknown interval unit
     */
    public String literal(Literal literal) {
        return switch (literal.kind()) {
            case NULL -> "NULL";
            case BOOLEAN -> dialect == Dialect.MSSQL
                ? (literal.asBoolean() ? "1" : "0")
                : (literal.asBoolean() ? "TRUE" : "FALSE");
            case INTEGER, FLOAT -> literal.value();
            case STRING -> SQLQuoting.quoteLiteral(literal.value());
            case DATE -> typed("DATE", literal.value());
            case TIME -> typed("TIME", literal.value());
            case TIMESTAMP -> typed(dialect == Dialect.MSSQL ? "DATETIME2" : "TIMESTAMP",
                literal.value().replace('T', ' '));
            case VALUE_AND_UNIT -> interval(literal);
        };
    }

    private String typed(String type, String value) {
        if (dialect == Dialect.MSSQL) {
            return "CAST(" + SQLQuoting.quoteLiteral(value) + " AS " + type + ")";
        }
        return type + " " + SQLQuoting.quoteLiteral(value);
    }

    private String interval(Literal literal) {
        String unit = INTERVAL_UNITS.get(literal.unit().toLowerCase(Locale.ROOT));
        if (unit == null) {
            throw new GenerationException("unknown interval unit `" + literal.unit() + "`", "interval", literal.span());
        }
        if (dialect.requiresQuotedIntervals()) {
            return "INTERVAL '" + literal.value() + " " + unit + "'";
        }
        return "INTERVAL " + literal.value() + " " + unit;
    }

    /**
     * Renders a column or alias name, quoting it if needed.
     */
    public String identifier(String name) {
        return SQLQuoting.quoteIdentifierIfNeeded(name, dialect);
    }

    /**
     * Renders a possibly schema-qualified table name.
     */
    public String tableName(String name) {
        return SQLQuoting.quoteTableName(name, dialect);
    }

    /**
     * Renders a builtin function call.
     *
     * @see FunctionRegistry#translate(String, Dialect, List, Span)
     */
    public SqlFragment function(String name, List<SqlFragment> args, Span span) {
        return FunctionRegistry.translate(name, dialect, args, span);
    }
}

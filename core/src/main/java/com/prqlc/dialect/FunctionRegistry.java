package com.prqlc.dialect;

import com.prqlc.exception.GenerationException;
import com.prqlc.pl.Span;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Registry of the SQL renderings of builtin functions and operators.
 *
 * <p>Functions are identified by their standard library name, such as
 * {@code std.add} or {@code std.text.lower}. Lookup order:
 * <ol>
 *   <li>a rendering specific to the target dialect</li>
 *   <li>a direct mapping to a SQL function of the same arity</li>
 *   <li>a custom template shared by all dialects</li>
 *   <li>the uppercased last name segment called with all arguments</li>
 * </ol>
 *
 * <p>Function categories:
 * <ul>
 *   <li>Operators: arithmetic, comparison, logic, regex search</li>
 *   <li>Aggregate functions: min, max, sum, average, count, ...</li>
 *   <li>Window functions: lag, lead, rank, row_number, ...</li>
 *   <li>Math, text and date functions of the {@code std.math},
 *       {@code std.text} and {@code std.date} modules</li>
 * </ul>
 */
public final class FunctionRegistry {

    private static final Set<String> AGGREGATE_FUNCTIONS = Set.of(
        "std.min", "std.max", "std.sum", "std.average", "std.stddev", "std.all", "std.any",
        "std.concat_array", "std.count", "std.count_distinct");

    private static final Set<String> WINDOW_FUNCTIONS = Set.of(
        "std.lag", "std.lead", "std.first", "std.last", "std.rank", "std.rank_dense", "std.row_number");

    private static final Map<String, String> DIRECT_MAPPINGS = new HashMap<>();
    private static final Map<String, FunctionTemplate> CUSTOM_TRANSLATORS = new HashMap<>();
    private static final Map<Dialect, Map<String, FunctionTemplate>> DIALECT_TRANSLATORS = new EnumMap<>(Dialect.class);
    private static final Map<Dialect, Set<String>> UNSUPPORTED = new EnumMap<>(Dialect.class);

    static {
        initializeOperators();
        initializeAggregateFunctions();
        initializeWindowFunctions();
        initializeMathFunctions();
        initializeTextFunctions();
        initializeDateFunctions();
        initializeDialectOverrides();
    }

    private FunctionRegistry() {
    }

    /**
     * Renders a builtin function call.
     *
     * @param name the standard library name of the function
     * @param dialect the target dialect
     * @param args the rendered arguments
     * @param span the source range of the call, for errors
     * @return the rendered call
     * @throws GenerationException if the dialect cannot express the function
     */
    public static SqlFragment translate(String name, Dialect dialect, List<SqlFragment> args, Span span) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("name must not be null or empty");
        }
        if (!isSupported(name, dialect)) {
            throw new GenerationException(
                "operator " + name + " is not supported for dialect " + dialect.dialectName(), name, span);
        }

        FunctionTemplate specific = DIALECT_TRANSLATORS.getOrDefault(dialect, Map.of()).get(name);
        if (specific != null) {
            return render(specific, name, args, span);
        }

        String sqlFunction = DIRECT_MAPPINGS.get(name);
        if (sqlFunction != null) {
            return buildFunctionCall(sqlFunction, args);
        }

        FunctionTemplate template = CUSTOM_TRANSLATORS.get(name);
        if (template != null) {
            return render(template, name, args, span);
        }

        String last = name.substring(name.lastIndexOf('.') + 1);
        return buildFunctionCall(last.toUpperCase(), args);
    }

    /**
     * Checks if a function can be rendered for a dialect.
     *
     * @param name the standard library name of the function
     * @param dialect the target dialect
     * @return false if the dialect cannot express the function
     */
    public static boolean isSupported(String name, Dialect dialect) {
        return !UNSUPPORTED.getOrDefault(dialect, Set.of()).contains(name);
    }

    /**
     * Returns true for functions that reduce many rows to one value.
     */
    public static boolean isAggregate(String name) {
        return AGGREGATE_FUNCTIONS.contains(name);
    }

    /**
     * Returns true for functions that are only valid over a window.
     */
    public static boolean isWindowFunction(String name) {
        return WINDOW_FUNCTIONS.contains(name);
    }

    private static SqlFragment render(FunctionTemplate template, String name, List<SqlFragment> args, Span span) {
        try {
            return template.render(args);
        } catch (IllegalArgumentException e) {
            throw new GenerationException(e.getMessage(), name, span);
        }
    }

    private static SqlFragment buildFunctionCall(String function, List<SqlFragment> args) {
        return SqlFragment.atomic(function + "(" + joinArgs(args) + ")");
    }

    private static String joinArgs(List<SqlFragment> args) {
        return args.stream().map(SqlFragment::sql).collect(Collectors.joining(", "));
    }

    private static FunctionTemplate call(String function) {
        return args -> buildFunctionCall(function, args);
    }

    private static FunctionTemplate infix(String operator, int precedence) {
        return args -> new SqlFragment(
            args.get(0).wrap(precedence) + " " + operator + " " + args.get(1).wrap(precedence + 1), precedence);
    }

    private static void register(Dialect dialect, String name, FunctionTemplate template) {
        DIALECT_TRANSLATORS.computeIfAbsent(dialect, d -> new HashMap<>()).put(name, template);
    }

    private static void unsupported(Dialect dialect, String name) {
        UNSUPPORTED.computeIfAbsent(dialect, d -> new HashSet<>()).add(name);
    }

    /**
     * Returns the text of a rendered string literal.
     *
     * @throws IllegalArgumentException if the fragment is not a string literal
     */
    static String stringValue(SqlFragment fragment, String function) {
        String sql = fragment.sql();
        if (sql.length() < 2 || sql.charAt(0) != '\'' || sql.charAt(sql.length() - 1) != '\'') {
            throw new IllegalArgumentException(function + " expects a string literal, but found " + sql);
        }
        return sql.substring(1, sql.length() - 1).replace("''", "'");
    }

    private static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    // ==================== Operators ====================

    private static void initializeOperators() {
        CUSTOM_TRANSLATORS.put("std.mul", infix("*", SqlFragment.MULTIPLICATIVE));
        CUSTOM_TRANSLATORS.put("std.mod", infix("%", SqlFragment.MULTIPLICATIVE));
        CUSTOM_TRANSLATORS.put("std.add", infix("+", SqlFragment.ADDITIVE));
        CUSTOM_TRANSLATORS.put("std.sub", infix("-", SqlFragment.ADDITIVE));
        CUSTOM_TRANSLATORS.put("std.gt", infix(">", SqlFragment.COMPARISON));
        CUSTOM_TRANSLATORS.put("std.gte", infix(">=", SqlFragment.COMPARISON));
        CUSTOM_TRANSLATORS.put("std.lt", infix("<", SqlFragment.COMPARISON));
        CUSTOM_TRANSLATORS.put("std.lte", infix("<=", SqlFragment.COMPARISON));
        CUSTOM_TRANSLATORS.put("std.and", infix("AND", SqlFragment.AND));
        CUSTOM_TRANSLATORS.put("std.or", infix("OR", SqlFragment.OR));
        CUSTOM_TRANSLATORS.put("std.pow", call("POW"));
        DIRECT_MAPPINGS.put("std.coalesce", "COALESCE");

        // Comparisons with null need IS
        CUSTOM_TRANSLATORS.put("std.eq", args -> nullAware(args, "=", "IS NULL"));
        CUSTOM_TRANSLATORS.put("std.ne", args -> nullAware(args, "<>", "IS NOT NULL"));

        CUSTOM_TRANSLATORS.put("std.neg", args ->
            new SqlFragment("-" + args.get(0).wrap(SqlFragment.UNARY + 1), SqlFragment.UNARY));
        CUSTOM_TRANSLATORS.put("std.not", args ->
            new SqlFragment("NOT " + args.get(0).wrap(SqlFragment.NOT), SqlFragment.NOT));

        // Division: `/` keeps fractions, `//` truncates towards zero
        CUSTOM_TRANSLATORS.put("std.div_f", args -> SqlFragment.atomic(
            "(" + args.get(0).wrap(SqlFragment.MULTIPLICATIVE) + " * 1.0 / "
                + args.get(1).wrap(SqlFragment.MULTIPLICATIVE + 1) + ")"));
        CUSTOM_TRANSLATORS.put("std.div_i", args -> signed("FLOOR(ABS(" + division(args) + "))", args));

        CUSTOM_TRANSLATORS.put("std.regex_search", infix("REGEXP", SqlFragment.COMPARISON));

        CUSTOM_TRANSLATORS.put("std.between", args -> new SqlFragment(
            args.get(0).wrap(SqlFragment.COMPARISON + 1) + " BETWEEN " + args.get(1).wrap(SqlFragment.COMPARISON + 1)
                + " AND " + args.get(2).wrap(SqlFragment.COMPARISON + 1), SqlFragment.COMPARISON));
        CUSTOM_TRANSLATORS.put("std.in_list", args -> new SqlFragment(
            args.get(0).wrap(SqlFragment.COMPARISON + 1) + " IN ("
                + joinArgs(args.subList(1, args.size())) + ")", SqlFragment.COMPARISON));
        CUSTOM_TRANSLATORS.put("std.as", args ->
            SqlFragment.atomic("CAST(" + args.get(0).sql() + " AS " + args.get(1).sql() + ")"));
        CUSTOM_TRANSLATORS.put("std.concat", call("CONCAT"));
    }

    private static SqlFragment nullAware(List<SqlFragment> args, String operator, String nullTest) {
        SqlFragment left = args.get(0);
        SqlFragment right = args.get(1);
        if ("NULL".equals(right.sql())) {
            return new SqlFragment(left.wrap(SqlFragment.COMPARISON + 1) + " " + nullTest, SqlFragment.COMPARISON);
        }
        if ("NULL".equals(left.sql())) {
            return new SqlFragment(right.wrap(SqlFragment.COMPARISON + 1) + " " + nullTest, SqlFragment.COMPARISON);
        }
        return infix(operator, SqlFragment.COMPARISON).render(args);
    }

    private static String division(List<SqlFragment> args) {
        return args.get(0).wrap(SqlFragment.MULTIPLICATIVE) + " / " + args.get(1).wrap(SqlFragment.MULTIPLICATIVE + 1);
    }

    private static SqlFragment signed(String magnitude, List<SqlFragment> args) {
        return new SqlFragment(magnitude + " * SIGN(" + args.get(0).sql() + ") * SIGN(" + args.get(1).sql() + ")",
            SqlFragment.MULTIPLICATIVE);
    }

    // ==================== Aggregate Functions ====================

    private static void initializeAggregateFunctions() {
        DIRECT_MAPPINGS.put("std.min", "MIN");
        DIRECT_MAPPINGS.put("std.max", "MAX");
        DIRECT_MAPPINGS.put("std.sum", "SUM");
        DIRECT_MAPPINGS.put("std.average", "AVG");
        DIRECT_MAPPINGS.put("std.stddev", "STDDEV");
        DIRECT_MAPPINGS.put("std.all", "BOOL_AND");
        DIRECT_MAPPINGS.put("std.any", "BOOL_OR");
        DIRECT_MAPPINGS.put("std.concat_array", "ARRAY_AGG");

        CUSTOM_TRANSLATORS.put("std.count", args ->
            SqlFragment.atomic(args.isEmpty() ? "COUNT(*)" : "COUNT(" + joinArgs(args) + ")"));
        CUSTOM_TRANSLATORS.put("std.count_distinct", args ->
            SqlFragment.atomic("COUNT(DISTINCT " + joinArgs(args) + ")"));
    }

    // ==================== Window Functions ====================

    private static void initializeWindowFunctions() {
        DIRECT_MAPPINGS.put("std.first", "FIRST_VALUE");
        DIRECT_MAPPINGS.put("std.last", "LAST_VALUE");
        DIRECT_MAPPINGS.put("std.rank", "RANK");
        DIRECT_MAPPINGS.put("std.rank_dense", "DENSE_RANK");
        DIRECT_MAPPINGS.put("std.row_number", "ROW_NUMBER");

        // The offset comes first in the query language and second in SQL
        CUSTOM_TRANSLATORS.put("std.lag", args ->
            SqlFragment.atomic("LAG(" + args.get(1).sql() + ", " + args.get(0).sql() + ")"));
        CUSTOM_TRANSLATORS.put("std.lead", args ->
            SqlFragment.atomic("LEAD(" + args.get(1).sql() + ", " + args.get(0).sql() + ")"));
    }

    // ==================== Math Functions ====================

    private static void initializeMathFunctions() {
        DIRECT_MAPPINGS.put("std.math.abs", "ABS");
        DIRECT_MAPPINGS.put("std.math.floor", "FLOOR");
        DIRECT_MAPPINGS.put("std.math.ceil", "CEIL");
        DIRECT_MAPPINGS.put("std.math.pi", "PI");
        DIRECT_MAPPINGS.put("std.math.exp", "EXP");
        DIRECT_MAPPINGS.put("std.math.ln", "LN");
        DIRECT_MAPPINGS.put("std.math.log10", "LOG10");
        DIRECT_MAPPINGS.put("std.math.sqrt", "SQRT");
        DIRECT_MAPPINGS.put("std.math.degrees", "DEGREES");
        DIRECT_MAPPINGS.put("std.math.radians", "RADIANS");
        DIRECT_MAPPINGS.put("std.math.cos", "COS");
        DIRECT_MAPPINGS.put("std.math.acos", "ACOS");
        DIRECT_MAPPINGS.put("std.math.sin", "SIN");
        DIRECT_MAPPINGS.put("std.math.asin", "ASIN");
        DIRECT_MAPPINGS.put("std.math.tan", "TAN");
        DIRECT_MAPPINGS.put("std.math.atan", "ATAN");

        CUSTOM_TRANSLATORS.put("std.math.log", args -> new SqlFragment(
            "LOG10(" + args.get(1).sql() + ") / LOG10(" + args.get(0).sql() + ")", SqlFragment.MULTIPLICATIVE));
        CUSTOM_TRANSLATORS.put("std.math.pow", args ->
            SqlFragment.atomic("POW(" + args.get(1).sql() + ", " + args.get(0).sql() + ")"));
    }

    // ==================== Text Functions ====================

    private static void initializeTextFunctions() {
        DIRECT_MAPPINGS.put("std.text.lower", "LOWER");
        DIRECT_MAPPINGS.put("std.text.upper", "UPPER");
        DIRECT_MAPPINGS.put("std.text.ltrim", "LTRIM");
        DIRECT_MAPPINGS.put("std.text.rtrim", "RTRIM");
        DIRECT_MAPPINGS.put("std.text.trim", "TRIM");
        DIRECT_MAPPINGS.put("std.text.length", "CHAR_LENGTH");

        CUSTOM_TRANSLATORS.put("std.text.extract", args -> SqlFragment.atomic(
            "SUBSTRING(" + args.get(2).sql() + ", " + args.get(0).sql() + ", " + args.get(1).sql() + ")"));
        CUSTOM_TRANSLATORS.put("std.text.replace", args -> SqlFragment.atomic(
            "REPLACE(" + args.get(2).sql() + ", " + args.get(0).sql() + ", " + args.get(1).sql() + ")"));
        CUSTOM_TRANSLATORS.put("std.text.starts_with", args ->
            like(args.get(1), "CONCAT(" + args.get(0).sql() + ", '%')"));
        CUSTOM_TRANSLATORS.put("std.text.contains", args ->
            like(args.get(1), "CONCAT('%', " + args.get(0).sql() + ", '%')"));
        CUSTOM_TRANSLATORS.put("std.text.ends_with", args ->
            like(args.get(1), "CONCAT('%', " + args.get(0).sql() + ")"));
    }

    private static SqlFragment like(SqlFragment column, String pattern) {
        return new SqlFragment(column.wrap(SqlFragment.COMPARISON + 1) + " LIKE " + pattern, SqlFragment.COMPARISON);
    }

    // ==================== Date Functions ====================

    private static void initializeDateFunctions() {
        for (Dialect dialect : Dialect.values()) {
            DateFormats.Style style = DateFormats.styleOf(dialect);
            if (style == null) {
                unsupported(dialect, "std.date.to_text");
                continue;
            }
            register(dialect, "std.date.to_text", args -> {
                String format = quote(DateFormats.translate(stringValue(args.get(0), "date.to_text"), style));
                String column = args.get(1).sql();
                return SqlFragment.atomic(switch (dialect) {
                    case MSSQL -> "FORMAT(" + column + ", " + format + ")";
                    case MYSQL -> "DATE_FORMAT(" + column + ", " + format + ")";
                    case CLICKHOUSE -> "formatDateTime(" + column + ", " + format + ")";
                    case DUCKDB -> "strftime(" + column + ", " + format + ")";
                    case SQLITE -> "strftime(" + format + ", " + column + ")";
                    case BIGQUERY -> "FORMAT_TIMESTAMP(" + format + ", " + column + ")";
                    case HIVE -> "date_format(" + column + ", " + format + ")";
                    default -> "TO_CHAR(" + column + ", " + format + ")";
                });
            });
        }
    }

    // ==================== Dialect Overrides ====================

    private static void initializeDialectOverrides() {
        // Integer division
        register(Dialect.DUCKDB, "std.div_i", args -> SqlFragment.atomic(
            "TRUNC(" + args.get(0).wrap(SqlFragment.MULTIPLICATIVE) + " // "
                + args.get(1).wrap(SqlFragment.MULTIPLICATIVE + 1) + ")"));
        register(Dialect.POSTGRES, "std.div_i", args -> SqlFragment.atomic("TRUNC(" + division(args) + ")"));
        register(Dialect.MYSQL, "std.div_i", infix("DIV", SqlFragment.MULTIPLICATIVE));
        register(Dialect.CLICKHOUSE, "std.div_i", infix("DIV", SqlFragment.MULTIPLICATIVE));
        register(Dialect.SQLITE, "std.div_i", args -> signed("ROUND(ABS(" + division(args) + ") - 0.5)", args));
        register(Dialect.MSSQL, "std.div_i", args -> signed("ROUND(ABS(" + division(args) + "), 0, 1)", args));
        register(Dialect.BIGQUERY, "std.div_i", call("DIV"));

        // Float division where `/` already keeps fractions
        for (Dialect dialect : List.of(Dialect.DUCKDB, Dialect.MYSQL, Dialect.BIGQUERY, Dialect.CLICKHOUSE,
                                       Dialect.SNOWFLAKE)) {
            register(dialect, "std.div_f", infix("/", SqlFragment.MULTIPLICATIVE));
        }

        register(Dialect.BIGQUERY, "std.mod", call("MOD"));
        register(Dialect.SNOWFLAKE, "std.mod", call("MOD"));
        register(Dialect.MSSQL, "std.pow", call("POWER"));
        register(Dialect.MSSQL, "std.math.pow", args ->
            SqlFragment.atomic("POWER(" + args.get(1).sql() + ", " + args.get(0).sql() + ")"));

        // Regular expressions
        register(Dialect.POSTGRES, "std.regex_search", infix("~", SqlFragment.COMPARISON));
        register(Dialect.DUCKDB, "std.regex_search", call("REGEXP_MATCHES"));
        register(Dialect.BIGQUERY, "std.regex_search", call("REGEXP_CONTAINS"));
        register(Dialect.MYSQL, "std.regex_search", call("REGEXP_LIKE"));
        register(Dialect.SNOWFLAKE, "std.regex_search", call("REGEXP_LIKE"));
        register(Dialect.CLICKHOUSE, "std.regex_search", call("match"));
        register(Dialect.HIVE, "std.regex_search", infix("RLIKE", SqlFragment.COMPARISON));
        unsupported(Dialect.MSSQL, "std.regex_search");

        // Strings
        FunctionTemplate pipes = args -> new SqlFragment(args.stream()
            .map(arg -> arg.wrap(SqlFragment.ADDITIVE + 1))
            .collect(Collectors.joining(" || ")), SqlFragment.ADDITIVE);
        register(Dialect.SQLITE, "std.concat", pipes);
        register(Dialect.SQLITE, "std.text.length", call("LENGTH"));
        register(Dialect.MSSQL, "std.text.length", call("LEN"));
        register(Dialect.SQLITE, "std.text.extract", args -> SqlFragment.atomic(
            "SUBSTR(" + args.get(2).sql() + ", " + args.get(0).sql() + ", " + args.get(1).sql() + ")"));
        register(Dialect.SQLITE, "std.text.starts_with", args ->
            like(args.get(1), args.get(0).wrap(SqlFragment.ADDITIVE + 1) + " || '%'"));
        register(Dialect.SQLITE, "std.text.contains", args ->
            like(args.get(1), "'%' || " + args.get(0).wrap(SqlFragment.ADDITIVE + 1) + " || '%'"));
        register(Dialect.SQLITE, "std.text.ends_with", args ->
            like(args.get(1), "'%' || " + args.get(0).wrap(SqlFragment.ADDITIVE + 1)));

        // Aggregates
        register(Dialect.MSSQL, "std.stddev", call("STDEV"));
        register(Dialect.SQLITE, "std.concat_array", call("GROUP_CONCAT"));
        register(Dialect.MYSQL, "std.concat_array", call("JSON_ARRAYAGG"));
    }
}

package com.prqlc.dialect;

import com.prqlc.exception.GenerationException;
import com.prqlc.test.TestBase;
import com.prqlc.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FunctionRegistry}: operator precedence, null-aware
 * comparisons and per-dialect renderings.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Function Registry Tests")
public class FunctionRegistryTest extends TestBase {

    private static SqlFragment col(String name) {
        return SqlFragment.atomic(name);
    }

    private static String render(String function, Dialect dialect, SqlFragment... args) {
        return FunctionRegistry.translate(function, dialect, List.of(args), null).sql();
    }

    @Nested
    @DisplayName("Operators")
    class Operators {

        @Test
        @DisplayName("TC-FUNC-001: Addition renders infix")
        void testAddition() {
            SqlFragment sql = FunctionRegistry.translate("std.add", Dialect.GENERIC, List.of(col("a"), col("b")), null);

            assertThat(sql.sql()).isEqualTo("a + b");
            assertThat(sql.precedence()).isEqualTo(SqlFragment.ADDITIVE);
        }

        @Test
        @DisplayName("TC-FUNC-002: Lower precedence operands are parenthesized")
        void testPrecedence() {
            SqlFragment sum = new SqlFragment("a + b", SqlFragment.ADDITIVE);

            assertThat(render("std.mul", Dialect.GENERIC, sum, col("c"))).isEqualTo("(a + b) * c");
            assertThat(render("std.add", Dialect.GENERIC, sum, col("c"))).isEqualTo("a + b + c");
        }

        @Test
        @DisplayName("TC-FUNC-003: Right operand of equal precedence is parenthesized")
        void testRightAssociativity() {
            SqlFragment difference = new SqlFragment("b - c", SqlFragment.ADDITIVE);

            assertThat(render("std.sub", Dialect.GENERIC, col("a"), difference)).isEqualTo("a - (b - c)");
        }

        @Test
        @DisplayName("TC-FUNC-004: Comparison with null becomes IS NULL")
        void testNullComparison() {
            assertThat(render("std.eq", Dialect.GENERIC, col("a"), col("NULL"))).isEqualTo("a IS NULL");
            assertThat(render("std.eq", Dialect.GENERIC, col("NULL"), col("a"))).isEqualTo("a IS NULL");
            assertThat(render("std.ne", Dialect.GENERIC, col("a"), col("NULL"))).isEqualTo("a IS NOT NULL");
            assertThat(render("std.ne", Dialect.GENERIC, col("a"), col("b"))).isEqualTo("a <> b");
        }

        @Test
        @DisplayName("TC-FUNC-005: Unary operators")
        void testUnary() {
            assertThat(render("std.neg", Dialect.GENERIC, col("x"))).isEqualTo("-x");
            assertThat(render("std.not", Dialect.GENERIC, col("x"))).isEqualTo("NOT x");
        }

        @Test
        @DisplayName("TC-FUNC-006: IN list and BETWEEN")
        void testInAndBetween() {
            assertThat(render("std.in_list", Dialect.GENERIC, col("a"), col("1"), col("2"))).isEqualTo("a IN (1, 2)");
            assertThat(render("std.between", Dialect.GENERIC, col("a"), col("1"), col("5")))
                .isEqualTo("a BETWEEN 1 AND 5");
        }

        @Test
        @DisplayName("TC-FUNC-007: Cast")
        void testCast() {
            assertThat(render("std.as", Dialect.GENERIC, col("a"), col("int"))).isEqualTo("CAST(a AS int)");
        }
    }

    @Nested
    @DisplayName("Division")
    class Division {

        @Test
        @DisplayName("TC-FUNC-010: Float division forces a fractional result")
        void testFloatDivision() {
            assertThat(render("std.div_f", Dialect.GENERIC, col("a"), col("b"))).isEqualTo("(a * 1.0 / b)");
            assertThat(render("std.div_f", Dialect.DUCKDB, col("a"), col("b"))).isEqualTo("a / b");
        }

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = '|', value = {
            "GENERIC    | FLOOR(ABS(a / b)) * SIGN(a) * SIGN(b)",
            "POSTGRES   | TRUNC(a / b)",
            "DUCKDB     | TRUNC(a // b)",
            "MYSQL      | a DIV b",
            "CLICKHOUSE | a DIV b",
            "BIGQUERY   | DIV(a, b)",
            "SQLITE     | ROUND(ABS(a / b) - 0.5) * SIGN(a) * SIGN(b)",
            "MSSQL      | ROUND(ABS(a / b), 0, 1) * SIGN(a) * SIGN(b)"
        })
        @DisplayName("TC-FUNC-011: Integer division truncates towards zero in every dialect")
        void testIntegerDivision(Dialect dialect, String expected) {
            assertThat(render("std.div_i", dialect, col("a"), col("b"))).isEqualTo(expected);
        }

        @Test
        @DisplayName("TC-FUNC-012: Modulo uses MOD where % is missing")
        void testModulo() {
            assertThat(render("std.mod", Dialect.GENERIC, col("a"), col("b"))).isEqualTo("a % b");
            assertThat(render("std.mod", Dialect.BIGQUERY, col("a"), col("b"))).isEqualTo("MOD(a, b)");
        }
    }

    @Nested
    @DisplayName("Regular Expressions")
    class RegularExpressions {

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = '|', value = {
            "GENERIC  | a REGEXP 'x'",
            "POSTGRES | a ~ 'x'",
            "DUCKDB   | REGEXP_MATCHES(a, 'x')",
            "BIGQUERY | REGEXP_CONTAINS(a, 'x')",
            "MYSQL    | REGEXP_LIKE(a, 'x')",
            "HIVE     | a RLIKE 'x'"
        })
        @DisplayName("TC-FUNC-020: Regex search per dialect")
        void testRegexSearch(Dialect dialect, String expected) {
            assertThat(render("std.regex_search", dialect, col("a"), col("'x'"))).isEqualTo(expected);
        }

        @Test
        @DisplayName("TC-FUNC-021: MSSQL has no regex search")
        void testRegexUnsupported() {
            assertThat(FunctionRegistry.isSupported("std.regex_search", Dialect.MSSQL)).isFalse();
            assertThatThrownBy(() -> render("std.regex_search", Dialect.MSSQL, col("a"), col("'x'")))
                .isInstanceOf(GenerationException.class)
                .hasMessage("operator std.regex_search is not supported for dialect mssql");
        }
    }

    @Nested
    @DisplayName("Aggregate and Window Functions")
    class AggregateAndWindow {

        @Test
        @DisplayName("TC-FUNC-030: Count with and without argument")
        void testCount() {
            assertThat(render("std.count", Dialect.GENERIC)).isEqualTo("COUNT(*)");
            assertThat(render("std.count", Dialect.GENERIC, col("a"))).isEqualTo("COUNT(a)");
            assertThat(render("std.count_distinct", Dialect.GENERIC, col("a"))).isEqualTo("COUNT(DISTINCT a)");
        }

        @Test
        @DisplayName("TC-FUNC-031: Aggregates map to SQL names")
        void testAggregates() {
            assertThat(render("std.average", Dialect.GENERIC, col("a"))).isEqualTo("AVG(a)");
            assertThat(render("std.stddev", Dialect.MSSQL, col("a"))).isEqualTo("STDEV(a)");
            assertThat(render("std.concat_array", Dialect.SQLITE, col("a"))).isEqualTo("GROUP_CONCAT(a)");
        }

        @Test
        @DisplayName("TC-FUNC-032: Lag and lead move the offset after the column")
        void testLagLead() {
            assertThat(render("std.lag", Dialect.GENERIC, col("1"), col("x"))).isEqualTo("LAG(x, 1)");
            assertThat(render("std.lead", Dialect.GENERIC, col("2"), col("x"))).isEqualTo("LEAD(x, 2)");
        }

        @Test
        @DisplayName("TC-FUNC-033: Function classification")
        void testClassification() {
            assertThat(FunctionRegistry.isAggregate("std.sum")).isTrue();
            assertThat(FunctionRegistry.isAggregate("std.add")).isFalse();
            assertThat(FunctionRegistry.isWindowFunction("std.rank")).isTrue();
            assertThat(FunctionRegistry.isWindowFunction("std.sum")).isFalse();
        }
    }

    @Nested
    @DisplayName("Math, Text and Date Functions")
    class Modules {

        @Test
        @DisplayName("TC-FUNC-040: Logarithm with base")
        void testLog() {
            assertThat(render("std.math.log", Dialect.GENERIC, col("2"), col("x"))).isEqualTo("LOG10(x) / LOG10(2)");
        }

        @Test
        @DisplayName("TC-FUNC-041: Text length per dialect")
        void testLength() {
            assertThat(render("std.text.length", Dialect.GENERIC, col("s"))).isEqualTo("CHAR_LENGTH(s)");
            assertThat(render("std.text.length", Dialect.SQLITE, col("s"))).isEqualTo("LENGTH(s)");
            assertThat(render("std.text.length", Dialect.MSSQL, col("s"))).isEqualTo("LEN(s)");
        }

        @Test
        @DisplayName("TC-FUNC-042: Contains becomes LIKE")
        void testContains() {
            assertThat(render("std.text.contains", Dialect.GENERIC, col("'x'"), col("name")))
                .isEqualTo("name LIKE CONCAT('%', 'x', '%')");
            assertThat(render("std.text.contains", Dialect.SQLITE, col("'x'"), col("name")))
                .isEqualTo("name LIKE '%' || 'x' || '%'");
        }

        @Test
        @DisplayName("TC-FUNC-043: Concatenation without CONCAT uses pipes")
        void testConcat() {
            assertThat(render("std.concat", Dialect.GENERIC, col("a"), col("b"))).isEqualTo("CONCAT(a, b)");
            assertThat(render("std.concat", Dialect.SQLITE, col("a"), col("b"))).isEqualTo("a || b");
        }

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = '|', value = {
            "POSTGRES | TO_CHAR(d, 'YYYY-MM-DD')",
            "MSSQL    | FORMAT(d, 'yyyy-MM-dd')",
            "MYSQL    | DATE_FORMAT(d, '%Y-%m-%d')",
            "DUCKDB   | strftime(d, '%Y-%m-%d')",
            "SQLITE   | strftime('%Y-%m-%d', d)"
        })
        @DisplayName("TC-FUNC-044: Date formatting translates the format")
        void testDateToText(Dialect dialect, String expected) {
            assertThat(render("std.date.to_text", dialect, col("'%Y-%m-%d'"), col("d"))).isEqualTo(expected);
        }

        @Test
        @DisplayName("TC-FUNC-045: Date format must be a string literal")
        void testDateFormatNotLiteral() {
            assertThatThrownBy(() -> render("std.date.to_text", Dialect.POSTGRES, col("fmt"), col("d")))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("expects a string literal");
        }

        @Test
        @DisplayName("TC-FUNC-046: Unknown functions fall back to their uppercased name")
        void testFallback() {
            assertThat(render("std.foo.bar", Dialect.GENERIC, col("x"))).isEqualTo("BAR(x)");
        }
    }
}

package com.prqlc;

import com.prqlc.catalog.TableCatalog;
import com.prqlc.catalog.TableSchema;
import com.prqlc.dialect.Dialect;
import com.prqlc.exception.ErrorMessage;
import com.prqlc.exception.ParseException;
import com.prqlc.exception.ResolveException;
import com.prqlc.exception.UnsupportedVersionException;
import com.prqlc.test.TestBase;
import com.prqlc.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link Compiler}: PRQL source in, SQL or errors out.
 */
@TestCategories.Tier1
@TestCategories.Integration
@DisplayName("Compiler Tests")
public class CompilerTest extends TestBase {

    private static final TableCatalog EMPLOYEES = TableCatalog.of(
        TableSchema.of("employees", "name", "salary", "has_dog"));

    private static final TableCatalog NUMBERS = TableCatalog.of(
        TableSchema.of("nums", "n"), TableSchema.of("pairs", "a", "b"));

    @Nested
    @DisplayName("Pipelines")
    class Pipelines {

        @Test
        @DisplayName("TC-COMP-001: Filter and select compile to one SELECT")
        void testFilterSelect() {
            String sql = compile("from employees | filter has_dog | select salary");

            assertThat(sql).isEqualTo("SELECT salary FROM employees WHERE has_dog");
        }

        @Test
        @DisplayName("TC-COMP-002: Take renders per dialect")
        void testTakePerDialect() {
            String prql = "from employees | take 10";

            assertThat(compile(prql, Dialect.MSSQL)).isEqualTo("SELECT TOP (10) * FROM employees");
            assertThat(compile(prql, Dialect.GENERIC)).isEqualTo("SELECT * FROM employees LIMIT 10");
            assertThat(compile(prql, Dialect.POSTGRES)).isEqualTo("SELECT * FROM employees LIMIT 10");
        }

        @Test
        @DisplayName("TC-COMP-003: Filter directly after an aggregate folds into HAVING")
        void testHaving() {
            String sql = compile("from t | group g (aggregate {n = count}) | filter n > 3");

            assertThat(sql).isEqualTo("SELECT g, COUNT(*) AS n FROM t GROUP BY g HAVING COUNT(*) > 3");
        }

        @Test
        @DisplayName("TC-COMP-004: Known table columns are selected by name")
        void testCatalogColumns() {
            String sql = compileWithCatalog("from employees | select {name}", EMPLOYEES);

            assertThat(sql).isEqualTo("SELECT name FROM employees");
        }

        @Test
        @DisplayName("TC-COMP-005: Derived columns are computed in the projection")
        void testDerive() {
            String sql = compile("from employees | derive {gross = salary + 1} | select {name, gross}");

            assertThat(sql).isEqualTo("SELECT name, salary + 1 AS gross FROM employees");
        }

        @Test
        @DisplayName("TC-COMP-006: Descending sort and take")
        void testSortTake() {
            String sql = compile("from employees | sort {-salary} | take 5");

            assertThat(sql).isEqualTo("SELECT * FROM employees ORDER BY salary DESC LIMIT 5");
        }

        @Test
        @DisplayName("TC-COMP-007: Filter after take needs a CTE")
        void testFilterAfterTake() {
            String sql = compile("from t | take 10 | filter a > 5");

            assertThat(sql).startsWith("WITH table_0 AS (");
            assertThat(sql).endsWith("WHERE a > 5");
        }

        @Test
        @DisplayName("TC-COMP-008: Join of aliased tables")
        void testJoin() {
            String sql = compile("from e = employees | join d = departments (==dept_id)");

            logData("SQL", sql);
            assertThat(sql).contains("FROM employees AS e JOIN departments AS d ON ");
        }
    }

    @Nested
    @DisplayName("Query Splitting")
    class QuerySplitting {

        @Test
        @DisplayName("TC-COMP-040: Filter on a window function needs a CTE")
        void testFilterOnWindow() {
            String sql = compile("from employees | derive {rn = row_number id} | filter rn > 2");

            assertThat(sql).isEqualTo("WITH table_0 AS (SELECT *, ROW_NUMBER() OVER () AS rn FROM employees) "
                + "SELECT * FROM table_0 WHERE rn > 2");
        }

        @Test
        @DisplayName("TC-COMP-041: Aggregate over a window function needs a CTE")
        void testAggregateOverWindow() {
            String sql = compile("from employees | derive {rn = row_number id} | aggregate {m = max rn}");

            assertThat(sql).isEqualTo("WITH table_0 AS (SELECT *, ROW_NUMBER() OVER () AS rn FROM employees) "
                + "SELECT MAX(rn) AS m FROM table_0");
        }

        @Test
        @DisplayName("TC-COMP-042: Filter on a column computed by raw SQL needs a CTE")
        void testFilterOnRawColumn() {
            String sql = compile("from report | derive {r = s\"RANK() OVER ()\"} | filter r == 1");

            assertThat(sql).isEqualTo("WITH table_0 AS (SELECT *, RANK() OVER () AS r FROM report) "
                + "SELECT * FROM table_0 WHERE r = 1");
        }

        @Test
        @DisplayName("TC-COMP-043: Standard functions are not taken for columns of an unknown table")
        void testStandardFunctionOverWildcard() {
            assertThat(compile("from t | aggregate {n = count}")).isEqualTo("SELECT COUNT(*) AS n FROM t");
            assertThat(compile("from t | derive {d = date}")).isEqualTo("SELECT *, date AS d FROM t");
        }

        @Test
        @DisplayName("TC-COMP-044: Sort inside a group orders the partitioned window")
        void testGroupWindow() {
            String sql = compile("from employees | group department (sort salary | derive {rn = row_number salary})");

            assertThat(sql).isEqualTo(
                "SELECT *, ROW_NUMBER() OVER (PARTITION BY department ORDER BY salary) AS rn FROM employees");
        }

        @Test
        @DisplayName("TC-COMP-045: Window frame and sort reach the aggregate")
        void testWindowFrame() {
            String sql = compile("from employees | window rows:-1..1 (sort day | derive {s = sum salary})");

            assertThat(sql).isEqualTo(
                "SELECT *, SUM(salary) OVER (ORDER BY day ROWS BETWEEN 1 PRECEDING AND 1 FOLLOWING) AS s FROM employees");
        }

        @Test
        @DisplayName("TC-COMP-046: Group aggregate puts the keys first")
        void testGroupAggregate() {
            String sql = compile("from employees | group {department} (aggregate {total = sum salary})");

            assertThat(sql).isEqualTo("SELECT department, SUM(salary) AS total FROM employees GROUP BY department");
        }

        @Test
        @DisplayName("TC-COMP-047: Compiling the same source twice gives the same SQL")
        void testDeterministic() {
            String prql = "from e = employees | join d = departments (==dept_id) | derive {rn = row_number e.id}"
                + " | filter rn <= 3 | sort {-e.salary} | take 10";

            String first = compile(prql, Dialect.POSTGRES);
            String second = compile(prql, Dialect.POSTGRES);

            assertThat(second).isEqualTo(first);
        }
    }

    @Nested
    @DisplayName("Ranges and Negative Numbers")
    class RangesAndNegatives {

        @Test
        @DisplayName("TC-COMP-050: Take of a range open at the start")
        void testTakeOpenStart() {
            assertThat(compile("from employees | take ..10")).isEqualTo("SELECT * FROM employees LIMIT 10");
        }

        @Test
        @DisplayName("TC-COMP-051: Membership in a range open at the start")
        void testInOpenRange() {
            String sql = compile("from employees | filter (age | in ..5)");

            assertThat(sql).isEqualTo("SELECT * FROM employees WHERE age <= 5");
        }

        @Test
        @DisplayName("TC-COMP-052: Take of a negative number is a call with a negative bound")
        void testTakeNegative() {
            assertThatThrownBy(() -> compile("from employees | take -3"))
                .isInstanceOf(ResolveException.class)
                .hasMessageContaining("`take` bounds must be positive");
        }
    }

    @Nested
    @DisplayName("Distinct and Loop")
    class DistinctAndLoop {

        @Test
        @DisplayName("TC-COMP-060: First row of each group of the selected columns is a distinct select")
        void testDistinct() {
            assertThat(compile("from employees | select first_name | group first_name (take 1)"))
                .isEqualTo("SELECT DISTINCT first_name FROM employees");
            assertThat(compile("from employees | select {first_name, last_name} | group {last_name, first_name} (take 1)"))
                .isEqualTo("SELECT DISTINCT first_name, last_name FROM employees");
        }

        @Test
        @DisplayName("TC-COMP-061: Group over some of the columns keeps numbering rows")
        void testDistinctOnSomeColumns() {
            String sql = compile("from employees | group {first_name, last_name} (take 1)");

            assertThat(sql).doesNotContain("DISTINCT");
            assertThat(sql).contains("ROW_NUMBER() OVER (PARTITION BY first_name, last_name)");
        }

        @Test
        @DisplayName("TC-COMP-062: Loop over a table is a recursive CTE")
        void testLoop() {
            String prql = "from nums | loop (select {n = n + 1} | filter n < 5)";
            CompileOptions mssql = options(Dialect.MSSQL).toBuilder().catalog(NUMBERS).build();

            assertThat(compileWithCatalog(prql, NUMBERS)).isEqualTo("WITH RECURSIVE table_0 AS (SELECT n FROM nums "
                + "UNION ALL SELECT n + 1 AS n FROM table_0 WHERE n + 1 < 5) SELECT n FROM table_0");
            assertThat(compile(prql, mssql)).startsWith("WITH table_0 AS (SELECT n FROM nums UNION ALL ");
        }

        @Test
        @DisplayName("TC-COMP-063: Loop over inline rows continues the pipeline after the loop")
        void testLoopOverRows() {
            String sql = compile("from [{n = 1}] | select n = n - 2 | loop (select n = n + 1 | filter n < 5)"
                + " | select n = n * 2 | take 4");

            assertThat(sql).isEqualTo("WITH RECURSIVE table_0 AS (SELECT 1 AS n), "
                + "table_1 AS (SELECT n - 2 AS n FROM table_0 UNION ALL SELECT n + 1 AS n FROM table_1 WHERE n + 1 < 5) "
                + "SELECT n * 2 AS n FROM table_1 LIMIT 4");
        }

        @Test
        @DisplayName("TC-COMP-064: Loop step must keep the number of columns")
        void testLoopColumnCount() {
            assertThatThrownBy(() -> compileWithCatalog("from pairs | loop (select {a})", NUMBERS))
                .isInstanceOf(ResolveException.class)
                .hasMessageContaining("the step of `loop` yields 1 columns, but its input has 2");
        }

        @Test
        @DisplayName("TC-COMP-065: Loop is not allowed inside a group")
        void testLoopInGroup() {
            assertThatThrownBy(() -> compile("from t | group g (loop (take 1))"))
                .isInstanceOf(ResolveException.class)
                .hasMessageContaining("`loop` cannot be used inside `group` or `window`");
        }

        @Test
        @DisplayName("TC-COMP-066: Loop survives staged compilation through JSON")
        void testLoopThroughJson() {
            String prql = "from nums | loop (select {n = n + 1} | filter n < 5)";
            CompileOptions options = options(Dialect.POSTGRES).toBuilder().catalog(NUMBERS).build();

            String rqJson = Compiler.plToRqJson(Compiler.parseToJson(prql), options);

            logData("RQ", rqJson);
            assertThat(rqJson).contains("\"kind\":\"Loop\"");
            assertThat(Compiler.rqToSql(rqJson, options)).isEqualTo(Compiler.compile(prql, options));
        }
    }

    @Nested
    @DisplayName("Options and Header")
    class OptionsAndHeader {

        @Test
        @DisplayName("TC-COMP-010: Default options format SQL and sign it")
        void testDefaults() {
            String sql = Compiler.compile("from employees | filter has_dog | select salary", CompileOptions.defaults());

            assertThat(sql).isEqualTo("SELECT\n  salary\nFROM\n  employees\nWHERE\n  has_dog\n\n-- "
                + "Generated by PRQL compiler version:" + Compiler.VERSION + " (https://prql-lang.org)\n");
        }

        @Test
        @DisplayName("TC-COMP-011: Header target overrides the options")
        void testHeaderTarget() {
            String sql = compile("prql target:sql.mssql\nfrom employees | take 10");

            assertThat(sql).isEqualTo("SELECT TOP (10) * FROM employees");
        }

        @Test
        @DisplayName("TC-COMP-012: Unknown header target is an invalid argument")
        void testUnknownHeaderTarget() {
            assertThatThrownBy(() -> compile("prql target:sql.oracle\nfrom employees"))
                .isInstanceOf(ResolveException.class)
                .satisfies(e -> assertThat(((ResolveException) e).getKind())
                    .isEqualTo(ResolveException.Kind.INVALID_ARGUMENT))
                .hasMessageContaining("Unknown target");
        }

        @Test
        @DisplayName("TC-COMP-013: Newer major version is rejected before resolving")
        void testNewerVersion() {
            assertThatThrownBy(() -> compile("prql version:\"2\"\nfrom employees | filter invalid_name_ok"))
                .isInstanceOf(UnsupportedVersionException.class);
            assertThatThrownBy(() -> compile("prql version:\"0.99\"\nfrom employees"))
                .isInstanceOf(UnsupportedVersionException.class);
        }

        @Test
        @DisplayName("TC-COMP-014: Same minor version is accepted")
        void testSameVersion() {
            String sql = compile("prql version:\"0.13\"\nfrom employees | take 1");

            assertThat(sql).isEqualTo("SELECT * FROM employees LIMIT 1");
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("TC-COMP-020: Unknown name reports one error spanning the name")
        void testUnknownName() {
            String source = "from employees | filter invalid";
            CompileResult result = Compiler.compileResult(source,
                options(Dialect.GENERIC).toBuilder().catalog(EMPLOYEES).build());

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.sql()).isEmpty();
            assertThat(result.errors().messages()).hasSize(1);

            ErrorMessage error = result.errors().messages().get(0);
            logData("Display", error.display());
            assertThat(error.code()).isEqualTo("E0100");
            assertThat(error.reason()).isEqualTo("Unknown name `invalid`");
            assertThat(error.span().start()).isEqualTo(24);
            assertThat(error.span().end()).isEqualTo(31);
            assertThat(error.display()).startsWith("Error [E0100]: Unknown name `invalid`\n --> 1:25\n");
        }

        @Test
        @DisplayName("TC-COMP-021: Unsupported version yields an error and no SQL")
        void testUnsupportedVersionResult() {
            CompileResult result = Compiler.compileResult("prql version:\"1\"\nfrom employees",
                CompileOptions.defaults());

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.sql()).isEmpty();
            assertThat(result.errors().messages()).extracting(ErrorMessage::code)
                .containsExactly(UnsupportedVersionException.CODE);
        }

        @Test
        @DisplayName("TC-COMP-022: Syntax errors are parse errors")
        void testSyntaxError() {
            assertThatThrownBy(() -> compile("from employees | select {"))
                .isInstanceOf(ParseException.class);
        }

        @Test
        @DisplayName("TC-COMP-023: Successful result carries SQL and no errors")
        void testSuccessResult() {
            CompileResult result = Compiler.compileResult("from employees", options(Dialect.GENERIC));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.sql()).contains("SELECT * FROM employees");
            assertThat(result.errors().isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("JSON Exchange")
    class JsonExchange {

        @Test
        @DisplayName("TC-COMP-030: Staged compilation through JSON matches direct compilation")
        void testStagedThroughJson() {
            String prql = "from employees | derive {gross = salary + 1} | sort gross | take 3";
            CompileOptions options = options(Dialect.POSTGRES);

            String plJson = Compiler.parseToJson(prql);
            String rqJson = Compiler.plToRqJson(plJson, options);
            String sql = Compiler.rqToSql(rqJson, options);

            logData("PL", plJson);
            logData("RQ", rqJson);
            assertThat(plJson).startsWith("{\"stmts\":[");
            assertThat(sql).isEqualTo(Compiler.compile(prql, options));
        }

        @Test
        @DisplayName("TC-COMP-031: Malformed JSON is an illegal argument")
        void testMalformedJson() {
            assertThatThrownBy(() -> Compiler.plFromJson("{not json"))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> Compiler.rqFromJson(""))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}

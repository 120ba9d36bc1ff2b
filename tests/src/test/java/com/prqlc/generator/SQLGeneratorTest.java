package com.prqlc.generator;

import com.prqlc.dialect.Dialect;
import com.prqlc.exception.GenerationException;
import com.prqlc.pl.Literal;
import com.prqlc.rq.Aggregate;
import com.prqlc.rq.Append;
import com.prqlc.rq.CId;
import com.prqlc.rq.ColumnDef;
import com.prqlc.rq.ColumnRef;
import com.prqlc.rq.ColumnSort;
import com.prqlc.rq.Compute;
import com.prqlc.rq.Constant;
import com.prqlc.rq.Distinct;
import com.prqlc.rq.Filter;
import com.prqlc.rq.From;
import com.prqlc.rq.Join;
import com.prqlc.rq.LiteralRelation;
import com.prqlc.rq.Loop;
import com.prqlc.rq.Operator;
import com.prqlc.rq.RawSplice;
import com.prqlc.rq.Relation;
import com.prqlc.rq.RelationColumn;
import com.prqlc.rq.RelationalQuery;
import com.prqlc.rq.Remove;
import com.prqlc.rq.RqExpr;
import com.prqlc.rq.Select;
import com.prqlc.rq.Sort;
import com.prqlc.rq.TId;
import com.prqlc.rq.TableDecl;
import com.prqlc.rq.TableRef;
import com.prqlc.rq.Take;
import com.prqlc.rq.Window;
import com.prqlc.test.TestBase;
import com.prqlc.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SQLGenerator} on hand-built relational queries.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("SQL Generator Tests")
public class SQLGeneratorTest extends TestBase {

    private static final TId T0 = new TId(0);
    private static final TId T1 = new TId(1);

    private static CId c(int id) {
        return new CId(id);
    }

    private static RqExpr ref(int id) {
        return new ColumnRef(c(id), null);
    }

    private static RqExpr integer(long value) {
        return new Constant(Literal.integer(value, null));
    }

    private static RqExpr op(String name, RqExpr... args) {
        return new Operator(name, List.of(args), null);
    }

    private static RelationalQuery query(Relation main, TableDecl... tables) {
        return new RelationalQuery(null, null, List.of(tables), main);
    }

    private static String generate(RelationalQuery rq, Dialect dialect) {
        return new SQLGenerator(dialect, false).generate(rq);
    }

    /** {@code employees} with a wildcard column c0 and named columns. */
    private static TableRef employees(String... named) {
        List<RelationColumn> columns = new java.util.ArrayList<>();
        for (int i = 0; i < named.length; i++) {
            columns.add(new RelationColumn(named[i], c(i + 1)));
        }
        columns.add(RelationColumn.wildcard(c(0)));
        return new TableRef(T0, null, columns);
    }

    @Nested
    @DisplayName("Single SELECT")
    class SingleSelect {

        @Test
        @DisplayName("TC-GEN-001: Projection and filter share one SELECT")
        void testSelectWhere() {
            TableRef table = new TableRef(T0, null,
                List.of(new RelationColumn("salary", c(0)), new RelationColumn("has_dog", c(1))));
            Relation main = new Select(new Filter(new From(table), ref(1)), List.of(c(0)));

            String sql = generate(query(main, TableDecl.extern(T0, "employees")), Dialect.GENERIC);

            assertThat(sql).isEqualTo("SELECT salary FROM employees WHERE has_dog");
        }

        @Test
        @DisplayName("TC-GEN-002: Take renders LIMIT or TOP")
        void testTake() {
            Relation main = new Select(new Take(new From(employees()), 0, 10L), List.of(c(0)));
            RelationalQuery rq = query(main, TableDecl.extern(T0, "employees"));

            assertThat(generate(rq, Dialect.GENERIC)).isEqualTo("SELECT * FROM employees LIMIT 10");
            assertThat(generate(rq, Dialect.MSSQL)).isEqualTo("SELECT TOP (10) * FROM employees");
        }

        @Test
        @DisplayName("TC-GEN-003: Filter after aggregate becomes HAVING")
        void testHaving() {
            TableRef table = new TableRef(T0, null,
                List.of(new RelationColumn("g", c(1)), RelationColumn.wildcard(c(0))));
            Relation aggregate = new Aggregate(new From(table), List.of(c(1)),
                List.of(new ColumnDef(c(2), "n", op("std.count"), null)));
            Relation main = new Select(new Filter(aggregate, op("std.gt", ref(2), integer(3))),
                List.of(c(1), c(2)));

            String sql = generate(query(main, TableDecl.extern(T0, "t")), Dialect.GENERIC);

            assertThat(sql).isEqualTo("SELECT g, COUNT(*) AS n FROM t GROUP BY g HAVING COUNT(*) > 3");
        }

        @Test
        @DisplayName("TC-GEN-004: Sorted page with offset")
        void testOffset() {
            Relation sorted = new Sort(new From(employees("a")), List.of(new ColumnSort(c(1), false)));
            Relation main = new Select(new Take(sorted, 2, 3L), List.of(c(0)));
            RelationalQuery rq = query(main, TableDecl.extern(T0, "t"));

            assertThat(generate(rq, Dialect.GENERIC)).isEqualTo("SELECT * FROM t ORDER BY a LIMIT 3 OFFSET 2");
            assertThat(generate(rq, Dialect.MSSQL))
                .isEqualTo("SELECT * FROM t ORDER BY a OFFSET 2 ROWS FETCH FIRST 3 ROWS ONLY");
        }

        @Test
        @DisplayName("TC-GEN-005: Offset without limit")
        void testOffsetOnly() {
            Relation main = new Select(new Take(new From(employees()), 2, null), List.of(c(0)));
            RelationalQuery rq = query(main, TableDecl.extern(T0, "t"));

            assertThat(generate(rq, Dialect.GENERIC)).isEqualTo("SELECT * FROM t OFFSET 2");
            assertThat(generate(rq, Dialect.SQLITE)).isEqualTo("SELECT * FROM t LIMIT -1 OFFSET 2");
            assertThat(generate(rq, Dialect.MSSQL))
                .isEqualTo("SELECT * FROM t ORDER BY (SELECT NULL) OFFSET 2 ROWS");
        }

        @Test
        @DisplayName("TC-GEN-006: Consecutive takes merge")
        void testTakeTake() {
            Relation first = new Take(new From(employees()), 0, 10L);
            Relation main = new Select(new Take(first, 2, 5L), List.of(c(0)));

            String sql = generate(query(main, TableDecl.extern(T0, "t")), Dialect.GENERIC);

            assertThat(sql).isEqualTo("SELECT * FROM t LIMIT 5 OFFSET 2");
        }

        @Test
        @DisplayName("TC-GEN-007: Window function with frame")
        void testWindow() {
            Window window = new Window(Window.Kind.ROWS, -1L, 1L, List.of(c(1)), List.of(new ColumnSort(c(2), true)));
            Relation computed = new Compute(new From(employees("g", "x")),
                new ColumnDef(c(3), "s", op("std.sum", ref(2)), window));
            Relation main = new Select(computed, List.of(c(0), c(3)));

            String sql = generate(query(main, TableDecl.extern(T0, "t")), Dialect.GENERIC);

            assertThat(sql).isEqualTo(
                "SELECT *, SUM(x) OVER (PARTITION BY g ORDER BY x DESC ROWS BETWEEN 1 PRECEDING AND 1 FOLLOWING) AS s FROM t");
        }

        @Test
        @DisplayName("TC-GEN-008: Distinct rows with a limit")
        void testDistinct() {
            TableRef table = new TableRef(T0, null,
                List.of(new RelationColumn("first_name", c(1)), RelationColumn.wildcard(c(0))));
            Relation distinct = new Distinct(new Select(new From(table), List.of(c(1))));
            RelationalQuery rq = query(new Select(distinct, List.of(c(1))), TableDecl.extern(T0, "employees"));
            RelationalQuery limited = query(new Select(new Take(distinct, 0, 5L), List.of(c(1))),
                TableDecl.extern(T0, "employees"));

            assertThat(generate(rq, Dialect.GENERIC)).isEqualTo("SELECT DISTINCT first_name FROM employees");
            assertThat(generate(limited, Dialect.GENERIC)).isEqualTo("SELECT DISTINCT first_name FROM employees LIMIT 5");
        }

        @Test
        @DisplayName("TC-GEN-009: Generating the same query twice gives the same SQL")
        void testDeterministic() {
            Relation taken = new Take(new Sort(new From(employees("a", "b")), List.of(new ColumnSort(c(2), true))), 0, 10L);
            Relation derived = new Compute(new Filter(taken, op("std.gt", ref(1), integer(5))),
                new ColumnDef(c(3), null, op("std.add", ref(1), ref(2)), null));
            Relation main = new Select(derived, List.of(c(1), c(3)));

            String first = generate(query(main, TableDecl.extern(T0, "t")), Dialect.POSTGRES);
            String second = generate(query(main, TableDecl.extern(T0, "t")), Dialect.POSTGRES);

            logData("SQL", first);
            assertThat(second).isEqualTo(first);
            assertThat(first).startsWith("WITH table_0 AS (");
        }
    }

    @Nested
    @DisplayName("CTE Splitting")
    class CteSplitting {

        @Test
        @DisplayName("TC-GEN-010: Filter after take moves the take into a CTE")
        void testFilterAfterTake() {
            Relation taken = new Take(new From(employees("a")), 0, 10L);
            Relation main = new Select(new Filter(taken, op("std.gt", ref(1), integer(5))), List.of(c(0)));

            String sql = generate(query(main, TableDecl.extern(T0, "t")), Dialect.GENERIC);

            assertThat(sql).isEqualTo("WITH table_0 AS (SELECT * FROM t LIMIT 10) SELECT * FROM table_0 WHERE a > 5");
        }

        @Test
        @DisplayName("TC-GEN-011: Pretty output puts each clause on its own line")
        void testPretty() {
            Relation taken = new Take(new From(employees("a")), 0, 10L);
            Relation main = new Select(new Filter(taken, op("std.gt", ref(1), integer(5))), List.of(c(0)));

            String sql = new SQLGenerator(Dialect.GENERIC, true)
                .generate(query(main, TableDecl.extern(T0, "t")));

            assertThat(sql).isEqualTo(String.join("\n",
                "WITH table_0 AS (",
                "  SELECT",
                "    *",
                "  FROM",
                "    t",
                "  LIMIT",
                "    10",
                ")",
                "SELECT",
                "  *",
                "FROM",
                "  table_0",
                "WHERE",
                "  a > 5"));
        }

        @Test
        @DisplayName("TC-GEN-012: Literal rows become a UNION ALL CTE")
        void testLiteralRelation() {
            LiteralRelation rows = new LiteralRelation(List.of("a", "b"), List.of(
                List.of(Literal.integer(1, null), Literal.string("x", null)),
                List.of(Literal.integer(2, null), Literal.string("y", null))));
            TableDecl decl = new TableDecl(T0, null, rows,
                List.of(new RelationColumn("a", c(0)), new RelationColumn("b", c(1))));
            TableRef ref = new TableRef(T0, null,
                List.of(new RelationColumn("a", c(2)), new RelationColumn("b", c(3))));
            Relation main = new Select(new From(ref), List.of(c(2), c(3)));

            String sql = generate(query(main, decl), Dialect.GENERIC);

            assertThat(sql).isEqualTo("WITH table_0 AS (SELECT 1 AS a, 'x' AS b UNION ALL SELECT 2 AS a, 'y' AS b) "
                + "SELECT a, b FROM table_0");
        }

        @Test
        @DisplayName("TC-GEN-013: Filter on a window function reads it from a CTE")
        void testFilterOnWindow() {
            Relation numbered = new Compute(new From(employees()), new ColumnDef(c(1), "rn", op("std.row_number"),
                new Window(null, null, null, List.of(), List.of())));
            Relation main = new Select(new Filter(numbered, op("std.gt", ref(1), integer(2))), List.of(c(0), c(1)));

            String sql = generate(query(main, TableDecl.extern(T0, "employees")), Dialect.GENERIC);

            assertThat(sql).isEqualTo("WITH table_0 AS (SELECT *, ROW_NUMBER() OVER () AS rn FROM employees) "
                + "SELECT * FROM table_0 WHERE rn > 2");
        }

        @Test
        @DisplayName("TC-GEN-014: Aggregate over a window function reads it from a CTE")
        void testAggregateOverWindow() {
            Relation numbered = new Compute(new From(employees()), new ColumnDef(c(1), "rn", op("std.row_number"),
                new Window(null, null, null, List.of(), List.of())));
            Relation aggregate = new Aggregate(numbered, List.of(),
                List.of(new ColumnDef(c(2), "m", op("std.max", ref(1)), null)));
            Relation main = new Select(aggregate, List.of(c(2)));

            String sql = generate(query(main, TableDecl.extern(T0, "employees")), Dialect.GENERIC);

            assertThat(sql).isEqualTo("WITH table_0 AS (SELECT *, ROW_NUMBER() OVER () AS rn FROM employees) "
                + "SELECT MAX(rn) AS m FROM table_0");
        }

        @Test
        @DisplayName("TC-GEN-015: Filter on a raw SQL column reads it from a CTE")
        void testFilterOnRawColumn() {
            Relation ranked = new Compute(new From(employees()),
                new ColumnDef(c(1), "r", RawSplice.text("RANK() OVER ()", null), null));
            Relation main = new Select(new Filter(ranked, op("std.eq", ref(1), integer(1))), List.of(c(0), c(1)));

            String sql = generate(query(main, TableDecl.extern(T0, "report")), Dialect.GENERIC);

            assertThat(sql).isEqualTo("WITH table_0 AS (SELECT *, RANK() OVER () AS r FROM report) "
                + "SELECT * FROM table_0 WHERE r = 1");
        }

        @Test
        @DisplayName("TC-GEN-016: Loop becomes a recursive CTE")
        void testLoop() {
            TableRef nums = new TableRef(T0, null, List.of(new RelationColumn("n", c(0))));
            TableRef previous = new TableRef(T1, null, List.of(new RelationColumn("n", c(1))));
            Relation step = new Select(new Compute(new From(previous),
                new ColumnDef(c(2), "n", op("std.add", ref(1), integer(1)), null)), List.of(c(2)));
            Relation loop = new Loop(new Select(new From(nums), List.of(c(0))), T1,
                List.of(new RelationColumn("n", c(0))), step);
            RelationalQuery rq = query(new Select(loop, List.of(c(0))), TableDecl.extern(T0, "nums"));

            assertThat(generate(rq, Dialect.GENERIC)).isEqualTo(
                "WITH RECURSIVE table_0 AS (SELECT n FROM nums UNION ALL SELECT n + 1 AS n FROM table_0) "
                    + "SELECT n FROM table_0");
            assertThat(generate(rq, Dialect.MSSQL)).isEqualTo(
                "WITH table_0 AS (SELECT n FROM nums UNION ALL SELECT n + 1 AS n FROM table_0) "
                    + "SELECT n FROM table_0");
        }
    }

    @Nested
    @DisplayName("Joins and Set Operations")
    class JoinsAndSets {

        @Test
        @DisplayName("TC-GEN-020: Joined columns are qualified")
        void testJoin() {
            TableRef employees = new TableRef(T0, null,
                List.of(new RelationColumn("dept_id", c(1)), RelationColumn.wildcard(c(0))));
            TableRef departments = new TableRef(T1, null,
                List.of(new RelationColumn("id", c(3)), RelationColumn.wildcard(c(2))));
            Relation joined = new Join(new From(employees), Join.Side.LEFT, departments,
                op("std.eq", ref(1), ref(3)));
            Relation main = new Select(joined, List.of(c(0), c(2)));

            String sql = generate(query(main, TableDecl.extern(T0, "employees"), TableDecl.extern(T1, "departments")),
                Dialect.GENERIC);

            assertThat(sql).isEqualTo("SELECT employees.*, departments.* FROM employees "
                + "LEFT JOIN departments ON employees.dept_id = departments.id");
        }

        @Test
        @DisplayName("TC-GEN-021: Self join gets a unique alias")
        void testSelfJoin() {
            TableRef left = new TableRef(T0, null,
                List.of(new RelationColumn("manager_id", c(1)), RelationColumn.wildcard(c(0))));
            TableRef right = new TableRef(T0, null,
                List.of(new RelationColumn("id", c(3)), RelationColumn.wildcard(c(2))));
            Relation joined = new Join(new From(left), Join.Side.INNER, right, op("std.eq", ref(1), ref(3)));
            Relation main = new Select(joined, List.of(c(0), c(2)));

            String sql = generate(query(main, TableDecl.extern(T0, "employees")), Dialect.GENERIC);

            assertThat(sql).isEqualTo("SELECT employees.*, employees_1.* FROM employees "
                + "JOIN employees AS employees_1 ON employees.manager_id = employees_1.id");
        }

        @Test
        @DisplayName("TC-GEN-022: Join on true is a cross join")
        void testCrossJoin() {
            TableRef right = new TableRef(T1, null, List.of(RelationColumn.wildcard(c(1))));
            Relation joined = new Join(new From(employees()), Join.Side.INNER, right,
                new Constant(Literal.bool(true, null)));
            Relation main = new Select(joined, List.of(c(0), c(1)));

            String sql = generate(query(main, TableDecl.extern(T0, "a"), TableDecl.extern(T1, "b")), Dialect.GENERIC);

            assertThat(sql).isEqualTo("SELECT a.*, b.* FROM a CROSS JOIN b");
        }

        @Test
        @DisplayName("TC-GEN-023: Append and remove")
        void testSetOperations() {
            TableRef other = new TableRef(T1, null, List.of(RelationColumn.wildcard(c(1))));
            TableDecl[] tables = {TableDecl.extern(T0, "a"), TableDecl.extern(T1, "b")};

            Relation append = new Select(new Append(new From(employees()), other), List.of(c(0)));
            Relation remove = new Select(new Remove(new From(employees()), other), List.of(c(0)));

            assertThat(generate(query(append, tables), Dialect.GENERIC))
                .isEqualTo("SELECT * FROM a UNION ALL SELECT * FROM b");
            assertThat(generate(query(remove, tables), Dialect.GENERIC))
                .isEqualTo("SELECT * FROM a EXCEPT ALL SELECT * FROM b");
            assertThat(generate(query(remove, tables), Dialect.SQLITE))
                .isEqualTo("SELECT * FROM a EXCEPT SELECT * FROM b");
        }
    }

    @Nested
    @DisplayName("Errors and Options")
    class ErrorsAndOptions {

        @Test
        @DisplayName("TC-GEN-030: Signature comment is appended")
        void testSignature() {
            Relation main = new Select(new From(employees()), List.of(c(0)));

            String sql = new SQLGenerator(Dialect.GENERIC, false)
                .generate(query(main, TableDecl.extern(T0, "t")), "made by tests");

            assertThat(sql).isEqualTo("SELECT * FROM t\n\n-- made by tests\n");
        }

        @Test
        @DisplayName("TC-GEN-031: Undeclared table is a generation error")
        void testUndeclaredTable() {
            Relation main = new Select(new From(employees()), List.of(c(0)));

            assertThatThrownBy(() -> generate(query(main), Dialect.GENERIC))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("referenced before it is declared");
        }

        @Test
        @DisplayName("TC-GEN-032: Unsupported function names the dialect")
        void testUnsupportedFunction() {
            Relation main = new Select(new Filter(new From(employees("name")),
                op("std.regex_search", ref(1), new Constant(Literal.string("^a", null)))), List.of(c(0)));

            assertThatThrownBy(() -> generate(query(main, TableDecl.extern(T0, "t")), Dialect.MSSQL))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("mssql");
        }
    }
}

package com.prqlc.semantic;

import com.prqlc.catalog.TableCatalog;
import com.prqlc.catalog.TableSchema;
import com.prqlc.exception.ResolveException;
import com.prqlc.test.TestBase;
import com.prqlc.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Resolver}, observed through the SQL it leads to.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Resolver Tests")
public class ResolverTest extends TestBase {

    private static final TableCatalog EMPLOYEES = TableCatalog.of(
        TableSchema.of("employees", "name", "salary", "has_dog"));

    private static ResolveException.Kind kindOf(Throwable e) {
        return ((ResolveException) e).getKind();
    }

    @Nested
    @DisplayName("Names")
    class Names {

        @Test
        @DisplayName("TC-RES-001: Unknown column suggests the closest name and lists columns")
        void testUnknownColumnHints() {
            assertThatThrownBy(() -> compileWithCatalog("from employees | filter salry > 1", EMPLOYEES))
                .isInstanceOf(ResolveException.class)
                .satisfies(e -> {
                    ResolveException error = (ResolveException) e;
                    assertThat(error.getKind()).isEqualTo(ResolveException.Kind.UNKNOWN_NAME);
                    assertThat(error.getCode()).isEqualTo("E0100");
                    assertThat(error.getHints()).containsExactly(
                        "did you mean `salary`?",
                        "available columns: employees.name, employees.salary, employees.has_dog");
                });
        }

        @Test
        @DisplayName("TC-RES-002: Unknown names are absorbed by a single unknown table")
        void testWildcardAbsorbs() {
            assertThat(compile("from t | select {anything}")).isEqualTo("SELECT anything FROM t");
        }

        @Test
        @DisplayName("TC-RES-003: Bare name shared by two unknown tables is ambiguous")
        void testAmbiguous() {
            assertThatThrownBy(() -> compile("from a | join b (a.id == b.id) | select {x}"))
                .isInstanceOf(ResolveException.class)
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ResolveException.Kind.AMBIGUOUS_NAME));
        }

        @Test
        @DisplayName("TC-RES-004: Unknown function")
        void testUnknownFunction() {
            assertThatThrownBy(() -> compile("from t | derive {y = frobnicate x}"))
                .isInstanceOf(ResolveException.class)
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ResolveException.Kind.UNKNOWN_NAME))
                .hasMessageContaining("frobnicate");
        }
    }

    @Nested
    @DisplayName("Functions")
    class Functions {

        @Test
        @DisplayName("TC-RES-010: Named parameter defaults and overrides")
        void testNamedParameters() {
            String sql = compile("let inc = func x by:1 -> x + by\nfrom t | derive {y = inc a, z = inc a by:5}");

            assertThat(sql).isEqualTo("SELECT *, a + 1 AS y, a + 5 AS z FROM t");
        }

        @Test
        @DisplayName("TC-RES-011: Partial application completes on a later call")
        void testCurrying() {
            String sql = compile("let add = func a b -> a + b\nlet add_one = add 1\nfrom t | derive {y = add_one x}");

            assertThat(sql).isEqualTo("SELECT *, 1 + x AS y FROM t");
        }

        @Test
        @DisplayName("TC-RES-012: Too many arguments")
        void testTooManyArguments() {
            assertThatThrownBy(() -> compile("let add = func a b -> a + b\nfrom t | derive {y = add 1 2 3}"))
                .isInstanceOf(ResolveException.class)
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ResolveException.Kind.ARITY_MISMATCH))
                .hasMessageContaining("expects 2 arguments, but got 3");
        }

        @Test
        @DisplayName("TC-RES-013: Unknown named argument")
        void testUnknownNamedArgument() {
            assertThatThrownBy(() -> compile("let inc = func x by:1 -> x + by\nfrom t | derive {y = inc a step:2}"))
                .isInstanceOf(ResolveException.class)
                .satisfies(e -> {
                    assertThat(kindOf(e)).isEqualTo(ResolveException.Kind.INVALID_ARGUMENT);
                    assertThat(((ResolveException) e).getHints()).containsExactly("named parameters are: by");
                })
                .hasMessageContaining("has no parameter `step`");
        }

        @Test
        @DisplayName("TC-RES-014: Partially applied function used as a column")
        void testMissingArgument() {
            assertThatThrownBy(() -> compile("let add = func a b -> a + b\nfrom t | derive {y = add 1}"))
                .isInstanceOf(ResolveException.class)
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ResolveException.Kind.TYPE_MISMATCH))
                .hasMessageContaining("is missing 1 argument(s)");
        }

        @Test
        @DisplayName("TC-RES-015: User function as a pipeline step")
        void testRelationFunction() {
            String sql = compile("let top = func n rel <relation> -> (rel | sort {-salary} | take n)\n"
                + "from employees | top 3");

            assertThat(sql).isEqualTo("SELECT * FROM employees ORDER BY salary DESC LIMIT 3");
        }
    }

    @Nested
    @DisplayName("Transforms")
    class Transforms {

        @Test
        @DisplayName("TC-RES-020: Take needs integer bounds")
        void testTakeMismatch() {
            assertThatThrownBy(() -> compile("from t | take \"ten\""))
                .isInstanceOf(ResolveException.class)
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ResolveException.Kind.TYPE_MISMATCH));
        }

        @Test
        @DisplayName("TC-RES-021: Join side must be a known side")
        void testJoinSide() {
            assertThatThrownBy(() -> compile("from a | join side:outer b (==id)"))
                .isInstanceOf(ResolveException.class)
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ResolveException.Kind.INVALID_ARGUMENT))
                .hasMessageContaining("`side` expects inner, left, right or full");
        }

        @Test
        @DisplayName("TC-RES-022: Declared relation is referenced by name")
        void testDeclaredRelation() {
            String sql = compile("let big = (from employees | filter salary > 100)\nfrom big | select {name}");

            assertThat(sql).startsWith("WITH big AS (");
            assertThat(sql).endsWith("SELECT name FROM big");
        }

        @Test
        @DisplayName("TC-RES-023: Comparing an array with a scalar is rejected")
        void testArrayComparison() {
            assertThatThrownBy(() -> compile("from t | filter a == [1, 2]"))
                .isInstanceOf(ResolveException.class)
                .hasMessageContaining("cannot compare an array with a scalar");
        }
    }

    @Nested
    @DisplayName("Name Suggestions")
    class Suggestions {

        @Test
        @DisplayName("TC-RES-030: Closest candidate within the typo threshold")
        void testClosest() {
            assertThat(NameSuggestions.closest("salry", List.of("name", "salary"))).isEqualTo("salary");
            assertThat(NameSuggestions.closest("xyz", List.of("name", "salary"))).isNull();
            assertThat(NameSuggestions.distance("kitten", "sitting")).isEqualTo(3);
        }
    }
}

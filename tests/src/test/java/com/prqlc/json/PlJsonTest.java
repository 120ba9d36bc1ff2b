package com.prqlc.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prqlc.Compiler;
import com.prqlc.pl.Stmt;
import com.prqlc.test.TestBase;
import com.prqlc.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PlJson}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("PL JSON Tests")
public class PlJsonTest extends TestBase {

    private static final ObjectMapper mapper = new ObjectMapper();

    @Nested
    @DisplayName("Writing")
    class Writing {

        @Test
        @DisplayName("TC-PLJSON-001: Statements carry their kind and span")
        void testStatementShape() throws Exception {
            String json = PlJson.toJson(Compiler.parse("from employees | take 10"));
            logData("JSON", json);

            JsonNode stmt = mapper.readTree(json).get("stmts").get(0);
            assertThat(stmt.get("kind").asText()).isEqualTo("VarDef");
            assertThat(stmt.get("var_kind").asText()).isEqualTo("main");
            assertThat(stmt.get("span").get(0).asInt()).isEqualTo(0);
            assertThat(stmt.get("value").get("kind").asText()).isEqualTo("Pipeline");
        }

        @Test
        @DisplayName("TC-PLJSON-002: Literals keep type and value")
        void testLiteral() throws Exception {
            String json = PlJson.toJson(Compiler.parse("let x = 42"));

            JsonNode value = mapper.readTree(json).get("stmts").get(0).get("value");
            assertThat(value.get("kind").asText()).isEqualTo("Literal");
            assertThat(value.get("type").asText()).isEqualTo("integer");
            assertThat(value.get("value").asText()).isEqualTo("42");
        }

        @Test
        @DisplayName("TC-PLJSON-003: Query header keeps target and version")
        void testHeader() throws Exception {
            String json = PlJson.toJson(Compiler.parse("prql target:sql.duckdb version:\"0.13\"\nfrom t"));

            JsonNode header = mapper.readTree(json).get("stmts").get(0);
            assertThat(header.get("kind").asText()).isEqualTo("QueryDef");
            assertThat(header.get("target").asText()).isEqualTo("sql.duckdb");
            assertThat(header.get("version").asText()).isEqualTo("0.13");
        }
    }

    @Nested
    @DisplayName("Reading")
    class Reading {

        @Test
        @DisplayName("TC-PLJSON-010: Written statements read back unchanged")
        void testReadBack() {
            String source = String.join("\n",
                "prql target:sql.postgres",
                "let add_one = func x -> x + 1",
                "let big = (from employees | filter salary > 100)",
                "from big",
                "derive {label = case [salary > 1000 => \"high\", true => \"low\"], raw = s\"UPPER({name})\"}",
                "sort {-salary}",
                "take 1..10");
            String json = PlJson.toJson(Compiler.parse(source));

            List<Stmt> stmts = PlJson.fromJson(json);

            assertThat(stmts).hasSize(4);
            assertThat(PlJson.toJson(stmts)).isEqualTo(json);
        }

        @Test
        @DisplayName("TC-PLJSON-011: Read statements compile like parsed ones")
        void testCompileFromJson() {
            String source = "from employees | filter has_dog | select salary";
            List<Stmt> stmts = PlJson.fromJson(PlJson.toJson(Compiler.parse(source)));

            String sql = Compiler.generate(Compiler.resolveAndLower(stmts, options(com.prqlc.dialect.Dialect.GENERIC)),
                options(com.prqlc.dialect.Dialect.GENERIC));

            assertThat(sql).isEqualTo("SELECT salary FROM employees WHERE has_dog");
        }

        @Test
        @DisplayName("TC-PLJSON-012: Malformed documents are rejected")
        void testMalformed() {
            assertThatThrownBy(() -> PlJson.fromJson("  "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cannot be null or empty");
            assertThatThrownBy(() -> PlJson.fromJson("{\"stmts\": ["))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Failed to parse PL JSON");
            assertThatThrownBy(() -> PlJson.fromJson("{\"stmts\": [{\"kind\": \"Bogus\"}]}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown statement kind: Bogus");
            assertThatThrownBy(() -> PlJson.fromJson("{\"stmts\": [{\"kind\": \"VarDef\", \"name\": \"main\"}]}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Missing field \"var_kind\"");
        }
    }
}

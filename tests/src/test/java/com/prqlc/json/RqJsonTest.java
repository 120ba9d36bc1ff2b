package com.prqlc.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prqlc.CompileOptions;
import com.prqlc.Compiler;
import com.prqlc.dialect.Dialect;
import com.prqlc.rq.RelationalQuery;
import com.prqlc.test.TestBase;
import com.prqlc.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RqJson}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("RQ JSON Tests")
public class RqJsonTest extends TestBase {

    private static final ObjectMapper mapper = new ObjectMapper();

    @Nested
    @DisplayName("Writing")
    class Writing {

        @Test
        @DisplayName("TC-RQJSON-001: Tables and main relation are written")
        void testShape() throws Exception {
            String json = RqJson.toJson(lower("from employees | filter has_dog | select salary"));
            logData("JSON", json);

            JsonNode root = mapper.readTree(json);
            JsonNode table = root.get("tables").get(0);
            assertThat(table.get("name").asText()).isEqualTo("employees");
            assertThat(table.has("relation")).isFalse();

            JsonNode main = root.get("relation");
            assertThat(main.get("kind").asText()).isEqualTo("Select");
            assertThat(main.get("input").get("kind").asText()).isEqualTo("Filter");
            assertThat(main.get("input").get("input").get("kind").asText()).isEqualTo("From");
        }

        @Test
        @DisplayName("TC-RQJSON-002: Header target is kept in the definition")
        void testTarget() throws Exception {
            String json = RqJson.toJson(lower("prql target:sql.sqlite\nfrom t"));

            JsonNode def = mapper.readTree(json).get("def");
            assertThat(def.get("target").asText()).isEqualTo("sql.sqlite");
        }
    }

    @Nested
    @DisplayName("Reading")
    class Reading {

        @Test
        @DisplayName("TC-RQJSON-010: Written queries read back unchanged")
        void testReadBack() {
            String prql = String.join("\n",
                "from e = employees",
                "join d = departments (==dept_id)",
                "group {d.name} (aggregate {total = sum e.salary})",
                "sort {-total}",
                "take 10");
            String json = RqJson.toJson(lower(prql));

            RelationalQuery rq = RqJson.fromJson(json);

            assertThat(RqJson.toJson(rq)).isEqualTo(json);
        }

        @Test
        @DisplayName("TC-RQJSON-011: A target in the document overrides the options")
        void testTargetOverride() {
            String json = RqJson.toJson(lower("prql target:sql.mssql\nfrom employees | take 10"));

            String sql = Compiler.rqToSql(json, options(Dialect.POSTGRES));

            assertThat(sql).isEqualTo("SELECT TOP (10) * FROM employees");
        }

        @Test
        @DisplayName("TC-RQJSON-012: Malformed documents are rejected")
        void testMalformed() {
            assertThatThrownBy(() -> RqJson.fromJson("[1, 2"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Failed to parse RQ JSON");
            assertThatThrownBy(() -> RqJson.fromJson("{\"tables\": [], \"relation\": {\"kind\": \"Shuffle\", "
                + "\"input\": {\"kind\": \"From\", \"table\": {\"source\": 0, \"columns\": []}}}}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown relation kind: Shuffle");
            assertThatThrownBy(() -> RqJson.fromJson("{\"tables\": []}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Missing field \"relation\"");
            assertThatThrownBy(() -> Compiler.rqToSql("", CompileOptions.defaults()))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}

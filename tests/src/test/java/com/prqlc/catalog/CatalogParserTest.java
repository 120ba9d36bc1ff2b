package com.prqlc.catalog;

import com.prqlc.test.TestBase;
import com.prqlc.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CatalogParser} and the catalog it builds.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Catalog Parser Tests")
public class CatalogParserTest extends TestBase {

    @Test
    @DisplayName("TC-CAT-001: Tables with typed and bare columns")
    void testParse() {
        TableCatalog catalog = CatalogParser.parse(
            "{\"tables\": [{\"name\": \"employees\", \"columns\": [{\"name\": \"id\", \"type\": \"int\"}, \"name\"]},"
                + " {\"name\": \"departments\"}]}");
        logData("Catalog", catalog);

        assertThat(catalog.tables()).hasSize(2);
        TableSchema employees = catalog.table("employees").orElseThrow();
        assertThat(employees.columnNames()).containsExactly("id", "name");
        assertThat(employees.columns().get(0).type()).isEqualTo("int");
        assertThat(employees.columns().get(1).type()).isNull();
        assertThat(catalog.table("departments").orElseThrow().size()).isZero();
        assertThat(catalog.table("missing")).isEmpty();
    }

    @Test
    @DisplayName("TC-CAT-002: Empty catalog")
    void testEmpty() {
        assertThat(CatalogParser.parse("{\"tables\": []}").isEmpty()).isTrue();
        assertThat(TableCatalog.empty().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("TC-CAT-003: Invalid catalogs are rejected")
    void testInvalid() {
        assertThatThrownBy(() -> CatalogParser.parse(""))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be null or empty");
        assertThatThrownBy(() -> CatalogParser.parse("{\"tables\": "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Failed to parse catalog JSON");
        assertThatThrownBy(() -> CatalogParser.parse("{\"schemas\": []}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("\"tables\" array");
        assertThatThrownBy(() -> CatalogParser.parse("{\"tables\": [{\"columns\": []}]}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("needs a \"name\"");
        assertThatThrownBy(() -> CatalogParser.parse("{\"tables\": [{\"name\": \"t\", \"columns\": [{\"type\": \"int\"}]}]}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Column of table t has no \"name\"");
    }

    @Test
    @DisplayName("TC-CAT-004: Known columns turn unknown names into errors")
    void testCatalogDrivesResolution() {
        TableCatalog catalog = CatalogParser.parse("{\"tables\": [{\"name\": \"t\", \"columns\": [\"a\", \"b\"]}]}");

        assertThat(compileWithCatalog("from t | select {b}", catalog)).isEqualTo("SELECT b FROM t");
        assertThatThrownBy(() -> compileWithCatalog("from t | select {c}", catalog))
            .isInstanceOf(com.prqlc.exception.ResolveException.class)
            .hasMessageContaining("Unknown name `c`");
    }
}

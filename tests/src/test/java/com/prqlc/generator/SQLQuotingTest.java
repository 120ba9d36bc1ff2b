package com.prqlc.generator;

import com.prqlc.dialect.Dialect;
import com.prqlc.test.TestBase;
import com.prqlc.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("SQL Quoting Tests")
public class SQLQuotingTest extends TestBase {

    @ParameterizedTest
    @ValueSource(strings = {"name", "_private", "col_1", "price$"})
    @DisplayName("TC-QUOTE-001: Valid bare identifiers are not quoted")
    void testBareIdentifiers(String identifier) {
        assertThat(SQLQuoting.needsQuoting(identifier)).isFalse();
        assertThat(SQLQuoting.quoteIdentifierIfNeeded(identifier, Dialect.GENERIC)).isEqualTo(identifier);
    }

    @ParameterizedTest
    @ValueSource(strings = {"Name", "first name", "1st", "select", "order", "a-b"})
    @DisplayName("TC-QUOTE-002: Uppercase, spaces, leading digits and reserved words need quoting")
    void testQuotedIdentifiers(String identifier) {
        assertThat(SQLQuoting.needsQuoting(identifier)).isTrue();
    }

    @Test
    @DisplayName("TC-QUOTE-003: Embedded quote characters are doubled")
    void testEscaping() {
        assertThat(SQLQuoting.quoteIdentifier("a\"b", Dialect.POSTGRES)).isEqualTo("\"a\"\"b\"");
        assertThat(SQLQuoting.quoteIdentifier("a`b", Dialect.MYSQL)).isEqualTo("`a``b`");
        assertThat(SQLQuoting.quoteLiteral("O'Brien")).isEqualTo("'O''Brien'");
        assertThat(SQLQuoting.quoteLiteral(null)).isEqualTo("NULL");
    }

    @Test
    @DisplayName("TC-QUOTE-004: Table names are quoted part by part")
    void testTableNames() {
        assertThat(SQLQuoting.quoteTableName("db.Users", Dialect.GENERIC)).isEqualTo("db.\"Users\"");
        assertThat(SQLQuoting.quoteTableName("project.dataset.table", Dialect.BIGQUERY))
            .isEqualTo("`project.dataset.table`");
        assertThat(SQLQuoting.quoteTableName("dataset.events", Dialect.BIGQUERY)).isEqualTo("dataset.events");
    }

    @Test
    @DisplayName("TC-QUOTE-005: Empty identifiers are rejected")
    void testEmpty() {
        assertThatThrownBy(() -> SQLQuoting.quoteIdentifierIfNeeded("", Dialect.GENERIC))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SQLQuoting.quoteTableName(null, Dialect.GENERIC))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

package com.prqlc.dialect;

import com.prqlc.test.TestBase;
import com.prqlc.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Tier2
@TestCategories.Unit
@DisplayName("Date Format Translation Tests")
public class DateFormatsTest extends TestBase {

    @Test
    @DisplayName("TC-DATE-001: Postgres format")
    void testPostgres() {
        assertThat(DateFormats.translate("%Y-%m-%d %H:%M:%S", DateFormats.Style.POSTGRES))
            .isEqualTo("YYYY-MM-DD HH24:MI:SS");
    }

    @Test
    @DisplayName("TC-DATE-002: Composite specifiers expand")
    void testComposite() {
        assertThat(DateFormats.translate("%F", DateFormats.Style.MSSQL)).isEqualTo("yyyy-MM-dd");
        assertThat(DateFormats.translate("%T", DateFormats.Style.MSSQL)).isEqualTo("HH:mm:ss");
    }

    @Test
    @DisplayName("TC-DATE-003: MySQL keeps percent specifiers")
    void testMysql() {
        assertThat(DateFormats.translate("%d/%m/%Y %H:%M", DateFormats.Style.MYSQL)).isEqualTo("%d/%m/%Y %H:%i");
    }

    @Test
    @DisplayName("TC-DATE-004: Padding flags and fractional seconds")
    void testFlagsAndFractions() {
        assertThat(DateFormats.translate("%-d", DateFormats.Style.POSTGRES)).isEqualTo("DD");
        assertThat(DateFormats.translate("%S.%.3f", DateFormats.Style.POSTGRES)).isEqualTo("SS.MS");
        assertThat(DateFormats.translate("100%%", DateFormats.Style.POSTGRES)).isEqualTo("100%");
    }

    @Test
    @DisplayName("TC-DATE-005: strftime dialects take the format as is")
    void testStrftime() {
        assertThat(DateFormats.translate("%j %q", DateFormats.Style.STRFTIME)).isEqualTo("%j %q");
        assertThat(DateFormats.styleOf(Dialect.DUCKDB)).isEqualTo(DateFormats.Style.STRFTIME);
        assertThat(DateFormats.styleOf(Dialect.GLAREDB)).isNull();
    }

    @Test
    @DisplayName("TC-DATE-006: Unsupported and incomplete specifiers are rejected")
    void testErrors() {
        assertThatThrownBy(() -> DateFormats.translate("%j", DateFormats.Style.MSSQL))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("%j");
        assertThatThrownBy(() -> DateFormats.translate("%Y-%", DateFormats.Style.POSTGRES))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("incomplete");
    }
}

package com.prqlc;

import com.prqlc.catalog.TableCatalog;
import com.prqlc.catalog.TableSchema;
import com.prqlc.dialect.Dialect;
import com.prqlc.test.TestBase;
import com.prqlc.test.TestCategories;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CompileOptions}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Compile Options Tests")
public class CompileOptionsTest extends TestBase {

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("TC-OPT-001: Defaults")
        void testDefaults() {
            CompileOptions options = CompileOptions.defaults();

            assertThat(options.format()).isTrue();
            assertThat(options.target()).isEqualTo(Target.GENERIC);
            assertThat(options.signatureComment()).isTrue();
            assertThat(options.colorDisplay()).isFalse();
            assertThat(options.catalog().isEmpty()).isTrue();
        }

        @Test
        @DisplayName("TC-OPT-002: Builder and toBuilder")
        void testBuilder() {
            TableCatalog catalog = TableCatalog.of(TableSchema.of("t", "a"));
            CompileOptions options = CompileOptions.builder()
                .format(false)
                .target(Target.of(Dialect.BIGQUERY))
                .signatureComment(false)
                .catalog(catalog)
                .build();

            CompileOptions copy = options.toBuilder().format(true).build();

            assertThat(options.format()).isFalse();
            assertThat(copy.format()).isTrue();
            assertThat(copy.target().dialect()).isEqualTo(Dialect.BIGQUERY);
            assertThat(copy.signatureComment()).isFalse();
            assertThat(copy.catalog()).isSameAs(catalog);
        }

        @Test
        @DisplayName("TC-OPT-003: Null target is rejected")
        void testNullTarget() {
            assertThatThrownBy(() -> CompileOptions.builder().target(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("target must not be null");
        }
    }

    @Nested
    @DisplayName("System Properties")
    class SystemProperties {

        @AfterEach
        void clearProperties() {
            System.clearProperty(CompileOptions.PROP_FORMAT);
            System.clearProperty(CompileOptions.PROP_TARGET);
            System.clearProperty(CompileOptions.PROP_SIGNATURE_COMMENT);
        }

        @Test
        @DisplayName("TC-OPT-010: Properties override the defaults")
        void testProperties() {
            System.setProperty(CompileOptions.PROP_FORMAT, "false");
            System.setProperty(CompileOptions.PROP_TARGET, "sql.mysql");
            System.setProperty(CompileOptions.PROP_SIGNATURE_COMMENT, " FALSE ");

            CompileOptions options = CompileOptions.fromSystemProperties();

            assertThat(options.format()).isFalse();
            assertThat(options.target().dialect()).isEqualTo(Dialect.MYSQL);
            assertThat(options.signatureComment()).isFalse();
        }

        @Test
        @DisplayName("TC-OPT-011: Unset properties keep the defaults")
        void testNoProperties() {
            CompileOptions options = CompileOptions.fromSystemProperties();

            assertThat(options.format()).isTrue();
            assertThat(options.target()).isEqualTo(Target.GENERIC);
        }

        @Test
        @DisplayName("TC-OPT-012: Invalid values are rejected")
        void testInvalidValues() {
            System.setProperty(CompileOptions.PROP_FORMAT, "yes");
            assertThatThrownBy(CompileOptions::fromSystemProperties)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid value for prqlc.format: yes. Expected true or false");

            System.clearProperty(CompileOptions.PROP_FORMAT);
            System.setProperty(CompileOptions.PROP_TARGET, "sql.nope");
            assertThatThrownBy(CompileOptions::fromSystemProperties)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown target");
        }
    }
}

package com.migratorx.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

/**
 * Tests for {@link MigrationRunContextHolder}: thread-local storage, MDC bridge and scoped
 * execution.
 */
@DisplayName("MigrationRunContextHolder")
class MigrationRunContextHolderTest {

    @AfterEach
    void cleanup() {
        MigrationRunContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should return empty when no context is set")
        void shouldReturnEmpty() {
            assertThat(MigrationRunContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should populate and clear MDC")
        void shouldBridgeMdc() {
            MigrationRunContextHolder.set(new MigrationRunContext("run-1", "mysql57-to-80", "preflight", null));

            assertThat(MDC.get("runId")).isEqualTo("run-1");
            assertThat(MDC.get("migration")).isEqualTo("mysql57-to-80");
            assertThat(MDC.get("command")).isEqualTo("preflight");
            assertThat(MDC.get("target")).isNull();

            MigrationRunContextHolder.clear();

            assertThat(MDC.get("runId")).isNull();
            assertThat(MigrationRunContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should reject a null context and a blank run id")
        void shouldRejectInvalid() {
            assertThatThrownBy(() -> MigrationRunContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new MigrationRunContext(" ", null, null, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Scoped execution")
    class Scoped {

        @Test
        @DisplayName("should restore the previous context afterwards")
        void shouldRestorePrevious() {
            var outer = new MigrationRunContext("outer", null, "plan", null);
            var inner = new MigrationRunContext("inner", null, "promote", "db-replica-1");
            MigrationRunContextHolder.set(outer);
            AtomicReference<String> seen = new AtomicReference<>();

            MigrationRunContextHolder.runWithContext(inner, () -> seen.set(MDC.get("target")));

            assertThat(seen.get()).isEqualTo("db-replica-1");
            assertThat(MigrationRunContextHolder.get()).contains(outer);
            assertThat(MDC.get("target")).isNull();
        }

        @Test
        @DisplayName("should clear when nothing was set before and return the value")
        void shouldClearAfterCall() {
            String value = MigrationRunContextHolder.callWithContext(
                    new MigrationRunContext("r", null, null, null), () -> MDC.get("runId"));

            assertThat(value).isEqualTo("r");
            assertThat(MigrationRunContextHolder.get()).isEmpty();
        }
    }

    @Test
    @DisplayName("should fill in the migration name")
    void shouldAddMigration() {
        var context = new MigrationRunContext("r", null, "run", null).withMigration("orders-upgrade");

        assertThat(context.migration()).isEqualTo("orders-upgrade");
        assertThat(context.command()).isEqualTo("run");
    }
}

package com.migratorx.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;

import com.migratorx.workflow.Finding;
import com.migratorx.workflow.Findings;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SensitiveDataRedactor")
class SensitiveDataRedactorTest {

    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    @Test
    @DisplayName("should mask sensitive keys ignoring case and keep the rest")
    void shouldMaskKeys() {
        Finding finding = Finding.block("failed to connect", Findings.meta(
                "host", "db-replica-1", "DB_PASSWORD", "hunter2", "replicationToken", "abc"));

        Finding redacted = redactor.redact(finding);

        assertThat(redacted.metadata())
                .containsEntry("host", "db-replica-1")
                .containsEntry("DB_PASSWORD", SensitiveDataRedactor.REDACTED)
                .containsEntry("replicationToken", SensitiveDataRedactor.REDACTED);
        assertThat(redacted.message()).isEqualTo("failed to connect");
    }

    @Test
    @DisplayName("should return the same finding when nothing is sensitive")
    void shouldKeepCleanFinding() {
        Finding finding = Finding.info("ok", Findings.meta("table", "orders"));

        assertThat(redactor.redact(finding)).isSameAs(finding);
    }

    @Test
    @DisplayName("should redact nested maps")
    void shouldRedactNested() {
        Finding finding = Finding.warn("connector config", Findings.meta(
                "config", Map.of("database.hostname", "db", "database.password", "pw")));

        @SuppressWarnings("unchecked")
        Map<String, Object> nested = (Map<String, Object>) redactor.redact(finding).metadata().get("config");

        assertThat(nested).containsEntry("database.password", SensitiveDataRedactor.REDACTED)
                .containsEntry("database.hostname", "db");
    }

    @Test
    @DisplayName("should redact nested maps whose keys are not strings")
    void shouldRedactNestedWithNonStringKeys() {
        Finding finding = Finding.warn("worker config", Findings.meta(
                "workers", Map.of(1, "connect-1", "apiKey", "k-123")));

        Finding redacted = redactor.redact(finding);

        assertThat(redacted).isNotSameAs(finding);
        assertThat(redacted.metadata().get("workers")).asInstanceOf(MAP)
                .containsEntry("1", "connect-1")
                .containsEntry("apiKey", SensitiveDataRedactor.REDACTED);
    }

    @Test
    @DisplayName("should support custom fragments and null values")
    void shouldSupportCustomFragments() {
        var custom = new SensitiveDataRedactor(Set.of("ssn"));

        List<Finding> out = custom.redactAll(List.of(
                Finding.info("x", Findings.meta("customer_ssn", "123", "password", null))));

        assertThat(out.get(0).metadata())
                .containsEntry("customer_ssn", SensitiveDataRedactor.REDACTED)
                .containsEntry("password", null);
    }
}

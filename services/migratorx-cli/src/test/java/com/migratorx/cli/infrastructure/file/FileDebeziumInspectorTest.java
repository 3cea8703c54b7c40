package com.migratorx.cli.infrastructure.file;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.migratorx.cdc.ConnectorStatus;
import com.migratorx.cli.CliFixtures;
import com.migratorx.workflow.ExecutionContext;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("FileDebeziumInspector")
class FileDebeziumInspectorTest {

    @TempDir
    Path dir;

    private final ExecutionContext context = ExecutionContext.create();

    @Test
    @DisplayName("should parse connector and task states")
    void parsesStatus() throws IOException {
        Path file = CliFixtures.write(dir, "status.json", """
                {"name": "orders", "state": "RUNNING", "worker_id": "w1",
                 "tasks": [{"id": 0, "state": "RUNNING"}, {"id": 1, "state": "FAILED", "trace": "boom"}],
                 "restart_count": 4, "last_restart_at": "2024-05-01T10:00:00Z"}
                """);

        ConnectorStatus status = new FileDebeziumInspector(CliFixtures.mapper(), file).connectorStatus(context, "orders");

        assertThat(status.name()).isEqualTo("orders");
        assertThat(status.isRunning()).isTrue();
        assertThat(status.worker()).isEqualTo("w1");
        assertThat(status.tasks()).hasSize(2);
        assertThat(status.tasks().get(1).trace()).isEqualTo("boom");
        assertThat(status.restartCount()).isEqualTo(4);
        assertThat(status.lastRestartAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Test
    @DisplayName("should use the requested connector name when the file has none")
    void fillsMissingName() throws IOException {
        Path file = CliFixtures.write(dir, "status.json", CliFixtures.FAILED_STATUS);

        ConnectorStatus status = new FileDebeziumInspector(CliFixtures.mapper(), file).connectorStatus(context, "mysql-prod");

        assertThat(status.name()).isEqualTo("mysql-prod");
        assertThat(status.connectorState()).isEqualTo("FAILED");
    }

    @Test
    @DisplayName("should require a status file")
    void requiresFile() {
        assertThatThrownBy(() -> new FileDebeziumInspector(CliFixtures.mapper(), null).connectorStatus(context, "c"))
                .isInstanceOf(IOException.class)
                .hasMessage("cdc status file path is required");
    }
}

package com.migratorx.cli.infrastructure.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.migratorx.cdc.ConnectorStatus;
import com.migratorx.cdc.DebeziumInspector;
import com.migratorx.workflow.ExecutionContext;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Serves a Debezium connector status captured to a JSON file.
 *
 * <pre>
 * {"name": "orders", "state": "RUNNING", "worker_id": "connect-1:8083",
 *  "tasks": [{"id": 0, "state": "RUNNING", "worker_id": "connect-1:8083"}],
 *  "restart_count": 0, "last_restart_at": null}
 * </pre>
 *
 * A file without a name reports the requested connector name.
 */
public class FileDebeziumInspector implements DebeziumInspector {

    private final JsonFileReader reader;
    private final Path statusFile;

    public FileDebeziumInspector(ObjectMapper mapper, Path statusFile) {
        this.reader = new JsonFileReader(mapper);
        this.statusFile = statusFile;
    }

    @Override
    public ConnectorStatus connectorStatus(ExecutionContext context, String connector) throws IOException {
        if (statusFile == null) {
            throw new IOException("cdc status file path is required");
        }
        ConnectorStatus status = reader.read(statusFile, ConnectorStatus.class);
        if (status.name() == null || status.name().isBlank()) {
            return new ConnectorStatus(connector, status.connectorState(), status.worker(), status.tasks(),
                    status.restartCount(), status.lastRestartAt());
        }
        return status;
    }
}

package com.migratorx.cli.infrastructure.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.migratorx.checks.schema.SchemaInspector;
import com.migratorx.checks.schema.SchemaSnapshot;
import com.migratorx.workflow.ExecutionContext;
import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves schema snapshots exported to JSON files, one for the primary and one for the replica.
 *
 * <pre>
 * {"tables": [{"name": "orders", "primary_key": ["id"],
 *              "columns": [{"name": "id", "type": "bigint", "nullable": false}]}]}
 * </pre>
 */
public class FileSchemaInspector implements SchemaInspector {

    private static final Logger log = LoggerFactory.getLogger(FileSchemaInspector.class);

    private final JsonFileReader reader;
    private final String primaryHost;
    private final Path primaryFile;
    private final String replicaHost;
    private final Path replicaFile;

    public FileSchemaInspector(ObjectMapper mapper, String primaryHost, Path primaryFile,
                               String replicaHost, Path replicaFile) {
        this.reader = new JsonFileReader(mapper);
        this.primaryHost = primaryHost;
        this.primaryFile = primaryFile;
        this.replicaHost = replicaHost;
        this.replicaFile = replicaFile;
    }

    @Override
    public SchemaSnapshot schema(ExecutionContext context, String host) throws IOException {
        Path file = fileFor(host);
        log.debug("Reading schema of {} from {}", host, file);
        return reader.read(file, SchemaSnapshot.class);
    }

    private Path fileFor(String host) throws IOException {
        if (host == null || host.isBlank()) {
            throw new IOException("host is required");
        }
        Path file = null;
        if (host.equals(primaryHost)) {
            file = primaryFile;
        } else if (host.equals(replicaHost)) {
            file = replicaFile;
        }
        if (file == null) {
            throw new IOException("schema file path required for host \"" + host + "\"");
        }
        return file;
    }
}

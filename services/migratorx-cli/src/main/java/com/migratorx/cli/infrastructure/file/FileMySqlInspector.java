package com.migratorx.cli.infrastructure.file;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.migratorx.checks.mysql.MySqlInspector;
import com.migratorx.workflow.ExecutionContext;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Serves MySQL server settings of the primary captured to a JSON file.
 *
 * <pre>
 * {"sql_mode": "STRICT_TRANS_TABLES,NO_ZERO_DATE", "deprecated_features": ["QUERY_CACHE"]}
 * </pre>
 */
public class FileMySqlInspector implements MySqlInspector {

    private final JsonFileReader reader;
    private final Path file;

    public FileMySqlInspector(ObjectMapper mapper, Path file) {
        this.reader = new JsonFileReader(mapper);
        this.file = file;
    }

    @Override
    public String sqlMode(ExecutionContext context, String host) throws IOException {
        return load().sqlMode();
    }

    @Override
    public List<String> deprecatedFeaturesUsed(ExecutionContext context, String host) throws IOException {
        return load().deprecatedFeatures();
    }

    private ServerSettings load() throws IOException {
        if (file == null) {
            throw new IOException("mysql settings file path is required");
        }
        return reader.read(file, ServerSettings.class);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ServerSettings(
            @JsonProperty("sql_mode") String sqlMode,
            @JsonProperty("deprecated_features") List<String> deprecatedFeatures) {

        ServerSettings {
            sqlMode = sqlMode == null ? "" : sqlMode;
            deprecatedFeatures = deprecatedFeatures == null ? List.of() : List.copyOf(deprecatedFeatures);
        }
    }
}

package com.migratorx.cli.infrastructure.file;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.migratorx.cli.CliFixtures;
import com.migratorx.workflow.ExecutionContext;
import java.io.IOException;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("FileMySqlInspector")
class FileMySqlInspectorTest {

    @TempDir
    Path dir;

    private final ExecutionContext context = ExecutionContext.create();

    @Test
    @DisplayName("should read sql_mode and deprecated features")
    void readsSettings() throws IOException {
        Path file = CliFixtures.write(dir, "settings.json", """
                {"sql_mode": "STRICT_TRANS_TABLES,NO_AUTO_CREATE_USER", "deprecated_features": ["QUERY_CACHE"]}
                """);
        var inspector = new FileMySqlInspector(CliFixtures.mapper(), file);

        assertThat(inspector.sqlMode(context, "p")).isEqualTo("STRICT_TRANS_TABLES,NO_AUTO_CREATE_USER");
        assertThat(inspector.deprecatedFeaturesUsed(context, "p")).containsExactly("QUERY_CACHE");
    }

    @Test
    @DisplayName("should default absent settings to empty values")
    void defaultsAbsentSettings() throws IOException {
        Path file = CliFixtures.write(dir, "settings.json", "{}");
        var inspector = new FileMySqlInspector(CliFixtures.mapper(), file);

        assertThat(inspector.sqlMode(context, "p")).isEmpty();
        assertThat(inspector.deprecatedFeaturesUsed(context, "p")).isEmpty();
    }

    @Test
    @DisplayName("should require a settings file")
    void requiresFile() {
        assertThatThrownBy(() -> new FileMySqlInspector(CliFixtures.mapper(), null).sqlMode(context, "p"))
                .isInstanceOf(IOException.class)
                .hasMessage("mysql settings file path is required");
    }
}

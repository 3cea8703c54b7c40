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

@DisplayName("FileKafkaInspector")
class FileKafkaInspectorTest {

    @TempDir
    Path dir;

    private final ExecutionContext context = ExecutionContext.create();

    @Test
    @DisplayName("should answer topic existence, readability and tables from the snapshot")
    void answersFromSnapshot() throws IOException {
        Path file = CliFixtures.write(dir, "kafka.json", """
                {"topics": {
                  "dbhistory.orders": {"tables": ["shop.orders", "shop.customers"]},
                  "dbhistory.locked": {"readable": false}
                }}
                """);
        var inspector = new FileKafkaInspector(CliFixtures.mapper(), file);

        assertThat(inspector.topicExists(context, "dbhistory.orders")).isTrue();
        assertThat(inspector.topicReadable(context, "dbhistory.orders")).isTrue();
        assertThat(inspector.schemaHistoryTables(context, "dbhistory.orders"))
                .containsExactly("shop.orders", "shop.customers");

        assertThat(inspector.topicExists(context, "dbhistory.locked")).isTrue();
        assertThat(inspector.topicReadable(context, "dbhistory.locked")).isFalse();

        assertThat(inspector.topicExists(context, "unknown")).isFalse();
        assertThat(inspector.schemaHistoryTables(context, "unknown")).isEmpty();
    }

    @Test
    @DisplayName("should require a snapshot file")
    void requiresFile() {
        assertThatThrownBy(() -> new FileKafkaInspector(CliFixtures.mapper(), null).topicExists(context, "t"))
                .isInstanceOf(IOException.class)
                .hasMessage("schema history file path is required");
    }
}

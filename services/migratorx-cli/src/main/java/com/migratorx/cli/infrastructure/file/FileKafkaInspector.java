package com.migratorx.cli.infrastructure.file;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.migratorx.cdc.KafkaInspector;
import com.migratorx.workflow.ExecutionContext;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Serves schema history topic metadata captured to a JSON file.
 *
 * <pre>
 * {"topics": {"dbhistory.orders": {"readable": true, "tables": ["shop.orders"]}}}
 * </pre>
 */
public class FileKafkaInspector implements KafkaInspector {

    private final JsonFileReader reader;
    private final Path file;

    public FileKafkaInspector(ObjectMapper mapper, Path file) {
        this.reader = new JsonFileReader(mapper);
        this.file = file;
    }

    @Override
    public boolean topicExists(ExecutionContext context, String topic) throws IOException {
        return load().topics().containsKey(topic);
    }

    @Override
    public boolean topicReadable(ExecutionContext context, String topic) throws IOException {
        TopicSnapshot snapshot = load().topics().get(topic);
        return snapshot != null && snapshot.readable();
    }

    @Override
    public List<String> schemaHistoryTables(ExecutionContext context, String topic) throws IOException {
        TopicSnapshot snapshot = load().topics().get(topic);
        return snapshot == null ? List.of() : snapshot.tables();
    }

    private KafkaSnapshot load() throws IOException {
        if (file == null) {
            throw new IOException("schema history file path is required");
        }
        return reader.read(file, KafkaSnapshot.class);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record KafkaSnapshot(@JsonProperty("topics") Map<String, TopicSnapshot> topics) {

        KafkaSnapshot {
            topics = topics == null ? Map.of() : Map.copyOf(topics);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TopicSnapshot(@JsonProperty("readable") Boolean readableFlag, @JsonProperty("tables") List<String> tables) {

        TopicSnapshot {
            tables = tables == null ? List.of() : List.copyOf(tables);
        }

        /** Topics are readable unless the snapshot says otherwise. */
        boolean readable() {
            return readableFlag == null || readableFlag;
        }
    }
}

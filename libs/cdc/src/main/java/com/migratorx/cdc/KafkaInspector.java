package com.migratorx.cdc;

import com.migratorx.workflow.ExecutionContext;
import java.util.List;

/**
 * Read-only access to Kafka topics backing Debezium's schema history.
 */
public interface KafkaInspector {

    boolean topicExists(ExecutionContext context, String topic) throws Exception;

    boolean topicReadable(ExecutionContext context, String topic) throws Exception;

    /** Tables recorded in the schema history topic. */
    List<String> schemaHistoryTables(ExecutionContext context, String topic) throws Exception;
}

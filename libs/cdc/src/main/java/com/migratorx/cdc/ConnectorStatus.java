package com.migratorx.cdc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

/**
 * Live status of a Debezium connector.
 *
 * @param name           connector name
 * @param connectorState Kafka Connect state of the connector itself
 * @param worker         worker hosting the connector
 * @param tasks          task states
 * @param restartCount   restarts observed by the monitoring source
 * @param lastRestartAt  time of the latest restart, null when never restarted
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConnectorStatus(
        @JsonProperty("name") String name,
        @JsonProperty("state") String connectorState,
        @JsonProperty("worker_id") String worker,
        @JsonProperty("tasks") List<TaskStatus> tasks,
        @JsonProperty("restart_count") int restartCount,
        @JsonProperty("last_restart_at") Instant lastRestartAt) {

    public static final String RUNNING = "RUNNING";

    public ConnectorStatus {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public boolean isRunning() {
        return RUNNING.equals(connectorState);
    }
}

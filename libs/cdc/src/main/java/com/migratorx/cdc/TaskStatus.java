package com.migratorx.cdc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * State of one Debezium connector task.
 *
 * @param id     task number
 * @param state  Kafka Connect state, e.g. RUNNING, FAILED, PAUSED
 * @param worker worker the task is assigned to
 * @param trace  failure stack trace, when the task has failed
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskStatus(
        @JsonProperty("id") int id,
        @JsonProperty("state") String state,
        @JsonProperty("worker_id") String worker,
        @JsonProperty("trace") String trace) {

    public boolean isRunning() {
        return ConnectorStatus.RUNNING.equals(state);
    }
}

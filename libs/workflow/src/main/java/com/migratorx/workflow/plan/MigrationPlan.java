package com.migratorx.workflow.plan;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Declarative migration plan.
 *
 * <pre>
 * migration: mysql_57_to_80
 * source_version: "5.7"
 * target_version: "8.0"
 * topology:
 *   primary: mysql-primary
 *   replicas: [mysql-replica-1]
 * cdc:
 *   type: debezium
 *   connector: mysql-prod
 * steps: [preflight, upgrade_replica, validate_replica, cdc_check, promote, post_validation]
 * </pre>
 *
 * <p>Instances are plain data; use {@link PlanValidator} before acting on one.
 *
 * @param migration     migration name
 * @param sourceVersion version being upgraded from
 * @param targetVersion version being upgraded to
 * @param topology      primary/replica layout
 * @param cdc           change-data-capture settings
 * @param steps         ordered step names
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MigrationPlan(
        @JsonProperty("migration") String migration,
        @JsonProperty("source_version") String sourceVersion,
        @JsonProperty("target_version") String targetVersion,
        @JsonProperty("topology") Topology topology,
        @JsonProperty("cdc") CdcConfig cdc,
        @JsonProperty("steps") List<String> steps) {

    public MigrationPlan {
        topology = topology == null ? new Topology(null, List.of()) : topology;
        cdc = cdc == null ? new CdcConfig(null, null) : cdc;
        steps = steps == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(steps));
    }

    /** The replica targeted when the caller does not name one. */
    @JsonIgnore
    public Optional<String> firstReplica() {
        return topology.replicas().stream().findFirst();
    }

    /** Steps resolved to their canonical enum; unsupported names are dropped. */
    @JsonIgnore
    public List<PlanStep> resolvedSteps() {
        return steps.stream().map(PlanStep::fromName).flatMap(Optional::stream).toList();
    }
}

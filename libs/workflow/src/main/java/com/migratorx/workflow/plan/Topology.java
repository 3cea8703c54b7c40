package com.migratorx.workflow.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Primary/replica layout of the cluster being migrated. Exactly one primary; multi-primary
 * topologies are not supported.
 *
 * @param primary  primary host name
 * @param replicas replica host names, at least one
 */
public record Topology(String primary, List<String> replicas) {

    public Topology {
        replicas = replicas == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(replicas));
    }
}

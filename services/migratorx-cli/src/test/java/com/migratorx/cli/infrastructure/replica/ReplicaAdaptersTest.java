package com.migratorx.cli.infrastructure.replica;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.migratorx.replica.ReplicaUpgradeOrchestrator;
import com.migratorx.replica.ReplicaUpgradeResult;
import com.migratorx.replica.ReplicationStatus;
import com.migratorx.workflow.ExecutionContext;
import com.migratorx.workflow.Finding;
import com.migratorx.workflow.state.InMemoryCheckpointState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Command-line replica adapters")
class ReplicaAdaptersTest {

    private final ExecutionContext context = ExecutionContext.create();

    @Nested
    @DisplayName("StaticReplicaInspector")
    class Inspector {

        @Test
        @DisplayName("should treat only the configured primary as primary")
        void primaryByName() {
            var inspector = new StaticReplicaInspector("db-primary", ReplicationStatus.RUNNING);

            assertThat(inspector.isPrimary(context, "db-primary")).isTrue();
            assertThat(inspector.isPrimary(context, "db-replica")).isFalse();
            assertThat(inspector.isPrimary(context, null)).isFalse();
        }

        @Test
        @DisplayName("should report the given replication status for every replica")
        void reportsStatus() {
            var status = new ReplicationStatus(true, false);
            var inspector = new StaticReplicaInspector("db-primary", status);

            assertThat(inspector.replicationStatus(context, "db-replica")).isEqualTo(status);
        }

        @Test
        @DisplayName("should reject a missing status")
        void rejectsNullStatus() {
            assertThatThrownBy(() -> new StaticReplicaInspector("p", null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("SimulatedReplicaActions")
    class Simulated {

        @Test
        @DisplayName("should record every action in call order")
        void recordsActions() {
            var actions = new SimulatedReplicaActions();

            actions.stopReplication(context, "r1");
            actions.runUpgrade(context, "r1");
            actions.startReplication(context, "r1");

            assertThat(actions.performed())
                    .containsExactly("stop_replication:r1", "run_upgrade:r1", "start_replication:r1");
        }

        @Test
        @DisplayName("should let the orchestrator complete every phase")
        void drivesOrchestrator() {
            var actions = new SimulatedReplicaActions();
            var orchestrator = new ReplicaUpgradeOrchestrator(
                    new StaticReplicaInspector("p", ReplicationStatus.RUNNING), actions,
                    new InMemoryCheckpointState(), "p");

            ReplicaUpgradeResult result = orchestrator.run(context, "r1");

            assertThat(result.blocked()).isFalse();
            assertThat(result.findings()).extracting(Finding::message)
                    .containsExactly("replication stopped", "upgrade completed", "replication started");
            assertThat(actions.performed()).hasSize(3);
        }
    }

    @Nested
    @DisplayName("UnconfiguredReplicaActions")
    class Unconfigured {

        @Test
        @DisplayName("should fail every action with an explanatory message")
        void failsEveryAction() {
            var actions = new UnconfiguredReplicaActions();

            assertThatThrownBy(() -> actions.stopReplication(context, "r1"))
                    .isInstanceOf(UnsupportedOperationException.class)
                    .hasMessage(UnconfiguredReplicaActions.MESSAGE);
            assertThatThrownBy(() -> actions.runUpgrade(context, "r1"))
                    .hasMessage(UnconfiguredReplicaActions.MESSAGE);
            assertThatThrownBy(() -> actions.startReplication(context, "r1"))
                    .hasMessage(UnconfiguredReplicaActions.MESSAGE);
        }

        @Test
        @DisplayName("should make the orchestrator block before any checkpoint is written")
        void blocksOrchestrator() {
            var state = new InMemoryCheckpointState();
            var orchestrator = new ReplicaUpgradeOrchestrator(
                    new StaticReplicaInspector("p", ReplicationStatus.RUNNING), new UnconfiguredReplicaActions(),
                    state, "p");

            ReplicaUpgradeResult result = orchestrator.run(context, "r1");

            assertThat(result.blocked()).isTrue();
            assertThat(result.findings()).singleElement()
                    .extracting(Finding::message)
                    .isEqualTo("failed to stop replication: " + UnconfiguredReplicaActions.MESSAGE);
        }
    }
}

package com.migratorx.replica;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.migratorx.workflow.ExecutionContext;
import com.migratorx.workflow.WorkflowOutcome;
import com.migratorx.workflow.WorkflowRunResult;
import com.migratorx.workflow.WorkflowRunner;
import com.migratorx.workflow.state.InMemoryCheckpointState;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ReplicaUpgradeStep")
class ReplicaUpgradeStepTest {

    private ReplicaInspector inspector;
    private ReplicaActions actions;
    private ReplicaUpgradeStep step;

    @BeforeEach
    void setUp() throws Exception {
        inspector = mock(ReplicaInspector.class);
        actions = mock(ReplicaActions.class);
        when(inspector.isPrimary(any(), anyString())).thenReturn(false);
        when(inspector.replicationStatus(any(), anyString())).thenReturn(ReplicationStatus.RUNNING);
        step = new ReplicaUpgradeStep("upgrade_replica", inspector, actions, "db-primary", "db-replica-1");
    }

    @Test
    @DisplayName("should be refused by a runner that does not allow mutations")
    void shouldRequireMutationPermission() {
        WorkflowRunResult result = new WorkflowRunner(List.of(step), null, false)
                .run(ExecutionContext.create("step-test"));

        assertThat(result.outcome()).isEqualTo(WorkflowOutcome.BLOCKED);
        verifyNoInteractions(inspector, actions);
    }

    @Test
    @DisplayName("should upgrade the replica and complete when mutations are allowed")
    void shouldUpgrade() throws Exception {
        var state = new InMemoryCheckpointState();
        var context = ExecutionContext.create("step-test");

        WorkflowRunResult result = new WorkflowRunner(List.of(step), state, true).run(context);

        assertThat(result.outcome()).isEqualTo(WorkflowOutcome.COMPLETED);
        assertThat(result.summary().info()).isEqualTo(3);
        assertThat(state.isCompleted("upgrade_replica")).isTrue();
        verify(actions).runUpgrade(context, "db-replica-1");
    }

    @Test
    @DisplayName("should reject missing collaborators at construction")
    void shouldRejectNullCollaborators() {
        assertThatThrownBy(() -> new ReplicaUpgradeStep("upgrade_replica", null, actions, "db-primary", "db-replica-1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("inspector");
        assertThatThrownBy(() -> new ReplicaUpgradeStep("upgrade_replica", inspector, null, "db-primary", "db-replica-1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("actions");
    }
}

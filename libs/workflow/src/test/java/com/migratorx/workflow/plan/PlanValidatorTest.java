package com.migratorx.workflow.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PlanValidator")
class PlanValidatorTest {

    private static MigrationPlan plan(String... steps) {
        return new MigrationPlan("mysql_57_to_80", "5.7", "8.0",
                new Topology("mysql-primary", List.of("mysql-replica-1")),
                new CdcConfig("debezium", "mysql-prod"), Arrays.asList(steps));
    }

    @Nested
    @DisplayName("valid plans")
    class ValidPlans {

        @Test
        @DisplayName("full canonical step list passes")
        void fullPlan() {
            var result = PlanValidator.validate(plan("preflight", "upgrade_replica",
                    "validate_replica", "cdc_check", "promote", "post_validation"));
            assertThat(result.valid()).isTrue();
            assertThat(result.errors()).isEmpty();
        }

        @Test
        @DisplayName("steps may be omitted as long as order is kept")
        void omittedSteps() {
            assertThat(PlanValidator.validate(plan("preflight", "cdc_check", "promote")).valid())
                    .isTrue();
        }
    }

    @Nested
    @DisplayName("invalid plans")
    class InvalidPlans {

        @Test
        @DisplayName("reports every missing field at once")
        void missingFields() {
            var result = PlanValidator.validate(
                    new MigrationPlan(null, " ", null, null, null, null));
            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).contains(
                    "migration is required",
                    "source_version is required",
                    "target_version is required",
                    "topology.primary is required",
                    "topology.replicas must include at least one replica",
                    "cdc.type is required",
                    "cdc.connector is required",
                    "steps must include at least one step");
        }

        @Test
        @DisplayName("blank replica entry is reported with its index")
        void blankReplica() {
            var plan = new MigrationPlan("m", "5.7", "8.0",
                    new Topology("p", Arrays.asList("r1", " ")),
                    new CdcConfig("debezium", "c"), List.of("preflight"));
            assertThat(PlanValidator.validate(plan).errors())
                    .containsExactly("topology.replicas[1] is empty");
        }

        @Test
        @DisplayName("unsupported step fails")
        void unsupportedStep() {
            assertThat(PlanValidator.validate(plan("preflight", "unknown_step")).errors())
                    .singleElement().asString().contains("not supported");
        }

        @Test
        @DisplayName("reordered steps fail")
        void invalidOrder() {
            assertThat(PlanValidator.validate(plan("validate_replica", "preflight")).errors())
                    .singleElement().asString().contains("step order invalid");
        }

        @Test
        @DisplayName("duplicated step fails")
        void duplicateStep() {
            assertThat(PlanValidator.validate(plan("preflight", "preflight")).errors())
                    .singleElement().asString().contains("duplicated");
        }

        @Test
        @DisplayName("validateOrThrow joins every problem into one message")
        void validateOrThrow() {
            assertThatThrownBy(() -> PlanValidator.validateOrThrow(plan("promote", "preflight", "")))
                    .isInstanceOf(PlanValidationException.class)
                    .hasMessageStartingWith("migration plan validation failed: ")
                    .hasMessageContaining("step order invalid")
                    .hasMessageContaining("steps[2] is empty");
        }
    }

    @Test
    @DisplayName("resolves steps and the first replica")
    void resolution() {
        var plan = plan("preflight", "promote");
        assertThat(plan.resolvedSteps()).containsExactly(PlanStep.PREFLIGHT, PlanStep.PROMOTE);
        assertThat(plan.firstReplica()).contains("mysql-replica-1");
    }
}

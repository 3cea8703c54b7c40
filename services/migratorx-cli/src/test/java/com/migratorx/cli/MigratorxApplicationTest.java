package com.migratorx.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.migratorx.cli.command.MigratorxCommandRunner;
import com.migratorx.cli.config.MigratorxProperties;
import com.migratorx.observability.FindingMetrics;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/**
 * Loads the full Spring context. Started without arguments, the runner reports a usage error
 * instead of executing a command.
 */
@SpringBootTest
@DisplayName("migratorx application")
class MigratorxApplicationTest {

    @Autowired private ApplicationContext context;
    @Autowired private MigratorxProperties properties;

    @Test
    @DisplayName("Spring context loads with the command runner and metrics")
    void contextLoads() {
        assertThat(context.getBean(MigratorxCommandRunner.class)).isNotNull();
        assertThat(context.getBean(FindingMetrics.class)).isNotNull();
    }

    @Test
    @DisplayName("properties are bound from application.yml")
    void propertiesAreBound() {
        assertThat(properties.confirmationPhrase()).isEqualTo("PROMOTE");
        assertThat(properties.requiredPromotionChecks()).containsExactly("cdc_debezium_health", "schema_parity");
        assertThat(properties.restartLoop().window()).isEqualTo(Duration.ofMinutes(10));
        assertThat(properties.exitCodes().usage()).isEqualTo(64);
    }

    @Test
    @DisplayName("runner reports the usage exit code when no command is given")
    void runnerWithoutArguments() {
        assertThat(context.getBean(MigratorxCommandRunner.class).getExitCode()).isEqualTo(64);
    }
}

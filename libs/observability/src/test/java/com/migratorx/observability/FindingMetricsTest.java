package com.migratorx.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.migratorx.workflow.Finding;
import com.migratorx.workflow.Summary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FindingMetrics")
class FindingMetricsTest {

    private SimpleMeterRegistry registry;
    private FindingMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new FindingMetrics(registry);
    }

    @Test
    @DisplayName("should count findings per severity and component")
    void shouldCountFindings() {
        Summary summary = metrics.record("preflight", List.of(
                Finding.info("a"), Finding.warn("b"), Finding.warn("c"), Finding.block("d")));

        assertThat(summary).isEqualTo(new Summary(1, 2, 1));
        assertThat(registry.get(FindingMetrics.FINDINGS_METRIC)
                .tags("component", "preflight", "severity", "warn").counter().count()).isEqualTo(2.0);
        assertThat(registry.get(FindingMetrics.FINDINGS_METRIC)
                .tags("component", "preflight", "severity", "block").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should accumulate across calls")
    void shouldAccumulate() {
        metrics.record("cdc", List.of(Finding.info("ok")));
        metrics.record("cdc", List.of(Finding.info("ok")));

        assertThat(registry.get(FindingMetrics.FINDINGS_METRIC)
                .tags("component", "cdc", "severity", "info").counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("should time a run")
    void shouldTime() {
        Timer timer = metrics.timer("upgrade");
        timer.record(Duration.ofMillis(150));

        assertThat(registry.get(FindingMetrics.DURATION_METRIC).tag("component", "upgrade").timer().count())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("should reject a null registry and a blank component")
    void shouldRejectInvalid() {
        assertThatThrownBy(() -> new FindingMetrics(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> metrics.record(" ", List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}

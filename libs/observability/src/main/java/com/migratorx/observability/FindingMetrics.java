package com.migratorx.observability;

import com.migratorx.workflow.Finding;
import com.migratorx.workflow.Severity;
import com.migratorx.workflow.Summary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.Collection;
import java.util.Locale;

/**
 * Records findings and run durations in a Micrometer {@link MeterRegistry}.
 * <p>
 * Findings are counted in {@value #FINDINGS_METRIC} tagged by {@code severity} and
 * {@code component} (the command or check that produced them). Run durations go to
 * {@value #DURATION_METRIC} tagged by {@code component}.
 */
public final class FindingMetrics {

    public static final String FINDINGS_METRIC = "migratorx.findings";
    public static final String DURATION_METRIC = "migratorx.run.duration";

    public static final String TAG_SEVERITY = "severity";
    public static final String TAG_COMPONENT = "component";

    private final MeterRegistry registry;

    public FindingMetrics(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    /**
     * Counts every finding under its severity.
     *
     * @return the summary of what was recorded
     */
    public Summary record(String component, Collection<Finding> findings) {
        requireComponent(component);
        Summary summary = Summary.of(findings);
        for (Severity severity : Severity.values()) {
            int count = summary.count(severity);
            if (count > 0) {
                counter(component, severity).increment(count);
            }
        }
        return summary;
    }

    public Counter counter(String component, Severity severity) {
        requireComponent(component);
        return Counter.builder(FINDINGS_METRIC)
                .description("Findings emitted by migratorx")
                .tags(Tags.of(TAG_COMPONENT, component, TAG_SEVERITY, severity.name().toLowerCase(Locale.ROOT)))
                .register(registry);
    }

    public Timer timer(String component) {
        requireComponent(component);
        return Timer.builder(DURATION_METRIC)
                .description("Duration of a migratorx command")
                .tags(Tags.of(TAG_COMPONENT, component))
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    private static void requireComponent(String component) {
        if (component == null || component.isBlank()) {
            throw new IllegalArgumentException("component must not be null or blank");
        }
    }
}

package com.migratorx.workflow.plan;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a YAML migration plan from disk and validates it.
 */
public final class PlanLoader {

    private static final Logger log = LoggerFactory.getLogger(PlanLoader.class);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private PlanLoader() {
        // utility class
    }

    /**
     * Loads and validates the plan at {@code path}.
     *
     * @throws PlanValidationException if the path is missing, the file cannot be parsed, or the
     *     plan is invalid
     */
    public static MigrationPlan load(Path path) {
        if (path == null || path.toString().isBlank()) {
            throw new PlanValidationException(
                    PlanValidationResult.fail(List.of("plan path is required")));
        }
        if (!Files.isRegularFile(path)) {
            throw new PlanValidationException(
                    PlanValidationResult.fail(List.of("plan file not found: " + path)));
        }
        MigrationPlan plan;
        try {
            plan = YAML.readValue(path.toFile(), MigrationPlan.class);
        } catch (IOException e) {
            throw new PlanValidationException("failed to parse migration plan " + path + ": "
                    + e.getMessage(), e);
        }
        if (plan == null) {
            throw new PlanValidationException(
                    PlanValidationResult.fail(List.of("plan file is empty: " + path)));
        }
        PlanValidator.validateOrThrow(plan);
        log.info("Loaded migration plan '{}' ({} -> {}) with steps {}",
                plan.migration(), plan.sourceVersion(), plan.targetVersion(), plan.steps());
        return plan;
    }
}

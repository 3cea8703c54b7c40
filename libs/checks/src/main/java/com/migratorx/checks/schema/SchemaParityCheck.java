package com.migratorx.checks.schema;

import com.migratorx.checks.Check;
import com.migratorx.checks.CheckInput;
import com.migratorx.workflow.ExecutionContext;
import com.migratorx.workflow.Finding;
import com.migratorx.workflow.Findings;
import java.util.List;

/**
 * Read-only check comparing the primary schema with a replica's.
 *
 * <p>Hosts given at construction take precedence; otherwise they come from the {@link CheckInput}.
 * Inspector failures and missing hosts are reported as BLOCK findings. When the schemas match a
 * single INFO is emitted.
 */
public class SchemaParityCheck implements Check {

    public static final String NAME = "schema_parity";

    private final SchemaInspector inspector;
    private final String primaryHost;
    private final String replicaHost;

    public SchemaParityCheck(SchemaInspector inspector) {
        this(inspector, null, null);
    }

    public SchemaParityCheck(SchemaInspector inspector, String primaryHost, String replicaHost) {
        if (inspector == null) {
            throw new IllegalArgumentException("schema inspector must not be null");
        }
        this.inspector = inspector;
        this.primaryHost = primaryHost;
        this.replicaHost = replicaHost;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean readOnly() {
        return true;
    }

    @Override
    public List<Finding> run(ExecutionContext context, CheckInput input) {
        String primary = firstNonBlank(primaryHost, input.primaryHost());
        String replica = firstNonBlank(replicaHost, input.replicaHost());
        if (primary == null || replica == null) {
            return List.of(Finding.block("primary and replica hosts are required",
                    Findings.meta("primary", primary, "replica", replica)));
        }

        SchemaSnapshot primarySchema;
        try {
            primarySchema = inspector.schema(context, primary);
        } catch (Exception e) {
            restoreInterrupt(e);
            return List.of(Finding.block("failed to read primary schema: " + e.getMessage(),
                    Findings.meta("host", primary)));
        }
        SchemaSnapshot replicaSchema;
        try {
            replicaSchema = inspector.schema(context, replica);
        } catch (Exception e) {
            restoreInterrupt(e);
            return List.of(Finding.block("failed to read replica schema: " + e.getMessage(),
                    Findings.meta("host", replica)));
        }

        List<Finding> findings = SchemaParity.compare(primarySchema, replicaSchema);
        if (findings.isEmpty()) {
            return List.of(Finding.info("schema parity verified",
                    Findings.meta("primary", primary, "replica", replica)));
        }
        return findings;
    }

    private static void restoreInterrupt(Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
    }

    private static String firstNonBlank(String preferred, String fallback) {
        if (preferred != null && !preferred.isBlank()) {
            return preferred;
        }
        return fallback == null || fallback.isBlank() ? null : fallback;
    }
}

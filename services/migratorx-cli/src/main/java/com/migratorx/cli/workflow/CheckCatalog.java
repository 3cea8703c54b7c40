package com.migratorx.cli.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.migratorx.cdc.DebeziumHealthCheck;
import com.migratorx.cdc.SchemaHistoryCheck;
import com.migratorx.checks.Check;
import com.migratorx.checks.mysql.CompatibilityRules;
import com.migratorx.checks.mysql.MySqlCompatibilityCheck;
import com.migratorx.checks.schema.SchemaParityCheck;
import com.migratorx.cli.config.MigratorxProperties;
import com.migratorx.cli.infrastructure.file.FileDebeziumInspector;
import com.migratorx.cli.infrastructure.file.FileKafkaInspector;
import com.migratorx.cli.infrastructure.file.FileMySqlInspector;
import com.migratorx.cli.infrastructure.file.FileSchemaInspector;
import com.migratorx.workflow.plan.MigrationPlan;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the checks of one invocation from the plan, the configured properties and the snapshot
 * files named on the command line.
 */
public class CheckCatalog {

    private final ObjectMapper mapper;
    private final MigratorxProperties properties;
    private final Clock clock;
    private final MigrationPlan plan;
    private final CheckSources sources;

    public CheckCatalog(ObjectMapper mapper, MigratorxProperties properties, Clock clock,
                        MigrationPlan plan, CheckSources sources) {
        this.mapper = mapper;
        this.properties = properties;
        this.clock = clock;
        this.plan = plan;
        this.sources = sources == null ? CheckSources.NONE : sources;
    }

    public Check schemaParity(String replica) {
        String primary = plan.topology().primary();
        var inspector = new FileSchemaInspector(mapper, primary, sources.schemaPrimary(), replica,
                sources.schemaReplica());
        return new SchemaParityCheck(inspector, primary, replica);
    }

    public Check debeziumHealth() {
        return new DebeziumHealthCheck(new FileDebeziumInspector(mapper, sources.cdcStatus()),
                plan.cdc().connector(), properties.restartLoop().window(),
                properties.restartLoop().maxRestarts(), clock);
    }

    /** Present only when a settings file was given. */
    public List<Check> mysqlCompatibility() {
        if (sources.mysqlSettings() == null) {
            return List.of();
        }
        String primary = plan.topology().primary();
        var schemas = new FileSchemaInspector(mapper, primary, sources.schemaPrimary(), null, null);
        return List.of(new MySqlCompatibilityCheck(new FileMySqlInspector(mapper, sources.mysqlSettings()),
                schemas, primary, CompatibilityRules.mysql57To80()));
    }

    /** Present only when a topic is configured and a history file was given. */
    public List<Check> schemaHistory() {
        String topic = properties.schemaHistoryTopic();
        if (topic == null || topic.isBlank() || sources.schemaHistory() == null) {
            return List.of();
        }
        return List.of(new SchemaHistoryCheck(new FileKafkaInspector(mapper, sources.schemaHistory()),
                topic, properties.expectedTables()));
    }

    public List<Check> preflight(String replica) {
        List<Check> checks = new ArrayList<>();
        checks.add(schemaParity(replica));
        checks.add(debeziumHealth());
        checks.addAll(mysqlCompatibility());
        checks.addAll(schemaHistory());
        return checks;
    }

    public List<Check> cdc() {
        List<Check> checks = new ArrayList<>();
        checks.add(debeziumHealth());
        checks.addAll(schemaHistory());
        return checks;
    }

    public List<Check> promotion(String replica) {
        List<Check> checks = new ArrayList<>();
        checks.add(schemaParity(replica));
        checks.add(debeziumHealth());
        checks.addAll(schemaHistory());
        return checks;
    }

    public MigrationPlan plan() {
        return plan;
    }
}

package com.migratorx.cli;

import com.migratorx.cli.config.MigratorxProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * migratorx command-line entry point.
 *
 * <p>Runs as a non-web Spring Boot application: the command is executed by
 * {@link com.migratorx.cli.command.MigratorxCommandRunner} during startup and the process exits
 * with the code it reports. Findings are printed to stdout as JSON; logs go to stderr.
 *
 * <pre>
 * migratorx plan --plan=migration.yaml
 * migratorx preflight --plan=migration.yaml --schema-primary=p.json --schema-replica=r.json --cdc-status=s.json
 * migratorx upgrade replica db-replica-1 --plan=migration.yaml --simulate
 * migratorx promote --plan=migration.yaml --confirm=PROMOTE ...
 * </pre>
 */
@SpringBootApplication
@EnableConfigurationProperties(MigratorxProperties.class)
public class MigratorxApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(MigratorxApplication.class, args)));
    }
}

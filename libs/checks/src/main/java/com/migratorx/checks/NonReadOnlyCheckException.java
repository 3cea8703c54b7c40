package com.migratorx.checks;

import com.migratorx.workflow.MigrationConfigurationException;

/**
 * Thrown by {@link ChecksRunner} when a check does not report itself read-only.
 */
public class NonReadOnlyCheckException extends MigrationConfigurationException {

    private final String checkName;

    public NonReadOnlyCheckException(String checkName) {
        super(String.format("check \"%s\" is not read-only", checkName));
        this.checkName = checkName;
    }

    public String checkName() {
        return checkName;
    }
}

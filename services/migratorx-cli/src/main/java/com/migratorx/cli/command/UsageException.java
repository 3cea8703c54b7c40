package com.migratorx.cli.command;

/**
 * Unknown command, missing positional argument or malformed option. Reported with the usage text
 * instead of a findings payload.
 */
public class UsageException extends RuntimeException {

    public UsageException(String message) {
        super(message);
    }
}

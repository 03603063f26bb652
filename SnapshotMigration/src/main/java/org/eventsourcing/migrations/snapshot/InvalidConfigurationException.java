package org.eventsourcing.migrations.snapshot;

/**
 * The configuration file or the command line options cannot describe a runnable migration.
 */
public class InvalidConfigurationException extends RuntimeException {
    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

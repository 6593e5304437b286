package dev.univer.worktracker.error;

public class MigrationFailedException extends RosterException {

    public MigrationFailedException(String message) {
        super(message);
    }

    public MigrationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}

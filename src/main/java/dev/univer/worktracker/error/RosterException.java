package dev.univer.worktracker.error;

/**
 * Base of every failure the roster core reports to its callers.
 */
public abstract class RosterException extends RuntimeException {

    protected RosterException(String message) {
        super(message);
    }

    protected RosterException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Whether repeating the same call unchanged can succeed. */
    public boolean isRetryable() {
        return false;
    }
}

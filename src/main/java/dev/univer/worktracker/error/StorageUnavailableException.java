package dev.univer.worktracker.error;

/**
 * The store could not complete the operation; nothing was committed.
 * Callers retry the whole batch, never a part of it.
 */
public class StorageUnavailableException extends RosterException {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}

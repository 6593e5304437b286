package dev.univer.worktracker.migration;

/**
 * Start-up migration states, in execution order. FAILED can follow any of them.
 */
public enum MigrationPhase {
    NOT_STARTED,
    BACKFILLING_KEYS,
    DEDUPLICATING,
    CONSTRAINT_APPLIED,
    DONE,
    FAILED;

    public boolean isAfter(MigrationPhase other) {
        return ordinal() > other.ordinal();
    }
}

package dev.univer.worktracker.migration;

import dev.univer.worktracker.error.StorageUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Holds the migration state machine. Reads and writes of entries pass through
 * {@link #ensureServing()} and are refused until the migration reached DONE.
 */
@Component
@Slf4j
public class MigrationGate {

    private volatile MigrationPhase phase = MigrationPhase.NOT_STARTED;

    public MigrationPhase current() {
        return phase;
    }

    public boolean isServing() {
        return phase == MigrationPhase.DONE;
    }

    public void ensureServing() {
        MigrationPhase p = phase;
        if (p != MigrationPhase.DONE) {
            throw new StorageUnavailableException("Entry store is not ready, migration state: " + p);
        }
    }

    void moveTo(MigrationPhase next) {
        MigrationPhase prev = phase;
        phase = next;
        if (prev != next) log.info("Migration state {} -> {}", prev, next);
    }
}

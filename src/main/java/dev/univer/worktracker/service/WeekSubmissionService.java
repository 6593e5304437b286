package dev.univer.worktracker.service;

import dev.univer.worktracker.config.RosterProperties;
import dev.univer.worktracker.error.StorageUnavailableException;
import dev.univer.worktracker.migration.MigrationGate;
import dev.univer.worktracker.model.DayEntry;
import dev.univer.worktracker.model.DayRecord;
import dev.univer.worktracker.util.IdentityNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;

/**
 * Applies "this person worked here on these days" as one all-or-nothing write.
 * Only the submitted days are touched; other days of the week stay as they were.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WeekSubmissionService {
    private final EntryStore entryStore;
    private final MigrationGate migrationGate;
    private final TransactionTemplate transactionTemplate;
    private final RosterProperties props;
    private final Clock clock;

    // unique violation, serialization failure, PostgreSQL deadlock, H2 concurrent update
    private static final Set<String> RACE_SQL_STATES = Set.of("23505", "40001", "40P01", "90131");

    public record SubmissionResult(int acceptedCount, int inserted, int updated) {}

    public SubmissionResult submitWeek(String displayName, List<DayRecord> records) {
        String userKey = IdentityNormalizer.normalize(displayName);
        List<DayEntry> days = SubmissionValidator.validate(records);
        migrationGate.ensureServing();

        int maxAttempts = Math.max(1, props.getSubmission().getMaxAttempts());
        for (int attempt = 1; ; attempt++) {
            try {
                SubmissionResult result = transactionTemplate.execute(status -> applyBatch(userKey, displayName, days));
                log.info("Submitted {} days for '{}' ({} inserted, {} updated)",
                         result.acceptedCount(), userKey, result.inserted(), result.updated());
                return result;
            } catch (DataAccessException e) {
                if (!lostRace(e)) {
                    log.error("Submission for '{}' rolled back", userKey, e);
                    throw new StorageUnavailableException("Could not store entries: " + e.getMessage(), e);
                }
                if (attempt >= maxAttempts) {
                    log.warn("Giving up on '{}' after {} attempts: {}", userKey, attempt, e.getMessage());
                    throw new StorageUnavailableException("Concurrent update for " + displayName + ", retry the submission", e);
                }
                log.debug("Attempt {} for '{}' lost a race, retrying: {}", attempt, userKey, e.getMessage());
                backoff(attempt);
            } catch (TransactionException e) {
                log.error("Submission for '{}' rolled back", userKey, e);
                throw new StorageUnavailableException("Could not store entries: " + e.getMessage(), e);
            }
        }
    }

    private SubmissionResult applyBatch(String userKey, String displayName, List<DayEntry> days) {
        Instant now = Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
        int inserted = 0, updated = 0;
        for (DayEntry day : days) {
            if (entryStore.upsertOne(userKey, displayName, day, now) == EntryStore.UpsertOutcome.INSERTED) inserted++;
            else updated++;
        }
        return new SubmissionResult(inserted + updated, inserted, updated);
    }

    // another writer got the same (user_key, entry_date) first, or the database chose us as the victim
    static boolean lostRace(DataAccessException e) {
        if (e instanceof DataIntegrityViolationException || e instanceof TransientDataAccessException) return true;
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException && RACE_SQL_STATES.contains(String.valueOf(((SQLException) t).getSQLState()))) {
                return true;
            }
        }
        return false;
    }

    private void backoff(int attempt) {
        long millis = props.getSubmission().getRetryBackoff().toMillis() * attempt;
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageUnavailableException("Interrupted while retrying the submission", e);
        }
    }
}

package dev.univer.worktracker.service;

import dev.univer.worktracker.migration.MigrationGate;
import dev.univer.worktracker.model.Entry;
import dev.univer.worktracker.util.IdentityNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * Read side of the roster. Users are always looked up by user key, so case variants of
 * a name read as one person, the same way they are written.
 */
@Service
@RequiredArgsConstructor
public class RosterQueryService {
    /** Monday to Friday. */
    public static final int BUSINESS_DAYS = 5;

    private final EntryStore entryStore;
    private final MigrationGate migrationGate;

    public List<Entry> getWeekForUser(String displayName, LocalDate weekStart) {
        String userKey = IdentityNormalizer.normalize(displayName);
        migrationGate.ensureServing();
        return entryStore.getByUserAndDateRange(userKey, weekStart, weekEnd(weekStart));
    }

    public List<Entry> getWeekSummary(LocalDate weekStart) {
        migrationGate.ensureServing();
        return entryStore.getAllInRange(weekStart, weekEnd(weekStart));
    }

    /** Known display names, latest capitalization per person; all time when weekStart is null. */
    public List<String> listKnownUsers(LocalDate weekStart) {
        migrationGate.ensureServing();
        if (weekStart == null) return entryStore.listDistinctUsersInRange(null, null);
        return entryStore.listDistinctUsersInRange(weekStart, weekEnd(weekStart));
    }

    public List<Entry> getEntries(LocalDate from, LocalDate to) {
        migrationGate.ensureServing();
        return entryStore.getAllInRange(from, to);
    }

    public boolean deleteEntry(Long id) {
        migrationGate.ensureServing();
        return entryStore.deleteById(id);
    }

    public static LocalDate weekEnd(LocalDate weekStart) {
        return weekStart.plusDays(BUSINESS_DAYS - 1);
    }
}

package dev.univer.worktracker.migration;

import dev.univer.worktracker.config.RosterProperties;
import dev.univer.worktracker.error.InvalidIdentityException;
import dev.univer.worktracker.error.MigrationFailedException;
import dev.univer.worktracker.model.Location;
import dev.univer.worktracker.util.IdentityNormalizer;
import dev.univer.worktracker.util.ParseUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Brings the entries table up to the current schema before anything reads or writes it.
 * Rows of the old {@code entry} table (text dates, no user key) are imported first, then
 * user keys are backfilled, location labels and client qualifiers repaired,
 * (user_key, entry_date) duplicates removed and the unique constraint added.
 * Runs while the context starts, so a failure stops the application.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MigrationRunner implements InitializingBean {

    static final String ENTRIES = "entries";
    static final String MARKER = "roster_migration";
    static final String UNIQUE_CONSTRAINT = "uq_entries_user_key_date";
    static final String LEGACY = "entry";
    static final String LEGACY_ARCHIVE = "entry_legacy";
    static final String UNRECORDED_QUALIFIER = "Not recorded";

    private static final List<MigrationPhase> STEPS = List.of(
            MigrationPhase.BACKFILLING_KEYS,
            MigrationPhase.DEDUPLICATING,
            MigrationPhase.CONSTRAINT_APPLIED);

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;
    private final SchemaInspector schema;
    private final MigrationGate gate;
    private final RosterProperties props;
    private final Clock clock;

    private volatile MigrationReport lastReport = MigrationReport.empty();

    public record MigrationReport(int legacyRowsImported, int keysBackfilled, int locationsRewritten,
                                  int qualifiersRepaired, int duplicatesRemoved, boolean constraintCreated) {
        static MigrationReport empty() { return new MigrationReport(0, 0, 0, 0, 0, false); }
    }

    @Override
    public void afterPropertiesSet() {
        if (props.getMigration().isEnabled()) {
            migrate();
        } else {
            verifyOnly();
        }
    }

    /** Resumes after the last phase recorded in the marker table. */
    public MigrationReport migrate() {
        return run(false);
    }

    /** Runs every phase regardless of the marker. Each phase is a no-op on a migrated store. */
    public MigrationReport runAllPhases() {
        return run(true);
    }

    public MigrationReport getLastReport() {
        return lastReport;
    }

    public Optional<MigrationPhase> recordedPhase() {
        if (!schema.tableExists(MARKER)) return Optional.empty();
        List<String> phases = jdbc.queryForList("SELECT phase FROM " + MARKER + " WHERE id = 1", String.class);
        if (phases.isEmpty()) return Optional.empty();
        try {
            return Optional.of(MigrationPhase.valueOf(phases.get(0)));
        } catch (IllegalArgumentException e) {
            throw new MigrationFailedException("Unrecognised phase '" + phases.get(0) + "' in " + MARKER, e);
        }
    }

    private synchronized MigrationReport run(boolean force) {
        int imported = 0, keys = 0, locations = 0, qualifiers = 0, removed = 0;
        boolean created = false;
        try {
            prepare();
            MigrationPhase completed = force ? MigrationPhase.NOT_STARTED
                                             : recordedPhase().orElse(MigrationPhase.NOT_STARTED);
            if (completed == MigrationPhase.DONE && !schema.uniqueConstraintExists(ENTRIES, UNIQUE_CONSTRAINT)) {
                log.warn("Marker says DONE but {} is missing; migrating again from the start", UNIQUE_CONSTRAINT);
                completed = MigrationPhase.NOT_STARTED;
            }
            if (completed != MigrationPhase.NOT_STARTED && schema.tableExists(LEGACY)) {
                log.warn("Table {} is present again; migrating again from the start", LEGACY);
                completed = MigrationPhase.NOT_STARTED;
            }

            for (MigrationPhase step : STEPS) {
                if (!step.isAfter(completed)) {
                    log.info("Migration phase {} already completed, skipping", step);
                    continue;
                }
                gate.moveTo(step);
                switch (step) {
                    case BACKFILLING_KEYS -> {
                        int[] counts = inTx(step, () -> {
                            int i = importLegacyTable();
                            int k = backfillKeys();
                            int l = rewriteLegacyLocations();
                            int q = repairQualifiers();
                            return new int[]{i, k, l, q};
                        });
                        imported = counts[0];
                        keys = counts[1];
                        locations = counts[2];
                        qualifiers = counts[3];
                    }
                    case DEDUPLICATING -> removed = inTx(step, this::deduplicate);
                    case CONSTRAINT_APPLIED -> created = inTx(step, this::applyConstraint);
                    default -> throw new IllegalStateException("Unexpected step " + step);
                }
            }

            recordPhase(MigrationPhase.DONE);
            gate.moveTo(MigrationPhase.DONE);
            lastReport = new MigrationReport(imported, keys, locations, qualifiers, removed, created);
            log.info("Entry store migrated: {} legacy rows imported, {} keys backfilled, {} locations rewritten, " +
                     "{} qualifiers repaired, {} duplicates removed, constraint {}",
                     imported, keys, locations, qualifiers, removed, created ? "created" : "already present");
            return lastReport;
        } catch (MigrationFailedException e) {
            gate.moveTo(MigrationPhase.FAILED);
            log.error("Migration failed: {}", e.getMessage());
            throw e;
        } catch (DataAccessException | TransactionException e) {
            MigrationPhase at = gate.current();
            gate.moveTo(MigrationPhase.FAILED);
            log.error("Migration failed in state {}", at, e);
            throw new MigrationFailedException("Migration aborted: " + e.getMessage(), e);
        }
    }

    private void verifyOnly() {
        if (schema.tableExists(ENTRIES) && schema.uniqueConstraintExists(ENTRIES, UNIQUE_CONSTRAINT)) {
            log.warn("Migration disabled; {} present, serving", UNIQUE_CONSTRAINT);
            gate.moveTo(MigrationPhase.DONE);
            return;
        }
        gate.moveTo(MigrationPhase.FAILED);
        throw new MigrationFailedException("Migration disabled and " + UNIQUE_CONSTRAINT + " is missing; refusing to serve");
    }

    // ===================== phases =====================

    private void prepare() {
        if (!schema.tableExists(ENTRIES)) {
            log.info("Creating table {}", ENTRIES);
            jdbc.execute("CREATE TABLE " + ENTRIES + " (" +
                         "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, " +
                         "user_name VARCHAR(255) NOT NULL, " +
                         "user_key VARCHAR(255), " +
                         "entry_date DATE NOT NULL, " +
                         "location VARCHAR(64) NOT NULL, " +
                         "client VARCHAR(255), " +
                         "notes VARCHAR(2000), " +
                         "created_at TIMESTAMP WITH TIME ZONE NOT NULL, " +
                         "updated_at TIMESTAMP WITH TIME ZONE)");
        }
        if (!schema.tableExists(MARKER)) {
            jdbc.execute("CREATE TABLE " + MARKER + " (" +
                         "id INT PRIMARY KEY, " +
                         "phase VARCHAR(32) NOT NULL, " +
                         "updated_at TIMESTAMP WITH TIME ZONE NOT NULL)");
        }
    }

    /**
     * Copies the old {@code entry} table into entries and renames it out of the way. Every
     * date is parsed before anything is written; one unreadable date fails the migration.
     */
    private int importLegacyTable() {
        if (!schema.tableExists(LEGACY)) return 0;
        if (!schema.columnExists(LEGACY, "date")) {
            throw new MigrationFailedException("Table " + LEGACY + " has no date column, cannot import it");
        }
        if (schema.tableExists(LEGACY_ARCHIVE)) {
            throw new MigrationFailedException("Both " + LEGACY + " and " + LEGACY_ARCHIVE + " exist; remove one by hand");
        }
        boolean hasUpdatedAt = schema.columnExists(LEGACY, "updated_at");
        Instant now = Instant.now(clock);

        List<Object[]> rows = new ArrayList<>();
        jdbc.query("SELECT id, user_name, \"date\", location, client, notes, created_at" +
                   (hasUpdatedAt ? ", updated_at" : "") + " FROM " + LEGACY + " ORDER BY id", rs -> {
            long id = rs.getLong("id");
            String rawDate = rs.getString("date");
            LocalDate date = ParseUtil.parseIsoDate(rawDate);
            if (date == null) {
                throw new MigrationFailedException("Legacy entry " + id + " has an unreadable date: '" + rawDate + "'");
            }
            Instant created = legacyInstant(rs, "created_at", id);
            Instant updated = hasUpdatedAt ? legacyInstant(rs, "updated_at", id) : null;
            rows.add(new Object[]{
                    rs.getString("user_name"), date, rs.getString("location"),
                    rs.getString("client"), rs.getString("notes"),
                    utc(created == null ? now : created), updated == null ? null : utc(updated)});
        });

        if (!rows.isEmpty()) {
            jdbc.batchUpdate("INSERT INTO " + ENTRIES +
                             " (user_name, entry_date, location, client, notes, created_at, updated_at)" +
                             " VALUES (?, ?, ?, ?, ?, ?, ?)", rows);
        }
        jdbc.execute("ALTER TABLE " + LEGACY + " RENAME TO " + LEGACY_ARCHIVE);
        log.info("Imported {} rows from {}, old table kept as {}", rows.size(), LEGACY, LEGACY_ARCHIVE);
        return rows.size();
    }

    // naive timestamps were written in UTC
    private static Instant legacyInstant(ResultSet rs, String column, long id) throws SQLException {
        Object raw = rs.getObject(column);
        if (raw == null) return null;
        if (raw instanceof OffsetDateTime) return ((OffsetDateTime) raw).toInstant();
        if (raw instanceof LocalDateTime) return ((LocalDateTime) raw).toInstant(ZoneOffset.UTC);
        if (raw instanceof Timestamp) {
            String type = rs.getMetaData().getColumnTypeName(rs.findColumn(column)).toLowerCase(Locale.ROOT);
            Timestamp ts = (Timestamp) raw;
            return type.contains("tz") || type.contains("time zone")
                   ? ts.toInstant()
                   : ts.toLocalDateTime().toInstant(ZoneOffset.UTC);
        }
        String text = raw.toString().trim().replace(' ', 'T');
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e2) {
                throw new MigrationFailedException("Legacy entry " + id + " has an unreadable " + column + ": '" + raw + "'", e2);
            }
        }
    }

    private static OffsetDateTime utc(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private int backfillKeys() {
        if (!schema.columnExists(ENTRIES, "user_key")) {
            log.info("Adding column user_key");
            jdbc.execute("ALTER TABLE " + ENTRIES + " ADD COLUMN user_key VARCHAR(255)");
        }
        if (!schema.columnExists(ENTRIES, "updated_at")) {
            log.info("Adding column updated_at");
            jdbc.execute("ALTER TABLE " + ENTRIES + " ADD COLUMN updated_at TIMESTAMP WITH TIME ZONE");
        }

        List<Object[]> updates = new ArrayList<>();
        jdbc.query("SELECT id, user_name FROM " + ENTRIES + " WHERE user_key IS NULL OR TRIM(user_key) = ''", rs -> {
            long id = rs.getLong("id");
            String name = rs.getString("user_name");
            try {
                updates.add(new Object[]{IdentityNormalizer.normalize(name), id});
            } catch (InvalidIdentityException e) {
                throw new MigrationFailedException("Entry " + id + " has no usable name: '" + name + "'", e);
            }
        });
        if (!updates.isEmpty()) {
            jdbc.batchUpdate("UPDATE " + ENTRIES + " SET user_key = ? WHERE id = ?", updates);
        }

        int stamped = jdbc.update("UPDATE " + ENTRIES + " SET updated_at = created_at WHERE updated_at IS NULL");
        log.info("Backfilled {} user keys, {} updated_at values", updates.size(), stamped);
        return updates.size();
    }

    /** Legacy free-text locations become enum names; unknown ones become OTHER with the old text kept. */
    private int rewriteLegacyLocations() {
        int rewritten = 0;
        List<String> values = jdbc.queryForList("SELECT DISTINCT location FROM " + ENTRIES, String.class);
        for (String value : values) {
            if (value == null) {
                throw new MigrationFailedException("Entries without a location cannot be migrated");
            }
            if (isEnumName(value)) continue;
            Optional<Location> mapped = Location.fromLabel(value);
            int n;
            if (mapped.isPresent()) {
                n = jdbc.update("UPDATE " + ENTRIES + " SET location = ? WHERE location = ?", mapped.get().name(), value);
                log.info("Location '{}' -> {} on {} entries", value, mapped.get(), n);
            } else {
                n = jdbc.update("UPDATE " + ENTRIES + " SET location = ?, " +
                                "client = CASE WHEN client IS NULL OR TRIM(client) = '' THEN ? ELSE client END " +
                                "WHERE location = ?", Location.OTHER.name(), value, value);
                log.warn("Unknown location '{}' kept as OTHER on {} entries", value, n);
            }
            rewritten += n;
        }
        return rewritten;
    }

    /**
     * A client is kept exactly where the location asks for one. A client on any other
     * location moves into the notes; a missing one is filled with a placeholder.
     */
    private int repairQualifiers() {
        jdbc.update("UPDATE " + ENTRIES + " SET client = NULL WHERE client IS NOT NULL AND TRIM(client) = ''");
        int moved = jdbc.update(
                "UPDATE " + ENTRIES + " SET notes = CASE WHEN notes IS NULL OR TRIM(notes) = '' THEN client " +
                "ELSE notes || ' (' || client || ')' END, client = NULL " +
                "WHERE client IS NOT NULL AND location IN (" + locationNames(false) + ")");
        int filled = jdbc.update(
                "UPDATE " + ENTRIES + " SET client = ? WHERE client IS NULL AND location IN (" + locationNames(true) + ")",
                UNRECORDED_QUALIFIER);
        if (moved > 0) log.warn("Moved the client of {} entries into notes, their location takes none", moved);
        if (filled > 0) log.warn("{} entries need a client and had none; marked '{}'", filled, UNRECORDED_QUALIFIER);
        return moved + filled;
    }

    private int deduplicate() {
        List<DuplicateResolver.Row> rows = jdbc.query(
                "SELECT id, user_key, entry_date, updated_at FROM " + ENTRIES,
                (rs, i) -> {
                    OffsetDateTime updated = rs.getObject("updated_at", OffsetDateTime.class);
                    return new DuplicateResolver.Row(
                            rs.getLong("id"),
                            rs.getString("user_key"),
                            rs.getObject("entry_date", LocalDate.class),
                            updated == null ? null : updated.toInstant());
                });
        List<Long> losers = DuplicateResolver.losers(rows);
        if (losers.isEmpty()) {
            log.info("No duplicate (user_key, entry_date) pairs among {} entries", rows.size());
            return 0;
        }
        List<Object[]> args = losers.stream().map(id -> new Object[]{id}).toList();
        jdbc.batchUpdate("DELETE FROM " + ENTRIES + " WHERE id = ?", args);
        log.info("Removed {} duplicate entries, {} remain", losers.size(), rows.size() - losers.size());
        return losers.size();
    }

    private boolean applyConstraint() {
        if (schema.uniqueConstraintExists(ENTRIES, UNIQUE_CONSTRAINT)) {
            log.info("Constraint {} already present", UNIQUE_CONSTRAINT);
            return false;
        }
        Integer missingKeys = jdbc.queryForObject(
                "SELECT COUNT(*) FROM " + ENTRIES + " WHERE user_key IS NULL OR updated_at IS NULL", Integer.class);
        if (missingKeys != null && missingKeys > 0) {
            throw new MigrationFailedException(missingKeys + " entries still lack user_key or updated_at");
        }
        Integer badQualifiers = jdbc.queryForObject(
                "SELECT COUNT(*) FROM " + ENTRIES + " WHERE location NOT IN (" + locationNames(true) + ", " +
                locationNames(false) + ") OR (location IN (" + locationNames(true) + ") AND client IS NULL) " +
                "OR (location IN (" + locationNames(false) + ") AND client IS NOT NULL)", Integer.class);
        if (badQualifiers != null && badQualifiers > 0) {
            throw new MigrationFailedException(badQualifiers + " entries have an unknown location or a client that does not match it");
        }
        Integer dupes = jdbc.queryForObject(
                "SELECT COUNT(*) FROM (SELECT user_key, entry_date FROM " + ENTRIES +
                " GROUP BY user_key, entry_date HAVING COUNT(*) > 1) d", Integer.class);
        if (dupes != null && dupes > 0) {
            throw new MigrationFailedException(dupes + " (user_key, entry_date) pairs are still duplicated");
        }

        jdbc.execute("ALTER TABLE " + ENTRIES + " ALTER COLUMN user_key SET NOT NULL");
        jdbc.execute("ALTER TABLE " + ENTRIES + " ALTER COLUMN updated_at SET NOT NULL");
        jdbc.execute("ALTER TABLE " + ENTRIES + " ADD CONSTRAINT " + UNIQUE_CONSTRAINT + " UNIQUE (user_key, entry_date)");
        log.info("Constraint {} created", UNIQUE_CONSTRAINT);
        return true;
    }

    // ===================== marker =====================

    private <T> T inTx(MigrationPhase phase, PhaseWork<T> work) {
        return tx.execute(status -> {
            T result = work.run();
            recordPhase(phase);
            return result;
        });
    }

    private void recordPhase(MigrationPhase phase) {
        OffsetDateTime now = OffsetDateTime.ofInstant(Instant.now(clock), ZoneOffset.UTC);
        int n = jdbc.update("UPDATE " + MARKER + " SET phase = ?, updated_at = ? WHERE id = 1", phase.name(), now);
        if (n == 0) {
            jdbc.update("INSERT INTO " + MARKER + " (id, phase, updated_at) VALUES (1, ?, ?)", phase.name(), now);
        }
    }

    // enum names are plain identifiers, safe to inline
    private static String locationNames(boolean qualifierRequired) {
        StringJoiner names = new StringJoiner(", ");
        for (Location l : Location.values()) {
            if (l.isQualifierRequired() == qualifierRequired) names.add("'" + l.name() + "'");
        }
        return names.toString();
    }

    private static boolean isEnumName(String value) {
        for (Location l : Location.values()) {
            if (l.name().equals(value)) return true;
        }
        return false;
    }

    @FunctionalInterface
    private interface PhaseWork<T> {
        T run();
    }
}

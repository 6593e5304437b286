package dev.univer.worktracker.migration;

import java.time.Instant;
import java.time.LocalDate;
import java.util.*;

/**
 * Picks which rows of a legacy dataset to delete so that each (userKey, date) keeps one.
 * The survivor has the latest updatedAt, ties going to the highest id. Nothing is merged
 * from the losers.
 */
public final class DuplicateResolver {

    public record Row(long id, String userKey, LocalDate date, Instant updatedAt) {}

    private record Slot(String userKey, LocalDate date) {}

    static final Comparator<Row> NEWEST_LAST = Comparator
            .comparing(Row::updatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingLong(Row::id);

    private DuplicateResolver() {}

    /** Ids to delete, ascending. Empty when no (userKey, date) occurs twice. */
    public static List<Long> losers(Collection<Row> rows) {
        Map<Slot, List<Row>> bySlot = new HashMap<>();
        for (Row r : rows) {
            bySlot.computeIfAbsent(new Slot(r.userKey(), r.date()), k -> new ArrayList<>()).add(r);
        }
        List<Long> out = new ArrayList<>();
        for (List<Row> group : bySlot.values()) {
            if (group.size() < 2) continue;
            Row survivor = Collections.max(group, NEWEST_LAST);
            for (Row r : group) {
                if (r.id() != survivor.id()) out.add(r.id());
            }
        }
        Collections.sort(out);
        return out;
    }
}

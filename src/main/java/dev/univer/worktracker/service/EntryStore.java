package dev.univer.worktracker.service;

import dev.univer.worktracker.model.DayEntry;
import dev.univer.worktracker.model.Entry;
import dev.univer.worktracker.repo.EntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.*;

/**
 * Only path through which entries are written. The (user_key, entry_date) unique
 * constraint backs every write here, so a racing insert fails instead of duplicating.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntryStore {
    private final EntryRepository entryRepository;

    public enum UpsertOutcome { INSERTED, UPDATED }

    /**
     * Insert-if-absent, else overwrite the mutable fields of the existing row. Joins the
     * caller's transaction when there is one.
     */
    @Transactional
    public UpsertOutcome upsertOne(String userKey, String displayName, DayEntry day, Instant now) {
        Optional<Entry> existing = entryRepository.lockByUserKeyAndDate(userKey, day.date());
        if (existing.isPresent()) {
            Entry e = existing.get();
            e.setDisplayName(displayName);
            e.setLocation(day.location());
            e.setClientDescription(day.clientDescription());
            e.setNotes(day.notes());
            e.setUpdatedAt(now);
            return UpsertOutcome.UPDATED;
        }

        Entry created = Entry.builder()
                             .userKey(userKey)
                             .displayName(displayName)
                             .date(day.date())
                             .location(day.location())
                             .clientDescription(day.clientDescription())
                             .notes(day.notes())
                             .createdAt(now)
                             .updatedAt(now)
                             .build();
        // flush now: a concurrent insert of the same pair must fail inside this call
        entryRepository.saveAndFlush(created);
        return UpsertOutcome.INSERTED;
    }

    @Transactional(readOnly = true)
    public Optional<Entry> getByKeyAndDate(String userKey, LocalDate date) {
        return entryRepository.findByUserKeyAndDate(userKey, date);
    }

    @Transactional(readOnly = true)
    public List<Entry> getByUserAndDateRange(String userKey, LocalDate from, LocalDate to) {
        return entryRepository.findAllByUserKeyAndDateBetweenOrderByDateAsc(userKey, from, to);
    }

    /** Either bound may be null for an open range. */
    @Transactional(readOnly = true)
    public List<Entry> getAllInRange(LocalDate from, LocalDate to) {
        if (from != null && to != null) return entryRepository.findAllByDateBetweenOrderByDateAscUserKeyAsc(from, to);
        if (from != null) return entryRepository.findAllByDateGreaterThanEqualOrderByDateAscUserKeyAsc(from);
        if (to != null) return entryRepository.findAllByDateLessThanEqualOrderByDateAscUserKeyAsc(to);
        return entryRepository.findAllByOrderByDateAscUserKeyAsc();
    }

    /**
     * One display name per user key: the one on that key's most recently updated row
     * (ties to the highest id). Sorted by key. Either bound may be null for an open range.
     */
    @Transactional(readOnly = true)
    public List<String> listDistinctUsersInRange(LocalDate from, LocalDate to) {
        List<EntryRepository.UserName> newestFirst;
        if (from != null && to != null) newestFirst = entryRepository.findAllByDateBetweenOrderByUpdatedAtDescIdDesc(from, to);
        else if (from != null) newestFirst = entryRepository.findAllByDateGreaterThanEqualOrderByUpdatedAtDescIdDesc(from);
        else if (to != null) newestFirst = entryRepository.findAllByDateLessThanEqualOrderByUpdatedAtDescIdDesc(to);
        else newestFirst = entryRepository.findAllByOrderByUpdatedAtDescIdDesc();

        Map<String, String> latestByKey = new TreeMap<>();
        for (EntryRepository.UserName u : newestFirst) {
            latestByKey.putIfAbsent(u.getUserKey(), u.getDisplayName());
        }
        return new ArrayList<>(latestByKey.values());
    }

    @Transactional
    public boolean deleteById(Long id) {
        Optional<Entry> opt = entryRepository.findById(id);
        if (opt.isEmpty()) return false;
        entryRepository.delete(opt.get());
        entryRepository.flush();
        log.info("Deleted entry {} ({} on {})", id, opt.get().getUserKey(), opt.get().getDate());
        return true;
    }
}

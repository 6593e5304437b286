package dev.univer.worktracker.service;

import dev.univer.worktracker.MutableClock;
import dev.univer.worktracker.TestClockConfig;
import dev.univer.worktracker.error.InvalidIdentityException;
import dev.univer.worktracker.error.ValidationFailedException;
import dev.univer.worktracker.model.DayRecord;
import dev.univer.worktracker.model.Entry;
import dev.univer.worktracker.model.Location;
import dev.univer.worktracker.repo.EntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Import(TestClockConfig.class)
class WeekSubmissionServiceTest {

    private static final LocalDate MON = LocalDate.of(2025, 1, 6);

    @Autowired WeekSubmissionService service;
    @Autowired EntryRepository entryRepository;
    @Autowired MutableClock clock;

    @BeforeEach
    void clean() {
        entryRepository.deleteAllInBatch();
        clock.set(Instant.parse("2025-01-08T12:00:00Z"));
    }

    @Test
    void resubmittingTheSameWeekUpdatesInPlace() {
        List<DayRecord> week = List.of(
                DayRecord.of("2025-01-06", "on-site"),
                DayRecord.of("2025-01-07", "remote"),
                new DayRecord("2025-01-08", "client-site", "Acme", null));

        WeekSubmissionService.SubmissionResult first = service.submitWeek("Jo Smith", week);
        assertThat(first.inserted()).isEqualTo(3);
        Entry before = entryRepository.findByUserKeyAndDate("jo smith", MON).orElseThrow();

        clock.advance(Duration.ofMinutes(5));
        WeekSubmissionService.SubmissionResult second = service.submitWeek("Jo Smith", week);

        assertThat(second.updated()).isEqualTo(3);
        assertThat(second.inserted()).isZero();
        assertThat(entryRepository.count()).isEqualTo(3);
        Entry after = entryRepository.findByUserKeyAndDate("jo smith", MON).orElseThrow();
        assertThat(after.getId()).isEqualTo(before.getId());
        assertThat(after.getCreatedAt()).isEqualTo(before.getCreatedAt());
        assertThat(after.getUpdatedAt()).isAfter(before.getUpdatedAt());
    }

    @Test
    void caseVariantsOfANameShareOneRow() {
        service.submitWeek("Jo Smith", List.of(DayRecord.of("2025-01-06", "on-site")));
        clock.advance(Duration.ofSeconds(1));
        service.submitWeek("  JO SMITH ", List.of(DayRecord.of("2025-01-06", "remote")));

        List<Entry> rows = entryRepository.findAll();
        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).getUserKey()).isEqualTo("jo smith");
        assertThat(rows.get(0).getLocation()).isEqualTo(Location.REMOTE);
        assertThat(rows.get(0).getDisplayName()).isEqualTo("  JO SMITH ");
    }

    @Test
    void twoSingleDaySubmissionsUnderDifferentCaseBelongToOnePerson() {
        service.submitWeek("A B", List.of(DayRecord.of("2025-01-06", "on-site")));
        service.submitWeek("a b", List.of(DayRecord.of("2025-01-07", "remote")));

        List<Entry> rows = entryRepository.findAllByUserKeyAndDateBetweenOrderByDateAsc("a b", MON, MON.plusDays(4));
        assertThat(rows).extracting(Entry::getDate).containsExactly(MON, MON.plusDays(1));
        assertThat(entryRepository.count()).isEqualTo(2);
    }

    @Test
    void partialWeekLeavesOtherDaysAlone() {
        service.submitWeek("Jo", List.of(
                DayRecord.of("2025-01-06", "on-site"),
                DayRecord.of("2025-01-07", "on-site"),
                DayRecord.of("2025-01-08", "on-site")));

        service.submitWeek("Jo", List.of(DayRecord.of("2025-01-07", "leave")));

        List<Entry> rows = entryRepository.findAllByUserKeyAndDateBetweenOrderByDateAsc("jo", MON, MON.plusDays(4));
        assertThat(rows).extracting(Entry::getLocation)
                        .containsExactly(Location.ON_SITE, Location.LEAVE, Location.ON_SITE);
    }

    @Test
    void invalidMiddleRecordRejectsTheWholeBatch() {
        service.submitWeek("Jo", List.of(DayRecord.of("2025-01-06", "remote")));

        assertThatThrownBy(() -> service.submitWeek("Jo", List.of(
                DayRecord.of("2025-01-06", "on-site"),
                DayRecord.of("2025-01-07", "client-site"),
                DayRecord.of("2025-01-08", "on-site"))))
                .isInstanceOf(ValidationFailedException.class);

        assertThat(entryRepository.count()).isEqualTo(1);
        assertThat(entryRepository.findByUserKeyAndDate("jo", MON).orElseThrow().getLocation())
                .isEqualTo(Location.REMOTE);
    }

    @Test
    void clientIsStoredForClientSiteDays() {
        service.submitWeek("Jo", List.of(new DayRecord("2025-01-06", "Client Office", "Acme Ltd", "badge at desk")));

        Entry e = entryRepository.findByUserKeyAndDate("jo", MON).orElseThrow();
        assertThat(e.getLocation()).isEqualTo(Location.CLIENT_SITE);
        assertThat(e.getClientDescription()).isEqualTo("Acme Ltd");
        assertThat(e.getNotes()).isEqualTo("badge at desk");
    }

    @Test
    void blankNameIsRejectedBeforeAnyWrite() {
        assertThatThrownBy(() -> service.submitWeek("  ", List.of(DayRecord.of("2025-01-06", "remote"))))
                .isInstanceOf(InvalidIdentityException.class);
        assertThat(entryRepository.count()).isZero();
    }

    @Test
    void concurrentSubmissionsForTheSameDayLeaveOneRow() throws Exception {
        int writers = 4;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Throwable> failures = Collections.synchronizedList(new ArrayList<>());
        List<Future<?>> futures = new ArrayList<>();
        String[] names = {"Jo Smith", "jo smith", "JO SMITH", " Jo Smith "};
        String[] places = {"on-site", "remote", "leave", "abroad"};
        try {
            for (int i = 0; i < writers; i++) {
                String name = names[i];
                String place = places[i];
                futures.add(pool.submit(() -> {
                    try {
                        start.await();
                        service.submitWeek(name, List.of(DayRecord.of("2025-01-06", place)));
                    } catch (Throwable t) {
                        failures.add(t);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get(60, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(failures).isEmpty();
        assertThat(entryRepository.findAll())
                .hasSize(1)
                .allSatisfy(e -> assertThat(e.getUserKey()).isEqualTo("jo smith"));
    }
}

package dev.univer.worktracker.repo;

import dev.univer.worktracker.model.Entry;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface EntryRepository extends JpaRepository<Entry, Long> {
    Optional<Entry> findByUserKeyAndDate(String userKey, LocalDate date);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from Entry e where e.userKey = :userKey and e.date = :date")
    Optional<Entry> lockByUserKeyAndDate(@Param("userKey") String userKey, @Param("date") LocalDate date);

    List<Entry> findAllByUserKeyAndDateBetweenOrderByDateAsc(String userKey, LocalDate from, LocalDate to);

    List<Entry> findAllByDateBetweenOrderByDateAscUserKeyAsc(LocalDate from, LocalDate to);
    List<Entry> findAllByDateGreaterThanEqualOrderByDateAscUserKeyAsc(LocalDate from);
    List<Entry> findAllByDateLessThanEqualOrderByDateAscUserKeyAsc(LocalDate to);
    List<Entry> findAllByOrderByDateAscUserKeyAsc();

    // newest first, so the first row seen per key carries the latest-typed name
    List<UserName> findAllByDateBetweenOrderByUpdatedAtDescIdDesc(LocalDate from, LocalDate to);
    List<UserName> findAllByDateGreaterThanEqualOrderByUpdatedAtDescIdDesc(LocalDate from);
    List<UserName> findAllByDateLessThanEqualOrderByUpdatedAtDescIdDesc(LocalDate to);
    List<UserName> findAllByOrderByUpdatedAtDescIdDesc();

    interface UserName {
        String getUserKey();
        String getDisplayName();
    }
}

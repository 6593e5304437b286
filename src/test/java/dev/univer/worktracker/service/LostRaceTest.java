package dev.univer.worktracker.service;

import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.InvalidDataAccessResourceUsageException;
import org.springframework.orm.jpa.JpaSystemException;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

class LostRaceTest {

    @Test
    void constraintAndLockFailuresAreRaces() {
        assertThat(WeekSubmissionService.lostRace(new DataIntegrityViolationException("dup"))).isTrue();
        assertThat(WeekSubmissionService.lostRace(new CannotAcquireLockException("timeout"))).isTrue();
    }

    @Test
    void uncategorizedFailureIsRecognisedBySqlState() {
        RuntimeException hibernate = new RuntimeException("could not execute statement",
                new SQLException("Concurrent update in table \"entries\"", "90131"));
        assertThat(WeekSubmissionService.lostRace(new JpaSystemException(hibernate))).isTrue();
    }

    @Test
    void otherFailuresAreNot() {
        assertThat(WeekSubmissionService.lostRace(new InvalidDataAccessResourceUsageException("no such table"))).isFalse();
        RuntimeException hibernate = new RuntimeException("broken", new SQLException("connection reset", "08006"));
        assertThat(WeekSubmissionService.lostRace(new JpaSystemException(hibernate))).isFalse();
    }
}

package dev.univer.worktracker.model;

import java.time.LocalDate;

/**
 * A validated day record: typed date, known location, qualifier present only where required.
 */
public record DayEntry(LocalDate date, Location location, String clientDescription, String notes) {}

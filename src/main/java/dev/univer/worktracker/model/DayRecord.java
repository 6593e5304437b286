package dev.univer.worktracker.model;

/**
 * A day record as submitted, before validation. Any field may be missing or malformed.
 */
public record DayRecord(String date, String location, String client, String notes) {

    public static DayRecord of(String date, String location) {
        return new DayRecord(date, location, null, null);
    }
}

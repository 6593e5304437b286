package dev.univer.worktracker.service;

import dev.univer.worktracker.error.ValidationFailedException;
import dev.univer.worktracker.model.DayEntry;
import dev.univer.worktracker.model.DayRecord;
import dev.univer.worktracker.model.Location;
import dev.univer.worktracker.util.ParseUtil;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a whole batch of day records before anything is written. The first bad record
 * fails the batch, naming its day and field.
 */
public final class SubmissionValidator {

    private SubmissionValidator() {}

    public static List<DayEntry> validate(List<DayRecord> records) {
        if (records == null || records.isEmpty()) {
            throw new ValidationFailedException(null, "entries", "No entries provided");
        }
        List<DayEntry> out = new ArrayList<>(records.size());
        Set<LocalDate> seen = new HashSet<>();
        for (int i = 0; i < records.size(); i++) {
            DayRecord r = records.get(i);
            String day = (r == null || r.date() == null || r.date().isBlank()) ? "#" + (i + 1) : r.date().trim();
            if (r == null) throw new ValidationFailedException(day, "entries", "Entry " + day + " is empty");

            LocalDate date = ParseUtil.parseIsoDate(r.date());
            if (date == null) {
                throw new ValidationFailedException(day, "date", "Invalid date for " + day + ". Use YYYY-MM-DD");
            }
            if (!seen.add(date)) {
                throw new ValidationFailedException(day, "date", "Date " + date + " appears more than once");
            }

            Location location = Location.fromLabel(r.location())
                                        .orElseThrow(() -> new ValidationFailedException(day, "location",
                                                "Unknown location '" + r.location() + "' for " + day));

            String client = blankToNull(r.client());
            if (location.isQualifierRequired() && client == null) {
                String what = location == Location.OTHER ? "Location description" : "Client name";
                throw new ValidationFailedException(day, "client",
                        what + " is required when location is '" + location.getLabel() + "' (" + day + ")");
            }
            if (!location.isQualifierRequired() && client != null) {
                throw new ValidationFailedException(day, "client",
                        "Client must be empty when location is '" + location.getLabel() + "' (" + day + ")");
            }

            out.add(new DayEntry(date, location, client, blankToNull(r.notes())));
        }
        return out;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}

package dev.univer.worktracker.web.dto;

import dev.univer.worktracker.model.DayRecord;
import lombok.*;

/**
 * One day as posted by the form. Kept as raw strings; the submission service validates them.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EntryInput {
    private String date;
    private String location;
    private String client;
    private String notes;

    public DayRecord toRecord() {
        return new DayRecord(date, location, client, notes);
    }
}

package dev.univer.worktracker.web.dto;

import dev.univer.worktracker.model.Entry;
import dev.univer.worktracker.model.Location;
import lombok.*;

import java.time.LocalDate;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SummaryRow {
    private String userName;
    private LocalDate date;
    private Location location;
    private String client;
    private String notes;

    public static SummaryRow from(Entry e) {
        return SummaryRow.builder()
                .userName(e.getDisplayName())
                .date(e.getDate())
                .location(e.getLocation())
                .client(e.getClientDescription())
                .notes(e.getNotes())
                .build();
    }
}

package dev.univer.worktracker.web.dto;

import dev.univer.worktracker.model.Entry;
import dev.univer.worktracker.model.Location;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EntryResponse {
    private Long id;
    private String userName;
    private String userKey;
    private LocalDate date;
    private Location location;
    private String client;
    private String notes;
    private Instant createdAt;
    private Instant updatedAt;

    public static EntryResponse from(Entry e) {
        return EntryResponse.builder()
                .id(e.getId())
                .userName(e.getDisplayName())
                .userKey(e.getUserKey())
                .date(e.getDate())
                .location(e.getLocation())
                .client(e.getClientDescription())
                .notes(e.getNotes())
                .createdAt(e.getCreatedAt())
                .updatedAt(e.getUpdatedAt())
                .build();
    }
}

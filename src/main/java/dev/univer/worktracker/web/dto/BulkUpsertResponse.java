package dev.univer.worktracker.web.dto;

import lombok.*;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BulkUpsertResponse {
    private boolean ok;
    private int count;
    private int inserted;
    private int updated;
}

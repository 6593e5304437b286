package dev.univer.worktracker.web.dto;

import lombok.*;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MigrationStatusResponse {
    private String state;
    private String recordedPhase;
    private int legacyRowsImported;
    private int keysBackfilled;
    private int locationsRewritten;
    private int qualifiersRepaired;
    private int duplicatesRemoved;
    private boolean constraintCreated;
}

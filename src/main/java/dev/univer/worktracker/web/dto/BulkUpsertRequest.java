package dev.univer.worktracker.web.dto;

import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BulkUpsertRequest {

    @NotNull
    private String userName;

    @NotNull
    private List<EntryInput> entries;
}

package dev.univer.worktracker.web.dto;

import lombok.*;

import java.time.LocalDate;
import java.util.List;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReportResponse {
    private boolean ok;
    private LocalDate weekStart;
    private LocalDate weekEnd;
    private int usersReported;
    private int totalEntries;
    private List<Long> deliveredTo;
    private List<Long> failed;
    private String text;
}

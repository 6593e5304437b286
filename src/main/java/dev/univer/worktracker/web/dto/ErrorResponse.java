package dev.univer.worktracker.web.dto;

import lombok.*;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ErrorResponse {
    private String error;
    private String detail;
    private String day;
    private String field;
    private boolean retryable;
}

package dev.univer.worktracker.web.dto;

import java.util.List;

public record WeekSummaryResponse(List<SummaryRow> entries) {}

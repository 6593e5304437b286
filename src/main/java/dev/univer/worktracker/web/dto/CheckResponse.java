package dev.univer.worktracker.web.dto;

import java.util.List;

/** Edit-flow prefill: whether the person already has entries in the week, and which. */
public record CheckResponse(boolean exists, int count, List<SummaryRow> entries) {}

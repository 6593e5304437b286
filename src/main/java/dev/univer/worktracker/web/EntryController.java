package dev.univer.worktracker.web;

import dev.univer.worktracker.model.DayRecord;
import dev.univer.worktracker.model.Entry;
import dev.univer.worktracker.service.RosterQueryService;
import dev.univer.worktracker.service.WeekSubmissionService;
import dev.univer.worktracker.web.dto.*;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.format.annotation.DateTimeFormat.ISO;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/entries")
@RequiredArgsConstructor
@Slf4j
public class EntryController {

    private final WeekSubmissionService submissionService;
    private final RosterQueryService queryService;

    @PostMapping("/bulk_upsert")
    public ResponseEntity<BulkUpsertResponse> bulkUpsert(@RequestBody @Valid BulkUpsertRequest request) {
        log.info("Bulk upsert request for user: {} ({} days)", request.getUserName(), request.getEntries().size());
        List<DayRecord> records = request.getEntries().stream()
                .map(in -> in == null ? null : in.toRecord())
                .toList();
        WeekSubmissionService.SubmissionResult result = submissionService.submitWeek(request.getUserName(), records);
        return ResponseEntity.ok(BulkUpsertResponse.builder()
                .ok(true)
                .count(result.acceptedCount())
                .inserted(result.inserted())
                .updated(result.updated())
                .build());
    }

    @GetMapping("/check")
    public ResponseEntity<CheckResponse> check(
            @RequestParam("user_name") String userName,
            @RequestParam("week_start") @DateTimeFormat(iso = ISO.DATE) LocalDate weekStart
    ) {
        List<SummaryRow> rows = queryService.getWeekForUser(userName, weekStart).stream()
                .map(SummaryRow::from)
                .toList();
        return ResponseEntity.ok(new CheckResponse(!rows.isEmpty(), rows.size(), rows));
    }

    @GetMapping
    public ResponseEntity<List<EntryResponse>> list(
            @RequestParam(name = "date_from", required = false) @DateTimeFormat(iso = ISO.DATE) LocalDate from,
            @RequestParam(name = "date_to", required = false) @DateTimeFormat(iso = ISO.DATE) LocalDate to
    ) {
        List<Entry> entries = queryService.getEntries(from, to);
        return ResponseEntity.ok(entries.stream().map(EntryResponse::from).toList());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable Long id) {
        if (!queryService.deleteEntry(id)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("ok", false, "message", "Entry not found"));
        }
        return ResponseEntity.ok(Map.of("ok", true, "message", "Entry deleted successfully"));
    }
}

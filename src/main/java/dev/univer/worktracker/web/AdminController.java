package dev.univer.worktracker.web;

import dev.univer.worktracker.migration.MigrationGate;
import dev.univer.worktracker.migration.MigrationPhase;
import dev.univer.worktracker.migration.MigrationRunner;
import dev.univer.worktracker.service.WeeklyReportService;
import dev.univer.worktracker.web.dto.MigrationStatusResponse;
import dev.univer.worktracker.web.dto.ReportResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final WeeklyReportService reportService;
    private final MigrationRunner migrationRunner;
    private final MigrationGate migrationGate;

    @GetMapping("/")
    public ResponseEntity<Map<String, String>> root() {
        return ResponseEntity.ok(Map.of(
                "message", "Work Location Tracker API",
                "status", migrationGate.current().name()));
    }

    @PostMapping("/admin/send-weekly-report")
    public ResponseEntity<ReportResponse> sendWeeklyReport() {
        log.info("Weekly report generation requested");
        WeeklyReportService.Delivery d = reportService.sendPreviousWeek();
        return ResponseEntity.ok(ReportResponse.builder()
                .ok(d.failed().isEmpty())
                .weekStart(d.report().weekStart())
                .weekEnd(d.report().weekEnd())
                .usersReported(d.report().officeDays().size())
                .totalEntries(d.report().totalEntries())
                .deliveredTo(d.deliveredTo())
                .failed(d.failed())
                .text(reportService.render(d.report()))
                .build());
    }

    @GetMapping("/admin/migration-status")
    public ResponseEntity<MigrationStatusResponse> migrationStatus() {
        MigrationRunner.MigrationReport r = migrationRunner.getLastReport();
        return ResponseEntity.ok(MigrationStatusResponse.builder()
                .state(migrationGate.current().name())
                .recordedPhase(migrationRunner.recordedPhase().map(MigrationPhase::name).orElse(null))
                .legacyRowsImported(r.legacyRowsImported())
                .keysBackfilled(r.keysBackfilled())
                .locationsRewritten(r.locationsRewritten())
                .qualifiersRepaired(r.qualifiersRepaired())
                .duplicatesRemoved(r.duplicatesRemoved())
                .constraintCreated(r.constraintCreated())
                .build());
    }
}

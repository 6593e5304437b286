package dev.univer.worktracker.service;

import dev.univer.worktracker.error.RosterException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "roster.report", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WeeklyReportScheduler {

    private final WeeklyReportService reportService;

    // Monday morning by default: report on the week that just ended
    @Scheduled(cron = "${roster.report.cron:0 0 9 * * MON}", zone = "${roster.report.zone-id:Europe/London}")
    public void tick() {
        try {
            reportService.sendPreviousWeek();
        } catch (RosterException e) {
            log.error("Weekly report skipped: {}", e.getMessage());
        }
    }
}

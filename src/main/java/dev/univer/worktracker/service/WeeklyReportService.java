package dev.univer.worktracker.service;

import dev.univer.worktracker.config.RosterProperties;
import dev.univer.worktracker.model.Entry;
import dev.univer.worktracker.model.Location;
import dev.univer.worktracker.util.ParseUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.*;

/**
 * Office-attendance report: per person, the days of a Monday-Friday week spent on site
 * or at a client (leave and remote days do not count).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WeeklyReportService {
    private static final Set<Location> OFFICE_LOCATIONS = EnumSet.of(Location.ON_SITE, Location.CLIENT_SITE);

    private final RosterQueryService queryService;
    private final RosterProperties props;
    private final ObjectProvider<TelegramSender> telegramSender;
    private final Clock clock;

    public record WeeklyReport(LocalDate weekStart, LocalDate weekEnd, Map<String, Integer> officeDays, int totalEntries) {}

    public record Delivery(WeeklyReport report, List<Long> deliveredTo, List<Long> failed) {}

    public WeeklyReport build(LocalDate weekStart) {
        List<Entry> entries = queryService.getWeekSummary(weekStart);

        // latest-typed name per key, so "jo smith" and "Jo Smith" count as one line
        Map<String, Entry> newestByKey = new HashMap<>();
        Map<String, Integer> daysByKey = new HashMap<>();
        for (Entry e : entries) {
            newestByKey.merge(e.getUserKey(), e, (a, b) -> isNewer(b, a) ? b : a);
            if (OFFICE_LOCATIONS.contains(e.getLocation())) {
                daysByKey.merge(e.getUserKey(), 1, Integer::sum);
            }
        }

        Map<String, Integer> officeDays = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        daysByKey.forEach((key, days) -> officeDays.put(newestByKey.get(key).getDisplayName(), days));
        return new WeeklyReport(weekStart, RosterQueryService.weekEnd(weekStart), officeDays, entries.size());
    }

    public WeeklyReport buildPreviousWeek() {
        return build(previousWeekStart());
    }

    public LocalDate previousWeekStart() {
        LocalDate today = LocalDate.now(clock.withZone(ZoneId.of(props.getReport().getZoneId())));
        return ParseUtil.mondayOf(today).minusWeeks(1);
    }

    public String render(WeeklyReport r) {
        StringBuilder sb = new StringBuilder();
        sb.append("Weekly office attendance ")
          .append(ParseUtil.formatDots(r.weekStart())).append(" - ").append(ParseUtil.formatDots(r.weekEnd()))
          .append("\n");
        if (r.officeDays().isEmpty()) {
            sb.append("No office or client-site days recorded.");
            return sb.toString();
        }
        r.officeDays().forEach((name, days) ->
                sb.append("• ").append(name).append(": ").append(days).append(days == 1 ? " day" : " days").append("\n"));
        return sb.toString().trim();
    }

    /** Builds last week's report and sends it to every configured chat; logs it when Telegram is off. */
    public Delivery sendPreviousWeek() {
        WeeklyReport report = buildPreviousWeek();
        String text = render(report);
        List<Long> delivered = new ArrayList<>();
        List<Long> failed = new ArrayList<>();

        TelegramSender sender = telegramSender.getIfAvailable();
        List<Long> chatIds = props.getReport().getChatIds();
        if (sender == null || chatIds.isEmpty()) {
            log.info("Weekly report (no Telegram recipients configured):\n{}", text);
            return new Delivery(report, delivered, failed);
        }
        for (Long chatId : chatIds) {
            try {
                sender.send(chatId, text);
                delivered.add(chatId);
            } catch (TelegramApiException e) {
                log.error("Failed to send weekly report to chat {}: {}", chatId, e.getMessage());
                failed.add(chatId);
            }
        }
        log.info("Weekly report for {} sent to {} chats, {} failed", report.weekStart(), delivered.size(), failed.size());
        return new Delivery(report, delivered, failed);
    }

    private static boolean isNewer(Entry a, Entry b) {
        int c = a.getUpdatedAt().compareTo(b.getUpdatedAt());
        return c != 0 ? c > 0 : a.getId() > b.getId();
    }
}

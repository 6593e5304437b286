package dev.univer.worktracker.bot;

import dev.univer.worktracker.error.RosterException;
import dev.univer.worktracker.model.Entry;
import dev.univer.worktracker.service.RosterQueryService;
import dev.univer.worktracker.service.WeeklyReportService;
import dev.univer.worktracker.util.ParseUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only roster commands over Telegram. Entries are submitted through the HTTP API.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "roster.telegram", name = "enabled", havingValue = "true")
public class RosterBot {

    private final RosterQueryService queryService;
    private final WeeklyReportService reportService;
    private final AbsSender sender;
    private final Clock clock;

    private static final String MENTION_OPT = "(?:@\\w+)?";
    private static final String DATE_OPT = "(?:\\s+(\\S+))?";

    private static final Pattern HELP   = Pattern.compile("^/(start|help)" + MENTION_OPT + "\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern WEEK   = Pattern.compile("^/week" + MENTION_OPT + DATE_OPT + "\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHO    = Pattern.compile("^/who" + MENTION_OPT + DATE_OPT + "\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ME     = Pattern.compile("^/me" + MENTION_OPT + "\\s+(.+?)\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ME_EMPTY = Pattern.compile("^/me" + MENTION_OPT + "\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern REPORT = Pattern.compile("^/report" + MENTION_OPT + "\\s*$", Pattern.CASE_INSENSITIVE);

    @EventListener
    public void onUpdate(Update update) {
        try { handle(update); } catch (Exception e) { log.error("Error processing update", e); }
    }

    void handle(Update update) throws TelegramApiException {
        if (!update.hasMessage()) return;
        Message msg = update.getMessage();
        if (!msg.hasText()) return;
        Long chatId = msg.getChatId();
        String text = msg.getText().trim();

        try {
            if (HELP.matcher(text).matches()) { send(chatId, helpText()); return; }
            if (REPORT.matcher(text).matches()) {
                send(chatId, reportService.render(reportService.buildPreviousWeek()));
                return;
            }

            Matcher wm = WEEK.matcher(text);
            if (wm.matches()) {
                LocalDate start = weekStartOrCurrent(wm.group(1));
                if (start == null) { send(chatId, "Invalid date. Use YYYY-MM-DD or DD.MM.YYYY"); return; }
                send(chatId, renderWeek(start, queryService.getWeekSummary(start), true));
                return;
            }

            Matcher who = WHO.matcher(text);
            if (who.matches()) {
                LocalDate start = who.group(1) == null ? null : ParseUtil.parseFlexibleDate(who.group(1));
                if (who.group(1) != null && start == null) { send(chatId, "Invalid date. Use YYYY-MM-DD or DD.MM.YYYY"); return; }
                List<String> users = queryService.listKnownUsers(start == null ? null : ParseUtil.mondayOf(start));
                send(chatId, users.isEmpty() ? "Nobody has recorded anything yet." : "People:\n• " + String.join("\n• ", users));
                return;
            }

            if (ME_EMPTY.matcher(text).matches()) { send(chatId, "Usage: /me <name> [date]"); return; }
            Matcher me = ME.matcher(text);
            if (me.matches()) {
                ParseUtil.NameAndDate nd = ParseUtil.parseNameAndDate(me.group(1));
                LocalDate start = weekStartOrCurrent(nd.date());
                if (start == null) { send(chatId, "Invalid date. Use YYYY-MM-DD or DD.MM.YYYY"); return; }
                List<Entry> week = queryService.getWeekForUser(nd.name(), start);
                if (week.isEmpty()) {
                    send(chatId, "Nothing recorded for " + nd.name() + " in the week of " + ParseUtil.formatDots(start) + ".");
                } else {
                    send(chatId, renderWeek(start, week, false));
                }
            }
        } catch (RosterException ex) {
            send(chatId, "❌ " + ex.getMessage());
        }
    }

    String renderWeek(LocalDate start, List<Entry> entries, boolean withNames) {
        StringBuilder sb = new StringBuilder("Week ")
                .append(ParseUtil.formatDots(start)).append(" - ")
                .append(ParseUtil.formatDots(RosterQueryService.weekEnd(start)));
        if (entries.isEmpty()) return sb.append("\nNo entries.").toString();

        Map<LocalDate, List<Entry>> byDate = new TreeMap<>();
        for (Entry e : entries) byDate.computeIfAbsent(e.getDate(), d -> new ArrayList<>()).add(e);
        for (Map.Entry<LocalDate, List<Entry>> day : byDate.entrySet()) {
            sb.append("\n").append(day.getKey().getDayOfWeek().getDisplayName(TextStyle.SHORT, Locale.ENGLISH))
              .append(" ").append(ParseUtil.formatDots(day.getKey())).append(":");
            for (Entry e : day.getValue()) {
                sb.append("\n• ");
                if (withNames) sb.append(e.getDisplayName()).append(": ");
                sb.append(e.getLocation().getLabel());
                if (e.getClientDescription() != null) sb.append(" (").append(e.getClientDescription()).append(")");
                if (e.getNotes() != null) sb.append(" — ").append(e.getNotes());
            }
        }
        return sb.toString();
    }

    private LocalDate weekStartOrCurrent(String raw) {
        if (raw == null) return ParseUtil.mondayOf(LocalDate.now(clock));
        LocalDate d = ParseUtil.parseFlexibleDate(raw);
        return d == null ? null : ParseUtil.mondayOf(d);
    }

    private void send(Long chatId, String text) throws TelegramApiException {
        SendMessage sm = SendMessage.builder().chatId(chatId.toString()).text(text).build();
        sender.execute(sm);
    }

    private static String helpText() {
        return String.join("\n", List.of(
                "Work location roster.",
                "",
                "/week [date] — everyone's week (Monday of the given date, default this week)",
                "/me <name> [date] — one person's week",
                "/who [date] — people who recorded anything (or in that week)",
                "/report — last week's office and client-site days",
                "",
                "Dates: YYYY-MM-DD or DD.MM.YYYY. Entries are submitted through the web form."
                                        ));
    }
}

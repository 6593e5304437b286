package dev.univer.worktracker.bot;

import dev.univer.worktracker.error.StorageUnavailableException;
import dev.univer.worktracker.model.Entry;
import dev.univer.worktracker.model.Location;
import dev.univer.worktracker.service.RosterQueryService;
import dev.univer.worktracker.service.WeeklyReportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.bots.AbsSender;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RosterBotTest {

    private static final LocalDate MON = LocalDate.of(2025, 1, 6);
    private static final Instant T0 = Instant.parse("2025-01-08T10:00:00Z");

    @Mock RosterQueryService queryService;
    @Mock WeeklyReportService reportService;
    @Mock AbsSender sender;

    RosterBot bot;

    @BeforeEach
    void setUp() {
        // a Wednesday
        bot = new RosterBot(queryService, reportService, sender, Clock.fixed(T0, ZoneOffset.UTC));
    }

    @Test
    void weekWithoutDateUsesTheCurrentMonday() throws Exception {
        when(queryService.getWeekSummary(MON)).thenReturn(List.of(
                entry("Ann", MON, Location.ON_SITE, null),
                entry("Jo Smith", MON, Location.CLIENT_SITE, "Acme")));

        bot.handle(update("/week"));

        assertThat(lastReply())
                .startsWith("Week 06.01.2025 - 10.01.2025")
                .contains("Mon 06.01.2025:")
                .contains("• Ann: Neal Street")
                .contains("• Jo Smith: Client Office (Acme)");
    }

    @Test
    void meAcceptsADottedDate() throws Exception {
        LocalDate next = MON.plusWeeks(1);
        when(queryService.getWeekForUser("jo smith", next)).thenReturn(List.of());

        bot.handle(update("/me jo smith 15.01.2025"));

        assertThat(lastReply()).isEqualTo("Nothing recorded for jo smith in the week of 13.01.2025.");
    }

    @Test
    void bareMeShowsUsage() throws Exception {
        bot.handle(update("/me"));
        assertThat(lastReply()).startsWith("Usage:");
        verifyNoInteractions(queryService);
    }

    @Test
    void whoListsKnownPeople() throws Exception {
        when(queryService.listKnownUsers(null)).thenReturn(List.of("Ann", "Jo Smith"));
        bot.handle(update("/who@roster_bot"));
        assertThat(lastReply()).isEqualTo("People:\n• Ann\n• Jo Smith");
    }

    @Test
    void invalidDateIsReportedNotThrown() throws Exception {
        bot.handle(update("/week someday"));
        assertThat(lastReply()).startsWith("Invalid date");
    }

    @Test
    void closedStoreIsRepliedAsAnError() throws Exception {
        when(queryService.getWeekSummary(MON)).thenThrow(new StorageUnavailableException("Entry store is not ready"));
        bot.handle(update("/week"));
        assertThat(lastReply()).isEqualTo("❌ Entry store is not ready");
    }

    @Test
    void reportRendersLastWeek() throws Exception {
        WeeklyReportService.WeeklyReport r = new WeeklyReportService.WeeklyReport(
                MON.minusWeeks(1), MON.minusDays(3), java.util.Map.of(), 0);
        when(reportService.buildPreviousWeek()).thenReturn(r);
        when(reportService.render(r)).thenReturn("No office or client-site days recorded.");

        bot.handle(update("/report"));

        assertThat(lastReply()).isEqualTo("No office or client-site days recorded.");
    }

    @Test
    void plainTextIsIgnored() throws Exception {
        bot.handle(update("hello"));
        verifyNoInteractions(sender, queryService, reportService);
    }

    private String lastReply() throws Exception {
        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(sender, atLeastOnce()).execute(captor.capture());
        SendMessage sm = captor.getValue();
        assertThat(sm.getChatId()).isEqualTo("42");
        return sm.getText();
    }

    private static Update update(String text) {
        Message msg = new Message();
        msg.setChat(new Chat(42L, "private"));
        msg.setText(text);
        Update u = new Update();
        u.setMessage(msg);
        return u;
    }

    private static Entry entry(String name, LocalDate date, Location location, String client) {
        return Entry.builder()
                    .userKey(name.toLowerCase()).displayName(name).date(date)
                    .location(location).clientDescription(client)
                    .createdAt(T0).updatedAt(T0)
                    .build();
    }
}

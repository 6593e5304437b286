package dev.univer.worktracker.web;

import dev.univer.worktracker.error.StorageUnavailableException;
import dev.univer.worktracker.model.Entry;
import dev.univer.worktracker.model.Location;
import dev.univer.worktracker.service.RosterQueryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SummaryController.class)
class SummaryControllerTest {

    private static final LocalDate MON = LocalDate.of(2025, 1, 6);

    @Autowired MockMvc mvc;
    @MockBean RosterQueryService queryService;

    @Test
    void weekSummaryListsEveryone() throws Exception {
        Instant t = Instant.parse("2025-01-06T10:00:00Z");
        when(queryService.getWeekSummary(MON)).thenReturn(List.of(
                Entry.builder().id(1L).userKey("ann").displayName("Ann").date(MON)
                     .location(Location.LEAVE).createdAt(t).updatedAt(t).build()));

        mvc.perform(get("/summary/week").param("week_start", "2025-01-06"))
           .andExpect(status().isOk())
           .andExpect(jsonPath("$.entries[0].user_name").value("Ann"))
           .andExpect(jsonPath("$.entries[0].location").value("leave"));
    }

    @Test
    void usersForAWeekAndForAllTime() throws Exception {
        when(queryService.listKnownUsers(MON)).thenReturn(List.of("Ann"));
        when(queryService.listKnownUsers(null)).thenReturn(List.of("Ann", "Jo Smith"));

        mvc.perform(get("/summary/users").param("week_start", "2025-01-06"))
           .andExpect(jsonPath("$.users[0]").value("Ann"));
        mvc.perform(get("/summary/all-users"))
           .andExpect(status().isOk())
           .andExpect(jsonPath("$.users[1]").value("Jo Smith"));
    }

    @Test
    void missingWeekStartIsA400() throws Exception {
        mvc.perform(get("/summary/week")).andExpect(status().isBadRequest());
    }

    @Test
    void closedStoreIsA503() throws Exception {
        when(queryService.listKnownUsers(null)).thenThrow(new StorageUnavailableException("migration state: FAILED"));
        mvc.perform(get("/summary/all-users")).andExpect(status().isServiceUnavailable());
    }
}

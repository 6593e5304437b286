package dev.univer.worktracker.web;

import dev.univer.worktracker.service.RosterQueryService;
import dev.univer.worktracker.web.dto.SummaryRow;
import dev.univer.worktracker.web.dto.UsersResponse;
import dev.univer.worktracker.web.dto.WeekSummaryResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.format.annotation.DateTimeFormat.ISO;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

@RestController
@RequestMapping("/summary")
@RequiredArgsConstructor
public class SummaryController {

    private final RosterQueryService queryService;

    @GetMapping("/week")
    public ResponseEntity<WeekSummaryResponse> week(
            @RequestParam("week_start") @DateTimeFormat(iso = ISO.DATE) LocalDate weekStart
    ) {
        return ResponseEntity.ok(new WeekSummaryResponse(
                queryService.getWeekSummary(weekStart).stream().map(SummaryRow::from).toList()));
    }

    @GetMapping("/users")
    public ResponseEntity<UsersResponse> usersForWeek(
            @RequestParam("week_start") @DateTimeFormat(iso = ISO.DATE) LocalDate weekStart
    ) {
        return ResponseEntity.ok(new UsersResponse(queryService.listKnownUsers(weekStart)));
    }

    @GetMapping("/all-users")
    public ResponseEntity<UsersResponse> allUsers() {
        return ResponseEntity.ok(new UsersResponse(queryService.listKnownUsers(null)));
    }
}

package com.peopleanalytics.timeentry.controller;

import com.peopleanalytics.dashboard.dto.response.DailyTotal;
import com.peopleanalytics.dashboard.model.DateRange;
import com.peopleanalytics.dashboard.service.SummaryService;
import com.peopleanalytics.timeentry.dto.request.CreateTimeEntryRequest;
import com.peopleanalytics.timeentry.dto.request.UpdateTimeEntryRequest;
import com.peopleanalytics.timeentry.dto.response.TimeEntryResponse;
import com.peopleanalytics.timeentry.service.TimeEntryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/time-entries")
@RequiredArgsConstructor
@Tag(name = "Time entries", description = "Logging and querying worked hours")
public class TimeEntryController {

    private final TimeEntryService timeEntryService;
    private final SummaryService summaryService;
    private final Clock clock;

    @Operation(summary = "Log a time entry")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Time entry created"),
            @ApiResponse(responseCode = "400", description = "Malformed request"),
            @ApiResponse(responseCode = "404", description = "Employee not found"),
            @ApiResponse(responseCode = "422", description = "Business rule violated, e.g. daily 24 h cap")
    })
    @PostMapping
    public ResponseEntity<TimeEntryResponse> createTimeEntry(@Valid @RequestBody CreateTimeEntryRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(timeEntryService.createTimeEntry(request));
    }

    @Operation(summary = "List time entries", description = "Paged, newest first, with optional filters")
    @GetMapping
    public ResponseEntity<Page<TimeEntryResponse>> getTimeEntries(
            @RequestParam(required = false) UUID employeeId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) Boolean billable,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        Pageable pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), 100),
                Sort.by(Sort.Direction.DESC, "entryDate").and(Sort.by("id")));
        return ResponseEntity.ok(timeEntryService.getTimeEntries(employeeId, startDate, endDate, billable, pageable));
    }

    @Operation(summary = "Search time entries by description")
    @GetMapping("/search")
    public ResponseEntity<List<TimeEntryResponse>> searchTimeEntries(
            @RequestParam("q") String query,
            @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(timeEntryService.searchTimeEntries(query, limit));
    }

    @Operation(summary = "Daily totals of an employee", description = "Days without entries are omitted")
    @GetMapping("/daily-totals")
    public ResponseEntity<List<DailyTotal>> getDailyTotals(
            @RequestParam UUID employeeId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        DateRange range = DateRange.resolve(startDate, endDate, clock);
        return ResponseEntity.ok(summaryService.dailyTotals(employeeId, range));
    }

    @Operation(summary = "Get a time entry")
    @GetMapping("/{timeEntryId}")
    public ResponseEntity<TimeEntryResponse> getTimeEntry(@PathVariable UUID timeEntryId) {
        return ResponseEntity.ok(timeEntryService.getTimeEntry(timeEntryId));
    }

    @Operation(summary = "Update a time entry", description = "Fields left out keep their current value")
    @PutMapping("/{timeEntryId}")
    public ResponseEntity<TimeEntryResponse> updateTimeEntry(
            @PathVariable UUID timeEntryId,
            @Valid @RequestBody UpdateTimeEntryRequest request) {
        return ResponseEntity.ok(timeEntryService.updateTimeEntry(timeEntryId, request));
    }

    @Operation(summary = "Delete a time entry")
    @DeleteMapping("/{timeEntryId}")
    public ResponseEntity<Void> deleteTimeEntry(@PathVariable UUID timeEntryId) {
        timeEntryService.deleteTimeEntry(timeEntryId);
        return ResponseEntity.noContent().build();
    }
}

package com.peopleanalytics.dashboard.controller;

import com.peopleanalytics.dashboard.dto.response.Summary;
import com.peopleanalytics.dashboard.dto.response.TrendsResponse;
import com.peopleanalytics.dashboard.model.DateRange;
import com.peopleanalytics.dashboard.model.SummaryScope;
import com.peopleanalytics.dashboard.service.SummaryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/dashboard")
@RequiredArgsConstructor
@Tag(name = "Dashboard", description = "Hours and utilization reporting")
public class DashboardController {

    private final SummaryService summaryService;
    private final Clock clock;

    @Operation(
            summary = "Summarize hours",
            description = "Totals, billable hours and utilization for an employee, a department or the whole firm. "
                    + "The range defaults to the current month up to today."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Summary computed"),
            @ApiResponse(responseCode = "400", description = "Missing scope id or start date after end date"),
            @ApiResponse(responseCode = "404", description = "Employee or department not found")
    })
    @GetMapping("/summary")
    public ResponseEntity<Summary> getSummary(
            @RequestParam(defaultValue = "FIRM") SummaryScope scope,
            @RequestParam(required = false) UUID scopeId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        log.debug("Summary request: scope={}, scopeId={}", scope, scopeId);
        DateRange range = DateRange.resolve(startDate, endDate, clock);
        return ResponseEntity.ok(summaryService.summarize(scope, scopeId, range));
    }

    @Operation(summary = "Firm-wide daily trends")
    @GetMapping("/trends")
    public ResponseEntity<TrendsResponse> getTrends(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        DateRange range = DateRange.resolve(startDate, endDate, clock);
        return ResponseEntity.ok(summaryService.trends(range));
    }
}

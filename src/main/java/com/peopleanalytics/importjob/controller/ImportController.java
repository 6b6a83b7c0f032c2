package com.peopleanalytics.importjob.controller;

import com.peopleanalytics.importjob.dto.response.ImportHistoryResponse;
import com.peopleanalytics.importjob.dto.response.ImportResponse;
import com.peopleanalytics.importjob.dto.response.ImportStatusResponse;
import com.peopleanalytics.importjob.model.ImportJobKind;
import com.peopleanalytics.importjob.service.ImportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/imports")
@RequiredArgsConstructor
@Tag(name = "Imports", description = "Bulk import of employees and time entries from CSV/XLSX")
public class ImportController {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final ImportService importService;

    @Operation(
            summary = "Import employees",
            description = "Queues an asynchronous import. Columns: name, email, hire_date, department, position"
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Import job created"),
            @ApiResponse(responseCode = "413", description = "File too large")
    })
    @PostMapping(value = "/employees", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImportResponse> importEmployees(@RequestParam("file") MultipartFile file) {
        log.info("Employee import request: {}", file.getOriginalFilename());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(importService.submit(file, ImportJobKind.EMPLOYEES));
    }

    @Operation(
            summary = "Import time entries",
            description = "Queues an asynchronous import. Columns: employee_id or employee_email, date, hours, "
                    + "description, billable, matter_code"
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Import job created"),
            @ApiResponse(responseCode = "413", description = "File too large")
    })
    @PostMapping(value = "/time-entries", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImportResponse> importTimeEntries(@RequestParam("file") MultipartFile file) {
        log.info("Time entry import request: {}", file.getOriginalFilename());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(importService.submit(file, ImportJobKind.TIME_ENTRIES));
    }

    @Operation(summary = "Import job status", description = "Counters, progress and row errors of a job")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Job status"),
            @ApiResponse(responseCode = "404", description = "Job not found")
    })
    @GetMapping("/{jobId}")
    public ResponseEntity<ImportStatusResponse> getImportStatus(@PathVariable UUID jobId) {
        return ResponseEntity.ok(importService.getStatus(jobId));
    }

    @Operation(summary = "Import history", description = "Jobs, newest first")
    @GetMapping
    public ResponseEntity<ImportHistoryResponse> getImportHistory(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(importService.getHistory(Math.max(page, 0), Math.min(Math.max(size, 1), 100)));
    }

    @Operation(summary = "Download a CSV template", description = "kind is employees or time-entries")
    @GetMapping("/templates/{kind}")
    public ResponseEntity<String> getTemplate(@PathVariable String kind) {
        ImportJobKind importKind = ImportJobKind.fromSlug(kind);
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"" + importKind.getSlug() + "-template.csv\"")
                .body(importService.getTemplate(importKind));
    }
}

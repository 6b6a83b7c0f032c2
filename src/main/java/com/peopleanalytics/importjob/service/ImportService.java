package com.peopleanalytics.importjob.service;

import com.peopleanalytics.exception.FatalImportException;
import com.peopleanalytics.importjob.dto.response.ImportHistoryResponse;
import com.peopleanalytics.importjob.dto.response.ImportResponse;
import com.peopleanalytics.importjob.dto.response.ImportStatusResponse;
import com.peopleanalytics.importjob.model.ImportJob;
import com.peopleanalytics.importjob.model.ImportJobKind;
import com.peopleanalytics.importjob.model.ImportJobStatus;
import com.peopleanalytics.importjob.parser.ImportFileParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ImportService {

    static final String QUEUE_FULL = "Import queue is full, please retry later";

    private static final String EMPLOYEE_TEMPLATE = """
            name,email,hire_date,department,position
            Jane Smith,jane.smith@example.com,2023-03-01,Engineering,Senior Engineer
            John Doe,john.doe@example.com,2024-01-15,,Analyst
            """;

    private static final String TIME_ENTRY_TEMPLATE = """
            employee_email,date,hours,description,billable,matter_code
            jane.smith@example.com,2024-01-10,7.50,Client meeting and contract review,true,MTR-1001
            john.doe@example.com,2024-01-10,6.00,Internal research and documentation,false,
            """;

    private final ImportJobTracker tracker;
    private final ImportFileParser parser;
    private final ImportJobProcessor processor;
    private final ImportJobWorker worker;
    private final Clock clock;

    /**
     * Stores the file as a new job and hands it to the worker pool. A file that cannot be read
     * or lacks required columns still gets a job, which fails straight away.
     */
    public ImportResponse submit(MultipartFile file, ImportJobKind kind) {
        Instant start = clock.instant();
        String fileName = file.getOriginalFilename() != null ? file.getOriginalFilename() : file.getName();
        log.info("Import submitted: kind={}, file={}, size={}", kind, fileName, file.getSize());

        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new IllegalArgumentException("Uploaded file could not be read", e);
        }

        ImportJob job = tracker.create(kind, fileName, content);
        UUID jobId = job.getId();

        try {
            processor.checkColumns(kind, parser.parse(content, fileName));
        } catch (FatalImportException e) {
            log.warn("Import job {} rejected at submit: {}", jobId, e.getMessage());
            processor.failAndNotify(jobId, e.getMessage(), start);
            return toResponse(tracker.get(jobId));
        }

        try {
            worker.run(jobId);
        } catch (TaskRejectedException e) {
            log.error("Import job {} rejected by the worker pool: {}", jobId, e.getMessage());
            processor.failAndNotify(jobId, QUEUE_FULL, start);
            return toResponse(tracker.get(jobId));
        }
        return toResponse(job);
    }

    public ImportStatusResponse getStatus(UUID jobId) {
        ImportJob job = tracker.get(jobId);
        List<ImportStatusResponse.RowError> errors = tracker.rowErrors(jobId).stream()
                .map(e -> new ImportStatusResponse.RowError(e.getRowNumber(), e.getErrorCode(), e.getMessage(), e.getRawData()))
                .toList();

        return new ImportStatusResponse(
                job.getId(),
                job.getKind(),
                job.getStatus(),
                job.getFileName(),
                job.getTotalRows(),
                job.processedRows(),
                job.getSucceeded(),
                job.getFailed(),
                progressPercent(job),
                job.getErrorMessage(),
                job.getCreatedAt(),
                job.getStartedAt(),
                job.getCompletedAt(),
                errors
        );
    }

    public ImportHistoryResponse getHistory(int page, int size) {
        Page<ImportJob> jobs = tracker.list(PageRequest.of(page, size));
        List<ImportHistoryResponse.ImportInfo> imports = jobs.stream()
                .map(job -> new ImportHistoryResponse.ImportInfo(
                        job.getId(),
                        job.getKind(),
                        job.getFileName(),
                        job.getStatus(),
                        job.getTotalRows(),
                        job.getSucceeded(),
                        job.getFailed(),
                        job.getCreatedAt(),
                        job.getCompletedAt()
                ))
                .toList();
        return new ImportHistoryResponse(imports, jobs.getNumber(), jobs.getSize(), jobs.getTotalElements());
    }

    public String getTemplate(ImportJobKind kind) {
        return switch (kind) {
            case EMPLOYEES -> EMPLOYEE_TEMPLATE;
            case TIME_ENTRIES -> TIME_ENTRY_TEMPLATE;
        };
    }

    static int progressPercent(ImportJob job) {
        if (job.getStatus() == ImportJobStatus.COMPLETED) {
            return 100;
        }
        Integer total = job.getTotalRows();
        if (total == null || total == 0) {
            return 0;
        }
        return Math.min(100, job.processedRows() * 100 / total);
    }

    private ImportResponse toResponse(ImportJob job) {
        return new ImportResponse(job.getId(), job.getKind(), job.getStatus(), job.getFileName(), job.getErrorMessage());
    }
}

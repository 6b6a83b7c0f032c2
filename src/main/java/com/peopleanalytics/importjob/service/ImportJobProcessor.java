package com.peopleanalytics.importjob.service;

import com.peopleanalytics.exception.FatalImportException;
import com.peopleanalytics.importjob.model.ImportJob;
import com.peopleanalytics.importjob.model.ImportJobKind;
import com.peopleanalytics.importjob.parser.ImportFileParser;
import com.peopleanalytics.importjob.parser.ImportRow;
import com.peopleanalytics.importjob.parser.ImportTable;
import com.peopleanalytics.lock.LockTimeoutException;
import com.peopleanalytics.notification.ImportJobEvent;
import com.peopleanalytics.notification.ImportNotifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Runs one import job from its stored file: rows in file order, one failing row never stops the
 * job. Only file defects and infrastructure faults fail the job.
 */
@Slf4j
@Service
public class ImportJobProcessor {

    static final String INFRASTRUCTURE_ERROR = "Import aborted due to an infrastructure error";
    static final String UNEXPECTED_ERROR = "Import aborted due to an unexpected error";

    private final ImportJobTracker tracker;
    private final ImportFileParser parser;
    private final ImportNotifier notifier;
    private final Clock clock;
    private final Map<ImportJobKind, RowImporter> importers = new EnumMap<>(ImportJobKind.class);

    public ImportJobProcessor(ImportJobTracker tracker,
                              ImportFileParser parser,
                              ImportNotifier notifier,
                              Clock clock,
                              List<RowImporter> rowImporters) {
        this.tracker = tracker;
        this.parser = parser;
        this.notifier = notifier;
        this.clock = clock;
        for (RowImporter importer : rowImporters) {
            importers.put(importer.kind(), importer);
        }
    }

    public void process(UUID jobId) {
        Instant start = clock.instant();
        if (!tracker.markProcessing(jobId)) {
            log.warn("Import job {} is not queued, skipping", jobId);
            return;
        }

        try {
            ImportJob job = tracker.get(jobId);
            log.info("Processing import job {} ({}, {})", jobId, job.getKind(), job.getFileName());

            ImportTable table = parser.parse(tracker.payload(jobId), job.getFileName());
            checkColumns(job.getKind(), table);
            tracker.setTotalRows(jobId, table.rows().size());

            RowImporter importer = importers.get(job.getKind());
            Set<String> batchKeys = new HashSet<>();
            for (ImportRow row : table.rows()) {
                RowOutcome outcome = importRow(importer, row, batchKeys);
                if (outcome.succeeded()) {
                    tracker.recordSuccess(jobId);
                } else {
                    log.debug("Import job {} row {} rejected: {}", jobId, row.rowNumber(), outcome.message());
                    tracker.recordRowError(jobId, row.rowNumber(), row.raw(), outcome.errorCode(), outcome.message());
                }
            }

            if (tracker.complete(jobId)) {
                notifyTerminal(jobId, start);
            }
        } catch (FatalImportException e) {
            log.warn("Import job {} failed: {}", jobId, e.getMessage());
            failAndNotify(jobId, e.getMessage(), start);
        } catch (DataAccessException | LockTimeoutException e) {
            log.error("Import job {} aborted: {}", jobId, e.getMessage(), e);
            failAndNotify(jobId, INFRASTRUCTURE_ERROR, start);
        } catch (RuntimeException e) {
            log.error("Import job {} aborted unexpectedly: {}", jobId, e.getMessage(), e);
            failAndNotify(jobId, UNEXPECTED_ERROR, start);
        }
    }

    /**
     * Moves a queued or running job to FAILED and notifies, unless it already ended.
     */
    public void failAndNotify(UUID jobId, String message, Instant start) {
        try {
            if (tracker.fail(jobId, message)) {
                notifyTerminal(jobId, start);
            }
        } catch (DataAccessException e) {
            log.error("Could not mark import job {} as failed: {}", jobId, e.getMessage(), e);
        }
    }

    public void checkColumns(ImportJobKind kind, ImportTable table) {
        List<String> missing = kind.missingColumns(table.headerSet());
        if (!missing.isEmpty()) {
            throw new FatalImportException("Missing required columns: " + String.join(", ", missing));
        }
    }

    private RowOutcome importRow(RowImporter importer, ImportRow row, Set<String> batchKeys) {
        try {
            return importer.importRow(row, batchKeys);
        } catch (DataIntegrityViolationException e) {
            // A concurrent writer won a unique constraint the validation could not see.
            log.warn("Row {} hit a constraint: {}", row.rowNumber(), e.getMostSpecificCause().getMessage());
            return RowOutcome.failure("CONFLICT", "Row conflicts with existing data");
        }
    }

    private void notifyTerminal(UUID jobId, Instant start) {
        ImportJob job = tracker.get(jobId);
        ImportJobEvent event = new ImportJobEvent(
                job.getId(),
                job.getKind(),
                job.getStatus(),
                job.getFileName(),
                job.getTotalRows() == null ? 0 : job.getTotalRows(),
                job.getSucceeded(),
                job.getFailed(),
                job.getErrorMessage(),
                Duration.between(start, clock.instant())
        );
        try {
            notifier.notify(event);
        } catch (RuntimeException e) {
            log.error("Notification for import job {} failed: {}", jobId, e.getMessage(), e);
        }
    }
}

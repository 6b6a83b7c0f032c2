package com.peopleanalytics.importjob.service;

import com.peopleanalytics.exception.ResourceNotFoundException;
import com.peopleanalytics.importjob.model.ImportJob;
import com.peopleanalytics.importjob.model.ImportJobFile;
import com.peopleanalytics.importjob.model.ImportJobKind;
import com.peopleanalytics.importjob.model.ImportJobStatus;
import com.peopleanalytics.importjob.model.ImportRowError;
import com.peopleanalytics.importjob.repository.ImportJobFileRepository;
import com.peopleanalytics.importjob.repository.ImportJobRepository;
import com.peopleanalytics.importjob.repository.ImportRowErrorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Durable registry of import jobs. Counters move through single-statement increments and status
 * changes only happen from an allowed source state, so a job reaches a terminal state once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImportJobTracker {

    private final ImportJobRepository jobRepository;
    private final ImportRowErrorRepository rowErrorRepository;
    private final ImportJobFileRepository fileRepository;
    private final Clock clock;

    @Transactional
    public ImportJob create(ImportJobKind kind, String fileName, byte[] content) {
        ImportJob job = jobRepository.save(ImportJob.builder()
                .kind(kind)
                .status(ImportJobStatus.QUEUED)
                .fileName(fileName)
                .fileSizeBytes((long) content.length)
                .succeeded(0)
                .failed(0)
                .build());
        fileRepository.save(ImportJobFile.builder()
                .jobId(job.getId())
                .content(content)
                .build());
        log.info("Import job {} queued: kind={}, file={}, {} bytes", job.getId(), kind, fileName, content.length);
        return job;
    }

    @Transactional(readOnly = true)
    public ImportJob get(UUID jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> ResourceNotFoundException.of("Import job", jobId));
    }

    @Transactional(readOnly = true)
    public Page<ImportJob> list(Pageable pageable) {
        return jobRepository.findAllByOrderByCreatedAtDescIdAsc(pageable);
    }

    @Transactional(readOnly = true)
    public List<ImportRowError> rowErrors(UUID jobId) {
        return rowErrorRepository.findAllByJobIdOrderByRowNumberAsc(jobId);
    }

    @Transactional(readOnly = true)
    public byte[] payload(UUID jobId) {
        return fileRepository.findById(jobId)
                .map(ImportJobFile::getContent)
                .orElseThrow(() -> ResourceNotFoundException.of("Import file", jobId));
    }

    /**
     * @return false when the job was no longer queued
     */
    @Transactional
    public boolean markProcessing(UUID jobId) {
        return jobRepository.markStarted(jobId, ImportJobStatus.PROCESSING,
                ImportJobStatus.sourcesOf(ImportJobStatus.PROCESSING), LocalDateTime.now(clock)) == 1;
    }

    @Transactional
    public void setTotalRows(UUID jobId, int totalRows) {
        jobRepository.setTotalRows(jobId, totalRows);
    }

    @Transactional
    public void recordSuccess(UUID jobId) {
        jobRepository.incrementSucceeded(jobId);
    }

    @Transactional
    public void recordRowError(UUID jobId, int rowNumber, String rawData, String errorCode, String message) {
        rowErrorRepository.save(ImportRowError.builder()
                .jobId(jobId)
                .rowNumber(rowNumber)
                .rawData(rawData)
                .errorCode(errorCode)
                .message(message)
                .build());
        jobRepository.incrementFailed(jobId);
    }

    @Transactional
    public boolean complete(UUID jobId) {
        return finish(jobId, ImportJobStatus.COMPLETED, null);
    }

    @Transactional
    public boolean fail(UUID jobId, String message) {
        return finish(jobId, ImportJobStatus.FAILED, message);
    }

    private boolean finish(UUID jobId, ImportJobStatus target, String message) {
        int updated = jobRepository.markFinished(jobId, target, ImportJobStatus.sourcesOf(target),
                message, LocalDateTime.now(clock));
        if (updated == 0) {
            log.warn("Import job {} could not move to {}: already terminal or missing", jobId, target);
            return false;
        }
        log.info("Import job {} is {}", jobId, target);
        return true;
    }
}

package com.peopleanalytics.notification;

import com.peopleanalytics.importjob.model.ImportJobKind;
import com.peopleanalytics.importjob.model.ImportJobStatus;

import java.time.Duration;
import java.util.UUID;

public record ImportJobEvent(
        UUID jobId,
        ImportJobKind kind,
        ImportJobStatus status,
        String fileName,
        int totalRows,
        int succeeded,
        int failed,
        String errorMessage,
        Duration duration
) {
}

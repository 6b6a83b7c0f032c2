package com.peopleanalytics.importjob.dto.response;

import com.peopleanalytics.importjob.model.ImportJobKind;
import com.peopleanalytics.importjob.model.ImportJobStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public record ImportStatusResponse(
        UUID jobId,
        ImportJobKind kind,
        ImportJobStatus status,
        String fileName,
        Integer totalRows,
        int processedRows,
        int succeeded,
        int failed,
        int progressPercent,
        String errorMessage,
        LocalDateTime createdAt,
        LocalDateTime startedAt,
        LocalDateTime completedAt,
        List<RowError> errors
) {
    public record RowError(
            int rowNumber,
            String errorCode,
            String message,
            String rawData
    ) {
    }
}

package com.peopleanalytics.importjob.dto.response;

import com.peopleanalytics.importjob.model.ImportJobKind;
import com.peopleanalytics.importjob.model.ImportJobStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public record ImportHistoryResponse(
        List<ImportInfo> imports,
        int page,
        int size,
        long totalElements
) {
    public record ImportInfo(
            UUID jobId,
            ImportJobKind kind,
            String fileName,
            ImportJobStatus status,
            Integer totalRows,
            int succeeded,
            int failed,
            LocalDateTime createdAt,
            LocalDateTime completedAt
    ) {
    }
}

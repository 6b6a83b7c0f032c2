package com.peopleanalytics.importjob.dto.response;

import com.peopleanalytics.importjob.model.ImportJobKind;
import com.peopleanalytics.importjob.model.ImportJobStatus;

import java.util.UUID;

public record ImportResponse(
        UUID jobId,
        ImportJobKind kind,
        ImportJobStatus status,
        String fileName,
        String errorMessage
) {
}

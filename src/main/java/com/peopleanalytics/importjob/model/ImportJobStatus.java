package com.peopleanalytics.importjob.model;

import java.util.EnumSet;
import java.util.Set;

public enum ImportJobStatus {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED;

    /**
     * States a job may be in when it moves to {@code target}.
     */
    public static Set<ImportJobStatus> sourcesOf(ImportJobStatus target) {
        return switch (target) {
            case QUEUED -> EnumSet.noneOf(ImportJobStatus.class);
            case PROCESSING -> EnumSet.of(QUEUED);
            case COMPLETED -> EnumSet.of(PROCESSING);
            case FAILED -> EnumSet.of(QUEUED, PROCESSING);
        };
    }
}

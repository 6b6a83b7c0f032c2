package com.peopleanalytics.exception;

/**
 * File-level defect that prevents any row of an import from being processed. The message is
 * shown to clients as the job's error, so it never contains internal details.
 */
public class FatalImportException extends RuntimeException {

    public FatalImportException(String message) {
        super(message);
    }

    public FatalImportException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.peopleanalytics.importjob.service;

import com.peopleanalytics.importjob.model.ImportJobKind;
import com.peopleanalytics.importjob.parser.ImportRow;

import java.util.Set;

/**
 * Imports one row of a given kind. {@code batchKeys} holds the keys of rows already imported by
 * the same job; implementations read it for duplicate detection and add to it on success.
 */
public interface RowImporter {

    ImportJobKind kind();

    RowOutcome importRow(ImportRow row, Set<String> batchKeys);
}

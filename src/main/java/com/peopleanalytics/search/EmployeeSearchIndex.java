package com.peopleanalytics.search;

import java.util.List;
import java.util.UUID;

/**
 * Write-through index of active employees. Writes are best effort: callers log failures and
 * carry on, the database stays the source of truth.
 */
public interface EmployeeSearchIndex {

    void upsert(EmployeeDocument document);

    void remove(UUID employeeId);

    /**
     * Drops every document.
     */
    void clear();

    /**
     * Documents matching every whitespace-separated term of the query against name, email,
     * department or position, best matches first.
     */
    List<EmployeeDocument> search(String query, int limit);
}

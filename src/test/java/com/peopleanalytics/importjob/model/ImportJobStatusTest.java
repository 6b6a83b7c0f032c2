package com.peopleanalytics.importjob.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ImportJobStatusTest {

    @Test
    void shouldAllowOnlyForwardTransitions() {
        assertEquals(Set.of(ImportJobStatus.QUEUED), ImportJobStatus.sourcesOf(ImportJobStatus.PROCESSING));
        assertEquals(Set.of(ImportJobStatus.PROCESSING), ImportJobStatus.sourcesOf(ImportJobStatus.COMPLETED));
        assertEquals(Set.of(ImportJobStatus.QUEUED, ImportJobStatus.PROCESSING),
                ImportJobStatus.sourcesOf(ImportJobStatus.FAILED));
        assertTrue(ImportJobStatus.sourcesOf(ImportJobStatus.QUEUED).isEmpty());
    }

    @Test
    void shouldNeverLeaveTerminalStates() {
        for (ImportJobStatus target : ImportJobStatus.values()) {
            assertFalse(ImportJobStatus.sourcesOf(target).contains(ImportJobStatus.COMPLETED));
            assertFalse(ImportJobStatus.sourcesOf(target).contains(ImportJobStatus.FAILED));
        }
    }

    @Test
    void shouldRequireEmployeeReferenceForTimeEntryImports() {
        // Act
        List<String> missing = ImportJobKind.TIME_ENTRIES.missingColumns(Set.of("date", "hours", "description"));
        List<String> satisfied = ImportJobKind.TIME_ENTRIES.missingColumns(Set.of("employee_id", "date", "hours", "description"));

        // Assert
        assertEquals(List.of("employee_id|employee_email"), missing);
        assertTrue(satisfied.isEmpty());
    }

    @Test
    void shouldResolveKindFromSlug() {
        assertEquals(ImportJobKind.TIME_ENTRIES, ImportJobKind.fromSlug("time-entries"));
        assertEquals(ImportJobKind.EMPLOYEES, ImportJobKind.fromSlug("Employees"));
        assertThrows(IllegalArgumentException.class, () -> ImportJobKind.fromSlug("payroll"));
    }
}

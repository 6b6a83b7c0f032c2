package com.peopleanalytics.timeentry.service;

import com.peopleanalytics.employee.model.Employee;
import com.peopleanalytics.employee.repository.EmployeeRepository;
import com.peopleanalytics.exception.ResourceNotFoundException;
import com.peopleanalytics.timeentry.model.TimeEntry;
import com.peopleanalytics.timeentry.repository.TimeEntryRepository;
import com.peopleanalytics.validation.TimeEntryDraft;
import com.peopleanalytics.validation.TimeEntryValidationContext;
import com.peopleanalytics.validation.TimeEntryValidator;
import com.peopleanalytics.validation.ValidatedTimeEntry;
import com.peopleanalytics.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Validate-then-save for time entries in one transaction. The daily hours are re-read inside the
 * transaction; callers hold the employee lock so no other writer can add hours for the same
 * employee in between.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TimeEntryWriter {

    private final TimeEntryRepository timeEntryRepository;
    private final EmployeeRepository employeeRepository;
    private final TimeEntryValidator timeEntryValidator;

    @Transactional
    public ValidationResult<TimeEntry> create(TimeEntryDraft draft) {
        ValidationResult<ValidatedTimeEntry> result =
                timeEntryValidator.validate(draft, loadContext(draft, null));
        if (!result.isValid()) {
            return result.asRejected();
        }

        ValidatedTimeEntry valid = result.getValue();
        TimeEntry entry = TimeEntry.builder()
                .employeeId(valid.employeeId())
                .entryDate(valid.date())
                .hours(valid.hours())
                .description(valid.description())
                .billable(valid.billable())
                .matterCode(valid.matterCode())
                .build();
        TimeEntry saved = timeEntryRepository.save(entry);
        log.info("Time entry created: {} ({} h for employee {} on {})",
                saved.getId(), saved.getHours(), saved.getEmployeeId(), saved.getEntryDate());
        return ValidationResult.accepted(saved);
    }

    @Transactional
    public ValidationResult<TimeEntry> update(UUID timeEntryId, TimeEntryDraft draft) {
        TimeEntry existing = timeEntryRepository.findById(timeEntryId)
                .orElseThrow(() -> ResourceNotFoundException.of("Time entry", timeEntryId));

        ValidationResult<ValidatedTimeEntry> result =
                timeEntryValidator.validate(draft, loadContext(draft, timeEntryId));
        if (!result.isValid()) {
            return result.asRejected();
        }

        ValidatedTimeEntry valid = result.getValue();
        existing.setEntryDate(valid.date());
        existing.setHours(valid.hours());
        existing.setDescription(valid.description());
        existing.setBillable(valid.billable());
        existing.setMatterCode(valid.matterCode());
        TimeEntry saved = timeEntryRepository.save(existing);
        log.info("Time entry updated: {}", saved.getId());
        return ValidationResult.accepted(saved);
    }

    private TimeEntryValidationContext loadContext(TimeEntryDraft draft, UUID excludedEntryId) {
        if (draft.employeeId() == null) {
            return TimeEntryValidationContext.missingEmployee();
        }
        Optional<Employee> employee = employeeRepository.findById(draft.employeeId());
        if (employee.isEmpty()) {
            return TimeEntryValidationContext.missingEmployee();
        }

        List<BigDecimal> dailyHours = draft.date() == null ? List.of()
                : timeEntryRepository.findAllByEmployeeIdAndEntryDate(draft.employeeId(), draft.date()).stream()
                .filter(entry -> !entry.getId().equals(excludedEntryId))
                .map(TimeEntry::getHours)
                .toList();
        return new TimeEntryValidationContext(true, !employee.get().isDeleted(), dailyHours);
    }
}

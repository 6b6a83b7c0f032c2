package com.peopleanalytics.timeentry.service;

import com.peopleanalytics.exception.BusinessValidationException;
import com.peopleanalytics.exception.ResourceNotFoundException;
import com.peopleanalytics.lock.EmployeeLockService;
import com.peopleanalytics.timeentry.dto.request.CreateTimeEntryRequest;
import com.peopleanalytics.timeentry.dto.request.UpdateTimeEntryRequest;
import com.peopleanalytics.timeentry.dto.response.TimeEntryResponse;
import com.peopleanalytics.timeentry.model.TimeEntry;
import com.peopleanalytics.timeentry.repository.TimeEntryRepository;
import com.peopleanalytics.validation.TimeEntryDraft;
import com.peopleanalytics.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class TimeEntryService {

    private final TimeEntryRepository timeEntryRepository;
    private final TimeEntryWriter timeEntryWriter;
    private final EmployeeLockService lockService;

    public TimeEntryResponse createTimeEntry(CreateTimeEntryRequest request) {
        log.info("Logging {} h for employee {} on {}", request.hours(), request.employeeId(), request.date());
        TimeEntryDraft draft = new TimeEntryDraft(
                request.employeeId(),
                request.date(),
                request.hours(),
                request.description(),
                request.billable() == null || request.billable(),
                request.matterCode()
        );

        ValidationResult<TimeEntry> result = lockService.withLock(
                EmployeeLockService.employeeKey(request.employeeId()),
                () -> timeEntryWriter.create(draft));
        return toResponse(unwrap(result));
    }

    @Transactional(readOnly = true)
    public TimeEntryResponse getTimeEntry(UUID timeEntryId) {
        log.debug("Fetching time entry {}", timeEntryId);
        return toResponse(findTimeEntry(timeEntryId));
    }

    @Transactional(readOnly = true)
    public Page<TimeEntryResponse> getTimeEntries(UUID employeeId, LocalDate startDate, LocalDate endDate,
                                                  Boolean billable, Pageable pageable) {
        log.debug("Listing time entries: employee={}, from={}, to={}, billable={}",
                employeeId, startDate, endDate, billable);
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("Start date must be before or equal to end date");
        }
        return timeEntryRepository.findFiltered(employeeId, startDate, endDate, billable, pageable)
                .map(this::toResponse);
    }

    public TimeEntryResponse updateTimeEntry(UUID timeEntryId, UpdateTimeEntryRequest request) {
        log.info("Updating time entry {}", timeEntryId);
        TimeEntry current = findTimeEntry(timeEntryId);
        TimeEntryDraft draft = new TimeEntryDraft(
                current.getEmployeeId(),
                request.date() != null ? request.date() : current.getEntryDate(),
                request.hours() != null ? request.hours() : current.getHours(),
                request.description() != null ? request.description() : current.getDescription(),
                request.billable() != null ? request.billable() : current.getBillable(),
                request.matterCode() != null ? request.matterCode() : current.getMatterCode()
        );

        ValidationResult<TimeEntry> result = lockService.withLock(
                EmployeeLockService.employeeKey(current.getEmployeeId()),
                () -> timeEntryWriter.update(timeEntryId, draft));
        return toResponse(unwrap(result));
    }

    @Transactional
    public void deleteTimeEntry(UUID timeEntryId) {
        log.info("Deleting time entry {}", timeEntryId);
        TimeEntry entry = findTimeEntry(timeEntryId);
        timeEntryRepository.delete(entry);
    }

    @Transactional(readOnly = true)
    public List<TimeEntryResponse> searchTimeEntries(String query, int limit) {
        if (query == null || query.trim().length() < 2) {
            throw new IllegalArgumentException("Search query must be at least 2 characters");
        }
        if (limit < 1 || limit > 50) {
            throw new IllegalArgumentException("Limit must be between 1 and 50");
        }
        log.debug("Searching time entries: {}", query);
        return timeEntryRepository.searchByDescription(query.trim(), PageRequest.of(0, limit)).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    private TimeEntry findTimeEntry(UUID timeEntryId) {
        return timeEntryRepository.findById(timeEntryId)
                .orElseThrow(() -> ResourceNotFoundException.of("Time entry", timeEntryId));
    }

    private TimeEntry unwrap(ValidationResult<TimeEntry> result) {
        if (!result.isValid()) {
            throw new BusinessValidationException(result.getViolations());
        }
        return result.getValue();
    }

    private TimeEntryResponse toResponse(TimeEntry entry) {
        return new TimeEntryResponse(
                entry.getId(),
                entry.getEmployeeId(),
                entry.getEntryDate(),
                entry.getHours(),
                entry.getDescription(),
                Boolean.TRUE.equals(entry.getBillable()),
                entry.getMatterCode(),
                entry.getCreatedAt(),
                entry.getUpdatedAt()
        );
    }
}

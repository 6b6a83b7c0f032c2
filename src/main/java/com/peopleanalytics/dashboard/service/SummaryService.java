package com.peopleanalytics.dashboard.service;

import com.peopleanalytics.dashboard.dto.response.DailyTotal;
import com.peopleanalytics.dashboard.dto.response.DepartmentSummary;
import com.peopleanalytics.dashboard.dto.response.EmployeeSummary;
import com.peopleanalytics.dashboard.dto.response.Summary;
import com.peopleanalytics.dashboard.dto.response.TrendsResponse;
import com.peopleanalytics.dashboard.model.DateRange;
import com.peopleanalytics.dashboard.model.SummaryScope;
import com.peopleanalytics.department.model.Department;
import com.peopleanalytics.department.repository.DepartmentRepository;
import com.peopleanalytics.employee.model.Employee;
import com.peopleanalytics.employee.repository.EmployeeRepository;
import com.peopleanalytics.exception.ResourceNotFoundException;
import com.peopleanalytics.timeentry.model.TimeEntry;
import com.peopleanalytics.timeentry.repository.TimeEntryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only aggregation of logged hours. Entries are summed in memory with {@link BigDecimal}
 * and every list in the output has a fixed order, so equal data yields equal summaries.
 */
@Slf4j
@Service
public class SummaryService {

    static final BigDecimal ZERO_HOURS = BigDecimal.ZERO.setScale(2);
    static final BigDecimal ZERO_RATE = BigDecimal.ZERO.setScale(4);
    private static final String FIRM_SCOPE_NAME = "Firm";

    private final TimeEntryRepository timeEntryRepository;
    private final EmployeeRepository employeeRepository;
    private final DepartmentRepository departmentRepository;
    private final boolean includeDeletedEmployees;

    public SummaryService(TimeEntryRepository timeEntryRepository,
                          EmployeeRepository employeeRepository,
                          DepartmentRepository departmentRepository,
                          @Value("${analytics.summary.include-deleted-employees:true}") boolean includeDeletedEmployees) {
        this.timeEntryRepository = timeEntryRepository;
        this.employeeRepository = employeeRepository;
        this.departmentRepository = departmentRepository;
        this.includeDeletedEmployees = includeDeletedEmployees;
    }

    @Transactional(readOnly = true)
    public Summary summarize(SummaryScope scope, UUID scopeId, DateRange range) {
        log.debug("Summarizing {} {} for {} - {}", scope, scopeId, range.start(), range.end());
        if (scope != SummaryScope.FIRM && scopeId == null) {
            throw new IllegalArgumentException("Scope " + scope + " requires a scope id");
        }

        Map<UUID, Department> departments = departmentRepository.findAll().stream()
                .collect(Collectors.toMap(Department::getId, Function.identity()));

        String scopeName;
        List<TimeEntry> entries;
        switch (scope) {
            case EMPLOYEE -> {
                Employee employee = employeeRepository.findById(scopeId)
                        .orElseThrow(() -> ResourceNotFoundException.of("Employee", scopeId));
                scopeName = employee.getName();
                entries = timeEntryRepository.findAllByEmployeeIdAndEntryDateBetween(
                        scopeId, range.start(), range.end());
            }
            case DEPARTMENT -> {
                Department department = departments.get(scopeId);
                if (department == null) {
                    throw ResourceNotFoundException.of("Department", scopeId);
                }
                scopeName = department.getName();
                List<UUID> memberIds = employeeRepository.findAllByDepartmentId(scopeId).stream()
                        .map(Employee::getId)
                        .toList();
                entries = memberIds.isEmpty() ? List.of()
                        : timeEntryRepository.findAllByEmployeeIdInAndEntryDateBetween(
                        memberIds, range.start(), range.end());
            }
            default -> {
                scopeName = FIRM_SCOPE_NAME;
                entries = timeEntryRepository.findAllByEntryDateBetween(range.start(), range.end());
            }
        }

        Map<UUID, Employee> employees = loadEmployees(entries);
        List<TimeEntry> counted = applyEmployeePolicy(entries, employees);

        Totals overall = new Totals();
        Map<UUID, Totals> byEmployee = new HashMap<>();
        for (TimeEntry entry : counted) {
            overall.add(entry);
            byEmployee.computeIfAbsent(entry.getEmployeeId(), id -> new Totals()).add(entry);
        }

        List<EmployeeSummary> employeeSummaries = byEmployee.entrySet().stream()
                .map(e -> toEmployeeSummary(employees.get(e.getKey()), departments, e.getValue()))
                .sorted(employeeOrder())
                .toList();

        Totals unassigned = new Totals();
        int unassignedEmployees = 0;
        Map<UUID, Totals> byDepartment = new HashMap<>();
        Map<UUID, Set<UUID>> contributors = new HashMap<>();
        for (Map.Entry<UUID, Totals> e : byEmployee.entrySet()) {
            UUID departmentId = employees.get(e.getKey()).getDepartmentId();
            if (departmentId == null || !departments.containsKey(departmentId)) {
                unassigned.merge(e.getValue());
                unassignedEmployees++;
            } else {
                byDepartment.computeIfAbsent(departmentId, id -> new Totals()).merge(e.getValue());
                contributors.computeIfAbsent(departmentId, id -> new HashSet<>()).add(e.getKey());
            }
        }

        List<DepartmentSummary> departmentSummaries = switch (scope) {
            case FIRM -> departments.values().stream()
                    .sorted(Comparator.comparing(Department::getName).thenComparing(Department::getId))
                    .map(d -> toDepartmentSummary(d, byDepartment.get(d.getId()), contributors.get(d.getId())))
                    .toList();
            case DEPARTMENT -> List.of(toDepartmentSummary(
                    departments.get(scopeId), byDepartment.get(scopeId), contributors.get(scopeId)));
            case EMPLOYEE -> List.of();
        };

        return new Summary(
                scope,
                scope == SummaryScope.FIRM ? null : scopeId,
                scopeName,
                range.start(),
                range.end(),
                overall.total(),
                overall.billable(),
                overall.nonBillable(),
                overall.utilization(),
                overall.entries,
                departmentSummaries,
                employeeSummaries,
                scope == SummaryScope.FIRM ? unassignedEmployees : 0,
                scope == SummaryScope.FIRM ? unassigned.total() : ZERO_HOURS
        );
    }

    /**
     * Per-day totals of one employee; days without entries are left out.
     */
    @Transactional(readOnly = true)
    public List<DailyTotal> dailyTotals(UUID employeeId, DateRange range) {
        log.debug("Daily totals for employee {} in {} - {}", employeeId, range.start(), range.end());
        if (!employeeRepository.existsById(employeeId)) {
            throw ResourceNotFoundException.of("Employee", employeeId);
        }
        return groupByDay(timeEntryRepository.findAllByEmployeeIdAndEntryDateBetween(
                employeeId, range.start(), range.end()));
    }

    @Transactional(readOnly = true)
    public TrendsResponse trends(DateRange range) {
        log.debug("Firm trends for {} - {}", range.start(), range.end());
        List<TimeEntry> entries = timeEntryRepository.findAllByEntryDateBetween(range.start(), range.end());
        List<DailyTotal> days = groupByDay(applyEmployeePolicy(entries, loadEmployees(entries)));

        Totals period = new Totals();
        for (DailyTotal day : days) {
            period.total = period.total.add(day.totalHours());
            period.billable = period.billable.add(day.billableHours());
        }
        BigDecimal dayCount = BigDecimal.valueOf(Math.max(days.size(), 1));

        return new TrendsResponse(
                range.start(),
                range.end(),
                days,
                period.total().divide(dayCount, 2, RoundingMode.HALF_UP),
                period.billable().divide(dayCount, 2, RoundingMode.HALF_UP),
                period.utilization()
        );
    }

    public static BigDecimal utilization(BigDecimal billableHours, BigDecimal totalHours) {
        if (totalHours.signum() == 0) {
            return ZERO_RATE;
        }
        return billableHours.divide(totalHours, 4, RoundingMode.HALF_UP);
    }

    private Map<UUID, Employee> loadEmployees(List<TimeEntry> entries) {
        Set<UUID> ids = entries.stream().map(TimeEntry::getEmployeeId).collect(Collectors.toSet());
        if (ids.isEmpty()) {
            return Map.of();
        }
        return employeeRepository.findAllByIdIn(ids).stream()
                .collect(Collectors.toMap(Employee::getId, Function.identity()));
    }

    private List<TimeEntry> applyEmployeePolicy(List<TimeEntry> entries, Map<UUID, Employee> employees) {
        List<TimeEntry> counted = new ArrayList<>(entries.size());
        for (TimeEntry entry : entries) {
            Employee employee = employees.get(entry.getEmployeeId());
            if (employee == null) {
                log.warn("Time entry {} references unknown employee {}", entry.getId(), entry.getEmployeeId());
                continue;
            }
            if (employee.isDeleted() && !includeDeletedEmployees) {
                continue;
            }
            counted.add(entry);
        }
        return counted;
    }

    private List<DailyTotal> groupByDay(List<TimeEntry> entries) {
        Map<LocalDate, Totals> byDay = new TreeMap<>();
        for (TimeEntry entry : entries) {
            byDay.computeIfAbsent(entry.getEntryDate(), d -> new Totals()).add(entry);
        }
        return byDay.entrySet().stream()
                .map(e -> new DailyTotal(
                        e.getKey(),
                        e.getValue().total(),
                        e.getValue().billable(),
                        e.getValue().nonBillable(),
                        e.getValue().utilization(),
                        e.getValue().entries))
                .toList();
    }

    private EmployeeSummary toEmployeeSummary(Employee employee, Map<UUID, Department> departments, Totals totals) {
        Department department = employee.getDepartmentId() == null ? null : departments.get(employee.getDepartmentId());
        return new EmployeeSummary(
                employee.getId(),
                employee.getName(),
                employee.getEmail(),
                department == null ? null : department.getId(),
                department == null ? null : department.getName(),
                !employee.isDeleted(),
                totals.total(),
                totals.billable(),
                totals.nonBillable(),
                totals.utilization(),
                totals.entries
        );
    }

    private DepartmentSummary toDepartmentSummary(Department department, Totals totals, Set<UUID> contributors) {
        Totals t = totals != null ? totals : new Totals();
        return new DepartmentSummary(
                department.getId(),
                department.getName(),
                contributors == null ? 0 : contributors.size(),
                t.total(),
                t.billable(),
                t.nonBillable(),
                t.utilization()
        );
    }

    // Department name, then employee name, then id; employees without a department go last.
    private static Comparator<EmployeeSummary> employeeOrder() {
        return Comparator.comparing(EmployeeSummary::departmentName, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(EmployeeSummary::name)
                .thenComparing(EmployeeSummary::employeeId);
    }

    private static final class Totals {
        private BigDecimal total = ZERO_HOURS;
        private BigDecimal billable = ZERO_HOURS;
        private int entries;

        void add(TimeEntry entry) {
            total = total.add(entry.getHours());
            if (Boolean.TRUE.equals(entry.getBillable())) {
                billable = billable.add(entry.getHours());
            }
            entries++;
        }

        void merge(Totals other) {
            total = total.add(other.total);
            billable = billable.add(other.billable);
            entries += other.entries;
        }

        BigDecimal total() {
            return total.setScale(2, RoundingMode.HALF_UP);
        }

        BigDecimal billable() {
            return billable.setScale(2, RoundingMode.HALF_UP);
        }

        BigDecimal nonBillable() {
            return total().subtract(billable());
        }

        BigDecimal utilization() {
            return SummaryService.utilization(billable(), total());
        }
    }
}

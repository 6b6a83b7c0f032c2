package com.peopleanalytics.employee.controller;

import com.peopleanalytics.employee.dto.request.CreateEmployeeRequest;
import com.peopleanalytics.employee.dto.request.UpdateEmployeeRequest;
import com.peopleanalytics.employee.dto.response.EmployeeResponse;
import com.peopleanalytics.employee.service.EmployeeService;
import com.peopleanalytics.search.EmployeeDocument;
import com.peopleanalytics.search.ReindexResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/employees")
@RequiredArgsConstructor
@Tag(name = "Employees", description = "Employee management and search")
public class EmployeeController {

    private final EmployeeService employeeService;

    @Operation(summary = "Create an employee")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Employee created"),
            @ApiResponse(responseCode = "400", description = "Malformed request"),
            @ApiResponse(responseCode = "404", description = "Department not found"),
            @ApiResponse(responseCode = "409", description = "Email already used by an active employee"),
            @ApiResponse(responseCode = "422", description = "Business rule violated")
    })
    @PostMapping
    public ResponseEntity<EmployeeResponse> createEmployee(@Valid @RequestBody CreateEmployeeRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(employeeService.createEmployee(request));
    }

    @Operation(summary = "List active employees", description = "Paged, optionally filtered by department and name/email")
    @GetMapping
    public ResponseEntity<Page<EmployeeResponse>> getEmployees(
            @RequestParam(required = false) UUID departmentId,
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        Pageable pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), 100),
                Sort.by(Sort.Direction.ASC, "name"));
        return ResponseEntity.ok(employeeService.getEmployees(departmentId, search, pageable));
    }

    @Operation(summary = "Search employees", description = "Queries the employee search index")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Matching employees"),
            @ApiResponse(responseCode = "400", description = "Query shorter than 2 characters or bad limit")
    })
    @GetMapping("/search")
    public ResponseEntity<List<EmployeeDocument>> searchEmployees(
            @RequestParam("q") String query,
            @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(employeeService.searchEmployees(query, limit));
    }

    @Operation(summary = "Rebuild the search index", description = "Clears the index and reloads every active employee")
    @PostMapping("/search/reindex")
    public ResponseEntity<ReindexResult> reindexSearch() {
        return ResponseEntity.ok(employeeService.reindexSearch());
    }

    @Operation(summary = "Get an employee")
    @GetMapping("/{employeeId}")
    public ResponseEntity<EmployeeResponse> getEmployee(@PathVariable UUID employeeId) {
        return ResponseEntity.ok(employeeService.getEmployee(employeeId));
    }

    @Operation(summary = "Update an employee", description = "Fields left out keep their current value")
    @PutMapping("/{employeeId}")
    public ResponseEntity<EmployeeResponse> updateEmployee(
            @PathVariable UUID employeeId,
            @Valid @RequestBody UpdateEmployeeRequest request) {
        return ResponseEntity.ok(employeeService.updateEmployee(employeeId, request));
    }

    @Operation(summary = "Delete an employee", description = "Soft delete, time entries are kept")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "204", description = "Employee deleted"),
            @ApiResponse(responseCode = "404", description = "Employee not found")
    })
    @DeleteMapping("/{employeeId}")
    public ResponseEntity<Void> deleteEmployee(@PathVariable UUID employeeId) {
        employeeService.deleteEmployee(employeeId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Restore a deleted employee")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Employee restored"),
            @ApiResponse(responseCode = "404", description = "No deleted employee with that ID"),
            @ApiResponse(responseCode = "409", description = "Email taken by another active employee")
    })
    @PostMapping("/{employeeId}/restore")
    public ResponseEntity<EmployeeResponse> restoreEmployee(@PathVariable UUID employeeId) {
        return ResponseEntity.ok(employeeService.restoreEmployee(employeeId));
    }
}

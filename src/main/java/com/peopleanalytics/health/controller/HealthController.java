package com.peopleanalytics.health.controller;

import com.peopleanalytics.health.dto.HealthResponse;
import com.peopleanalytics.health.service.HealthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
@Tag(name = "Health", description = "Dependency status")
public class HealthController {

    private final HealthService healthService;

    @Operation(summary = "Check dependencies", description = "Database, Redis and the import worker pool")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "All dependencies up"),
            @ApiResponse(responseCode = "503", description = "At least one dependency down")
    })
    @GetMapping
    public ResponseEntity<HealthResponse> checkHealth() {
        log.debug("Health check requested");
        HealthResponse health = healthService.checkAll();
        return health.isHealthy()
                ? ResponseEntity.ok(health)
                : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(health);
    }
}

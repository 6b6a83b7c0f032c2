package com.peopleanalytics.dashboard.controller;

import com.peopleanalytics.dashboard.dto.response.Summary;
import com.peopleanalytics.dashboard.model.DateRange;
import com.peopleanalytics.dashboard.model.SummaryScope;
import com.peopleanalytics.dashboard.service.SummaryService;
import com.peopleanalytics.exception.ResourceNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = DashboardController.class)
class DashboardControllerTest {

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2024-01-20T09:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SummaryService summaryService;

    @Test
    void shouldSummarizeFirmForCurrentMonthByDefault() throws Exception {
        // Arrange
        DateRange expected = new DateRange(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 20));
        when(summaryService.summarize(SummaryScope.FIRM, null, expected)).thenReturn(summary(expected));

        // Act & Assert
        mockMvc.perform(get("/api/v1/dashboard/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scope").value("FIRM"))
                .andExpect(jsonPath("$.startDate").value("2024-01-01"))
                .andExpect(jsonPath("$.endDate").value("2024-01-20"))
                .andExpect(jsonPath("$.utilizationRate").value(0.6));
    }

    @Test
    void shouldRejectStartAfterEnd() throws Exception {
        // Act & Assert
        mockMvc.perform(get("/api/v1/dashboard/summary")
                        .param("startDate", "2024-02-01")
                        .param("endDate", "2024-01-01"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
        verifyNoInteractions(summaryService);
    }

    @Test
    void shouldReturnNotFoundForUnknownDepartment() throws Exception {
        // Arrange
        UUID departmentId = UUID.randomUUID();
        when(summaryService.summarize(eq(SummaryScope.DEPARTMENT), eq(departmentId), any()))
                .thenThrow(ResourceNotFoundException.of("Department", departmentId));

        // Act & Assert
        mockMvc.perform(get("/api/v1/dashboard/summary")
                        .param("scope", "DEPARTMENT")
                        .param("scopeId", departmentId.toString()))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldRejectUnknownScope() throws Exception {
        // Act & Assert
        mockMvc.perform(get("/api/v1/dashboard/summary").param("scope", "GALAXY"))
                .andExpect(status().isBadRequest());
    }

    private static Summary summary(DateRange range) {
        return new Summary(SummaryScope.FIRM, null, "Firm", range.start(), range.end(),
                new BigDecimal("100.00"), new BigDecimal("60.00"), new BigDecimal("40.00"),
                new BigDecimal("0.6000"), 12, List.of(), List.of(), 0, new BigDecimal("0.00"));
    }
}

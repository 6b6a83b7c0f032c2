package com.peopleanalytics.importjob.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "import_row_errors", indexes = {
        @Index(name = "idx_import_row_errors_job", columnList = "job_id, source_row")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ImportRowError {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(name = "source_row", nullable = false)
    private Integer rowNumber;

    @Column(name = "raw_data", columnDefinition = "TEXT")
    private String rawData;

    @Column(name = "error_code", nullable = false, length = 50)
    private String errorCode;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String message;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}

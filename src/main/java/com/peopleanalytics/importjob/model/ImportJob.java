package com.peopleanalytics.importjob.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "import_jobs", indexes = {
        @Index(name = "idx_import_jobs_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ImportJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ImportJobKind kind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ImportJobStatus status = ImportJobStatus.QUEUED;

    @Column(name = "file_name", length = 255)
    private String fileName;

    @Column(name = "file_size_bytes")
    private Long fileSizeBytes;

    // Unknown until the worker has parsed the file.
    @Column(name = "total_rows")
    private Integer totalRows;

    @Column(nullable = false)
    @Builder.Default
    private Integer succeeded = 0;

    @Column(nullable = false)
    @Builder.Default
    private Integer failed = 0;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    public int processedRows() {
        return (succeeded == null ? 0 : succeeded) + (failed == null ? 0 : failed);
    }
}

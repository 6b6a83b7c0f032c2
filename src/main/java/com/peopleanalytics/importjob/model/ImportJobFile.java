package com.peopleanalytics.importjob.model;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * Uploaded file kept next to its job so a worker can process the job from its id alone.
 */
@Entity
@Table(name = "import_job_files")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ImportJobFile {

    @Id
    @Column(name = "job_id")
    private UUID jobId;

    // Upper bound above the multipart limit.
    @Column(nullable = false, length = 20 * 1024 * 1024)
    private byte[] content;
}

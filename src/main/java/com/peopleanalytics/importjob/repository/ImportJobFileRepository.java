package com.peopleanalytics.importjob.repository;

import com.peopleanalytics.importjob.model.ImportJobFile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface ImportJobFileRepository extends JpaRepository<ImportJobFile, UUID> {
}
